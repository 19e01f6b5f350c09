package com.ofdtext.backend.exceptions;

/**
 * Client sent a payload the service cannot work with (missing or malformed field).
 */
public class BadRequestException extends RuntimeException {

    public BadRequestException(String message) {
        super(message);
    }
}
