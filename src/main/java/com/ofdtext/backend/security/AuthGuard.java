package com.ofdtext.backend.security;

/**
 * Decides whether a request carrying these credentials may call protected endpoints.
 */
public interface AuthGuard {

    boolean check(BasicCredentials credentials);
}
