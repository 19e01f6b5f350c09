package com.ofdtext.backend.security;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

import org.springframework.stereotype.Component;

import com.ofdtext.backend.config.AuthProperties;

import lombok.RequiredArgsConstructor;

/**
 * Accepts exactly the username/password pair from {@link AuthProperties}.
 */
@Component
@RequiredArgsConstructor
public class ConfiguredCredentialsAuthGuard implements AuthGuard {

    private final AuthProperties authProperties;

    @Override
    public boolean check(BasicCredentials credentials) {
        if (credentials == null) return false;
        // Both compared in constant time, and always both, so timing does not reveal which one was wrong.
        boolean userMatches = constantTimeEquals(credentials.username(), authProperties.getUsername());
        boolean passwordMatches = constantTimeEquals(credentials.password(), authProperties.getPassword());
        return userMatches & passwordMatches;
    }

    private static boolean constantTimeEquals(String given, String expected) {
        if (given == null || expected == null) return false;
        return MessageDigest.isEqual(
                given.getBytes(StandardCharsets.UTF_8),
                expected.getBytes(StandardCharsets.UTF_8));
    }
}
