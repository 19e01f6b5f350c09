package com.ofdtext.backend.security;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

/**
 * Username/password pair taken from an "Authorization: Basic ..." header.
 */
public record BasicCredentials(String username, String password) {

    private static final String PREFIX = "basic ";

    /**
     * Empty when the header is absent, not Basic, or not valid base64 "user:password".
     */
    public static Optional<BasicCredentials> fromAuthorizationHeader(String header) {
        if (header == null || header.length() <= PREFIX.length()) return Optional.empty();
        if (!header.regionMatches(true, 0, PREFIX, 0, PREFIX.length())) return Optional.empty();

        String decoded;
        try {
            decoded = new String(Base64.getDecoder().decode(header.substring(PREFIX.length()).trim()), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }

        int colon = decoded.indexOf(':');
        if (colon < 0) return Optional.empty();
        return Optional.of(new BasicCredentials(decoded.substring(0, colon), decoded.substring(colon + 1)));
    }

    @Override
    public String toString() {
        return "BasicCredentials[username=" + username + ", password=***]";
    }
}
