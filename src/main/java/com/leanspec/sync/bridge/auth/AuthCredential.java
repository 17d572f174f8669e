package com.leanspec.sync.bridge.auth;

import org.springframework.http.HttpHeaders;

/**
 * A single request header carrying either the shared API key or a bearer token.
 */
public record AuthCredential(String headerName, String headerValue) {

    public static final String API_KEY_HEADER = "x-api-key";

    public static AuthCredential apiKey(String key) {
        return new AuthCredential(API_KEY_HEADER, key);
    }

    public static AuthCredential bearer(String token) {
        return new AuthCredential(HttpHeaders.AUTHORIZATION, "Bearer " + token);
    }

    public void applyTo(HttpHeaders headers) {
        headers.set(headerName, headerValue);
    }

    @Override
    public String toString() {
        return "AuthCredential[" + headerName + "=***]";
    }
}
