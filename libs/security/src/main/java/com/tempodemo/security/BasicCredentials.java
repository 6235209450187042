package com.tempodemo.security;

/**
 * Username/password pair decoded from a single {@code Authorization: Basic} header.
 * <p>
 * Lives for one authorization decision and is never persisted. {@link #toString()} masks the
 * password so the record can appear in log statements and assertion messages.
 *
 * @param username the asserted username (may be empty, never null)
 * @param password the asserted cleartext password (may be empty, never null)
 */
public record BasicCredentials(String username, String password) {

    public BasicCredentials {
        if (username == null) {
            throw new IllegalArgumentException("username must not be null");
        }
        if (password == null) {
            throw new IllegalArgumentException("password must not be null");
        }
    }

    @Override
    public String toString() {
        return "BasicCredentials[username=" + username + ", password=****]";
    }
}
