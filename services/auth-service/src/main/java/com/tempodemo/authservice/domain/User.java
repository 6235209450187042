package com.tempodemo.authservice.domain;

/**
 * A stored user as seen by the authorization check. The password never leaves the store.
 *
 * @param id database identifier
 * @param username unique, case-sensitive login name
 */
public record User(long id, String username) {}
