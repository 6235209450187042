package com.tempodemo.authservice.domain;

/**
 * Read-only access to stored credentials.
 *
 * <p>Failures are reported as {@link io.grpc.StatusRuntimeException} with:
 *
 * <ul>
 *   <li>{@code NOT_FOUND} "not found" when no row exists for the username
 *   <li>{@code UNAUTHENTICATED} "invalid password" when the password does not match
 *   <li>{@code CANCELLED} or {@code DEADLINE_EXCEEDED} when the calling context ends first
 *   <li>{@code INTERNAL} "read from database" for any other storage failure
 * </ul>
 *
 * <p>Each operation performs exactly one round trip and never writes.
 */
public interface UserStore {

    /**
     * Looks up the user by exact username.
     *
     * @throws io.grpc.StatusRuntimeException as described on the interface
     */
    User getUser(String username);

    /**
     * Verifies that {@code password} equals the stored password for {@code username}.
     *
     * @throws io.grpc.StatusRuntimeException as described on the interface
     */
    void checkUserPassword(String username, String password);
}
