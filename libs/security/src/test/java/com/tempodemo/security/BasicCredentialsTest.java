package com.tempodemo.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BasicCredentials")
class BasicCredentialsTest {

    @Test
    @DisplayName("toString masks the password")
    void toStringMasksPassword() {
        var credentials = new BasicCredentials("alice", "secret");

        assertThat(credentials.toString())
                .contains("alice")
                .doesNotContain("secret");
    }

    @Test
    @DisplayName("rejects null components")
    void rejectsNulls() {
        assertThatThrownBy(() -> new BasicCredentials(null, "x"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BasicCredentials("x", null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
