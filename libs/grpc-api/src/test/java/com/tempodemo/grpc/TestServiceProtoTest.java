package com.tempodemo.grpc;

import com.tempodemo.api.v1.RegisterRequest;
import com.tempodemo.api.v1.SayHelloRequest;
import com.tempodemo.api.v1.SayHelloResponse;
import com.tempodemo.api.v1.TestServiceGrpc;
import com.tempodemo.api.v1.User;
import io.grpc.MethodDescriptor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Verifies the generated contract from test_service.proto: the wire-level method names the proxy
 * routes on, and message defaults.
 */
@DisplayName("TestService Proto")
class TestServiceProtoTest {

    @Nested
    @DisplayName("Service descriptor")
    class ServiceDescriptor {

        @Test
        @DisplayName("should expose the api.v1.TestService service name")
        void shouldExposeServiceName() {
            assertThat(TestServiceGrpc.SERVICE_NAME).isEqualTo("api.v1.TestService");
        }

        @Test
        @DisplayName("should declare SayHello as a unary method")
        void shouldDeclareSayHelloUnary() {
            var method = TestServiceGrpc.getSayHelloMethod();

            assertThat(method.getFullMethodName()).isEqualTo("api.v1.TestService/SayHello");
            assertThat(method.getType()).isEqualTo(MethodDescriptor.MethodType.UNARY);
        }

        @Test
        @DisplayName("should declare Register returning a User")
        void shouldDeclareRegister() {
            var method = TestServiceGrpc.getRegisterMethod();

            assertThat(method.getFullMethodName()).isEqualTo("api.v1.TestService/Register");
            assertThat(method.getType()).isEqualTo(MethodDescriptor.MethodType.UNARY);
        }
    }

    @Nested
    @DisplayName("Messages")
    class Messages {

        @Test
        @DisplayName("should default names and text to empty strings")
        void shouldDefaultToEmptyStrings() {
            assertThat(SayHelloRequest.getDefaultInstance().getName()).isEmpty();
            assertThat(SayHelloResponse.getDefaultInstance().getText()).isEmpty();
        }

        @Test
        @DisplayName("should carry id and username on User")
        void shouldCarryUserFields() {
            var user = User.newBuilder().setId(42L).setUsername("alice").build();

            assertThat(user.getId()).isEqualTo(42L);
            assertThat(user.getUsername()).isEqualTo("alice");
        }

        @Test
        @DisplayName("should parse a serialized RegisterRequest")
        void shouldParseRegisterRequest() throws Exception {
            var request = RegisterRequest.newBuilder()
                    .setUsername("bob")
                    .setPassword("builder")
                    .build();

            var parsed = RegisterRequest.parseFrom(request.toByteArray());

            assertThat(parsed.getUsername()).isEqualTo("bob");
            assertThat(parsed.getPassword()).isEqualTo("builder");
        }
    }
}
