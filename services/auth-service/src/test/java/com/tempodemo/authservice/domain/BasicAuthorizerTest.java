package com.tempodemo.authservice.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.tempodemo.authservice.domain.AuthorizationDecision.Allow;
import com.tempodemo.authservice.domain.AuthorizationDecision.AppendAction;
import com.tempodemo.authservice.domain.AuthorizationDecision.Deny;
import com.tempodemo.authservice.domain.AuthorizationDecision.HeaderMutation;
import com.tempodemo.security.BasicCredentialsExtractor;
import io.grpc.Status;
import java.util.Base64;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/** Unit tests for {@link BasicAuthorizer} against a mocked {@link UserStore}. */
@ExtendWith(MockitoExtension.class)
@DisplayName("BasicAuthorizer")
class BasicAuthorizerTest {

    private static final String ALICE_SECRET = "Basic YWxpY2U6c2VjcmV0";

    @Mock private UserStore userStore;

    private BasicAuthorizer authorizer;

    @BeforeEach
    void setUp() {
        authorizer = new BasicAuthorizer(userStore);
    }

    private static Map<String, String> authorization(String value) {
        return Map.of("authorization", value, ":path", "/test");
    }

    private static void assertBasicRequired(AuthorizationDecision decision) {
        assertThat(decision).isInstanceOf(Deny.class);
        Deny deny = (Deny) decision;
        assertThat(deny.httpStatus()).isEqualTo(401);
        assertThat(deny.reason()).isEqualTo("Basic authentication required");
        assertThat(deny.failureKind()).isEqualTo(Status.Code.UNAUTHENTICATED);
    }

    @Nested
    @DisplayName("malformed credentials")
    class MalformedCredentials {

        @Test
        @DisplayName("denies a request without authorization header")
        void missingHeader() {
            assertBasicRequired(authorizer.check(Map.of(":path", "/test")));
            verifyNoInteractions(userStore);
        }

        @Test
        @DisplayName("denies a Bearer token")
        void bearerToken() {
            assertBasicRequired(authorizer.check(authorization("Bearer xyz")));
            verifyNoInteractions(userStore);
        }

        @Test
        @DisplayName("denies invalid Base64")
        void invalidBase64() {
            assertBasicRequired(authorizer.check(authorization("Basic !!!notbase64!!!")));
            verifyNoInteractions(userStore);
        }

        @Test
        @DisplayName("denies unpadded Base64 without touching the store")
        void unpaddedBase64() {
            // alice:secretx without its trailing "=="
            assertBasicRequired(authorizer.check(authorization("Basic YWxpY2U6c2VjcmV0eA")));
            verifyNoInteractions(userStore);
        }

        @Test
        @DisplayName("denies credentials that are not valid UTF-8 without touching the store")
        void invalidUtf8() {
            byte[] raw = {'a', 'l', 'i', 'c', 'e', ':', 'p', (byte) 0xFF};

            assertBasicRequired(
                    authorizer.check(
                            authorization("Basic " + Base64.getEncoder().encodeToString(raw))));
            verifyNoInteractions(userStore);
        }

        @Test
        @DisplayName("denies a credential with more than one colon without touching the store")
        void extraColon() {
            assertBasicRequired(
                    authorizer.check(authorization(BasicCredentialsExtractor.encode("alice", "pa:ss"))));
            verifyNoInteractions(userStore);
        }

        @Test
        @DisplayName("ignores a header with a different case")
        void upperCaseHeaderName() {
            assertBasicRequired(authorizer.check(Map.of("Authorization", ALICE_SECRET)));
        }
    }

    @Nested
    @DisplayName("valid credentials")
    class ValidCredentials {

        @Test
        @DisplayName("allows a matching pair and adds x-user-info")
        void allowsMatchingPair() {
            when(userStore.getUser("alice")).thenReturn(new User(1, "alice"));

            AuthorizationDecision decision = authorizer.check(authorization(ALICE_SECRET));

            assertThat(decision).isInstanceOf(Allow.class);
            assertThat(((Allow) decision).headers())
                    .containsExactly(
                            new HeaderMutation(
                                    "x-user-info", "alice", AppendAction.APPEND_IF_EXISTS_OR_ADD));
            var order = inOrder(userStore);
            order.verify(userStore).checkUserPassword("alice", "secret");
            order.verify(userStore).getUser("alice");
        }

        @Test
        @DisplayName("yields the same decision for the same input")
        void idempotent() {
            when(userStore.getUser("alice")).thenReturn(new User(1, "alice"));

            var first = authorizer.check(authorization(ALICE_SECRET));
            var second = authorizer.check(authorization(ALICE_SECRET));

            assertThat(second).isEqualTo(first);
        }
    }

    @Nested
    @DisplayName("store failures")
    class StoreFailures {

        @Test
        @DisplayName("denies a wrong password and skips the user lookup")
        void wrongPassword() {
            doThrow(Status.UNAUTHENTICATED.withDescription("invalid password").asRuntimeException())
                    .when(userStore)
                    .checkUserPassword("alice", "secret");

            AuthorizationDecision decision = authorizer.check(authorization(ALICE_SECRET));

            assertThat(decision).isEqualTo(AuthorizationDecision.deny("invalid password", Status.Code.UNAUTHENTICATED));
            verify(userStore, never()).getUser(anyString());
        }

        @Test
        @DisplayName("denies an unknown user with the lookup reason")
        void unknownUser() {
            doThrow(Status.NOT_FOUND.withDescription("not found").asRuntimeException())
                    .when(userStore)
                    .checkUserPassword("alice", "secret");

            Deny deny = (Deny) authorizer.check(authorization(ALICE_SECRET));

            assertThat(deny.reason()).isEqualTo("not found");
            assertThat(deny.failureKind()).isEqualTo(Status.Code.NOT_FOUND);
            assertThat(deny.httpStatus()).isEqualTo(401);
        }

        @Test
        @DisplayName("surfaces a user lookup timeout as DEADLINE_EXCEEDED")
        void lookupTimeout() {
            when(userStore.getUser("alice"))
                    .thenThrow(Status.DEADLINE_EXCEEDED.withDescription("read from database").asRuntimeException());

            Deny deny = (Deny) authorizer.check(authorization(ALICE_SECRET));

            assertThat(deny.failureKind()).isEqualTo(Status.Code.DEADLINE_EXCEEDED);
            assertThat(deny.failureKind()).isNotEqualTo(Status.Code.UNAUTHENTICATED);
        }

        @Test
        @DisplayName("collapses an internal store error into a 401 without backend text")
        void internalError() {
            doThrow(Status.INTERNAL
                            .withDescription("read from database")
                            .withCause(new IllegalStateException("FATAL: password authentication failed"))
                            .asRuntimeException())
                    .when(userStore)
                    .checkUserPassword("alice", "secret");

            Deny deny = (Deny) authorizer.check(authorization(ALICE_SECRET));

            assertThat(deny.httpStatus()).isEqualTo(401);
            assertThat(deny.reason()).isEqualTo("read from database");
            assertThat(deny.failureKind()).isEqualTo(Status.Code.INTERNAL);
        }

        @Test
        @DisplayName("falls back to the status code name when the store gives no description")
        void noDescription() {
            doThrow(Status.CANCELLED.asRuntimeException())
                    .when(userStore)
                    .checkUserPassword("alice", "secret");

            Deny deny = (Deny) authorizer.check(authorization(ALICE_SECRET));

            assertThat(deny.reason()).isEqualTo("CANCELLED");
            assertThat(deny.failureKind()).isEqualTo(Status.Code.CANCELLED);
        }
    }
}
