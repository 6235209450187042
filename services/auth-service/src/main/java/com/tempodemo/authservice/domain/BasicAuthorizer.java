package com.tempodemo.authservice.domain;

import com.tempodemo.authservice.domain.AuthorizationDecision.AppendAction;
import com.tempodemo.authservice.domain.AuthorizationDecision.HeaderMutation;
import com.tempodemo.security.BasicCredentials;
import com.tempodemo.security.BasicCredentialsExtractor;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Decides whether a proxied request carries valid Basic credentials.
 *
 * <p>The password is checked first and the user is loaded second; the first failure ends the
 * check. Every failure becomes a {@link AuthorizationDecision.Deny}, nothing is thrown to the
 * caller.
 */
@Service
public class BasicAuthorizer {

    private static final Logger log = LoggerFactory.getLogger(BasicAuthorizer.class);

    public static final String AUTHORIZATION_HEADER = "authorization";
    public static final String USER_INFO_HEADER = "x-user-info";
    public static final String BASIC_AUTH_REQUIRED = "Basic authentication required";

    private final UserStore userStore;

    public BasicAuthorizer(UserStore userStore) {
        this.userStore = userStore;
    }

    /**
     * @param headers request headers with lower-case names
     */
    public AuthorizationDecision check(Map<String, String> headers) {
        Optional<BasicCredentials> credentials =
                BasicCredentialsExtractor.extract(headers.get(AUTHORIZATION_HEADER));
        if (credentials.isEmpty()) {
            log.debug("Denied: missing or malformed Basic credentials");
            return AuthorizationDecision.deny(BASIC_AUTH_REQUIRED, Status.Code.UNAUTHENTICATED);
        }

        String username = credentials.get().username();
        try {
            userStore.checkUserPassword(username, credentials.get().password());
            User user = userStore.getUser(username);
            log.debug("Allowed user={}", user.username());
            return AuthorizationDecision.allow(
                    new HeaderMutation(
                            USER_INFO_HEADER, user.username(), AppendAction.APPEND_IF_EXISTS_OR_ADD));
        } catch (StatusRuntimeException e) {
            Status status = e.getStatus();
            String reason =
                    status.getDescription() != null
                            ? status.getDescription()
                            : status.getCode().name();
            log.debug("Denied user={} code={} reason={}", username, status.getCode(), reason);
            return AuthorizationDecision.deny(reason, status.getCode());
        }
    }
}
