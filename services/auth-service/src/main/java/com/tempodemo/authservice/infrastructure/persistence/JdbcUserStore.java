package com.tempodemo.authservice.infrastructure.persistence;

import com.tempodemo.authservice.domain.User;
import com.tempodemo.authservice.domain.UserStore;
import com.tempodemo.observability.SpanHelper;
import com.tempodemo.security.PasswordMatcher;
import io.grpc.Context;
import io.grpc.Contexts;
import io.grpc.Deadline;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.opentelemetry.api.trace.SpanKind;
import java.sql.PreparedStatement;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementCreator;
import org.springframework.jdbc.core.RowMapper;

/**
 * {@link UserStore} over the {@code users} table.
 *
 * <p>Queries run on the calling thread and honor the current gRPC {@link Context}: a cancelled
 * context fails fast, and the remaining deadline becomes the statement query timeout.
 */
public class JdbcUserStore implements UserStore {

    static final String SELECT_USER = "SELECT id, username FROM users WHERE username = ?";
    static final String SELECT_PASSWORD = "SELECT password FROM users WHERE username = ?";

    static final String NOT_FOUND = "not found";
    static final String INVALID_PASSWORD = "invalid password";
    static final String READ_FAILED = "read from database";

    private static final String SPAN_NAME = "SELECT users";
    private static final Map<String, String> SPAN_ATTRIBUTES =
            Map.of("db.system", "postgresql", "db.operation", "SELECT", "db.sql.table", "users");

    private static final RowMapper<User> USER_ROW =
            (rs, rowNum) -> new User(rs.getLong("id"), rs.getString("username"));
    private static final RowMapper<String> PASSWORD_ROW = (rs, rowNum) -> rs.getString("password");

    private final JdbcTemplate jdbcTemplate;
    private final SpanHelper spanHelper;

    public JdbcUserStore(JdbcTemplate jdbcTemplate, SpanHelper spanHelper) {
        this.jdbcTemplate = jdbcTemplate;
        this.spanHelper = spanHelper;
    }

    @Override
    public User getUser(String username) {
        return queryOne(SELECT_USER, username, USER_ROW);
    }

    @Override
    public void checkUserPassword(String username, String password) {
        String stored = queryOne(SELECT_PASSWORD, username, PASSWORD_ROW);
        if (!PasswordMatcher.matches(password, stored)) {
            throw Status.UNAUTHENTICATED.withDescription(INVALID_PASSWORD).asRuntimeException();
        }
    }

    private <T> T queryOne(String sql, String username, RowMapper<T> rowMapper) {
        Context context = Context.current();
        if (context.isCancelled()) {
            throw cancelled(context, null);
        }
        return spanHelper.traced(
                SPAN_NAME,
                SpanKind.CLIENT,
                SPAN_ATTRIBUTES,
                () -> {
                    List<T> rows;
                    try {
                        rows = jdbcTemplate.query(statement(sql, username, context), rowMapper);
                    } catch (QueryTimeoutException e) {
                        throw Status.DEADLINE_EXCEEDED
                                .withDescription(READ_FAILED)
                                .withCause(e)
                                .asRuntimeException();
                    } catch (DataAccessException e) {
                        if (context.isCancelled()) {
                            throw cancelled(context, e);
                        }
                        throw Status.INTERNAL
                                .withDescription(READ_FAILED)
                                .withCause(e)
                                .asRuntimeException();
                    }
                    if (rows.isEmpty()) {
                        throw Status.NOT_FOUND.withDescription(NOT_FOUND).asRuntimeException();
                    }
                    return rows.get(0);
                });
    }

    /** Binds the username and caps the statement at the time left on the deadline. */
    static PreparedStatementCreator statement(String sql, String username, Context context) {
        return connection -> {
            PreparedStatement ps = connection.prepareStatement(sql);
            ps.setString(1, username);
            Deadline deadline = context.getDeadline();
            if (deadline != null) {
                ps.setQueryTimeout(queryTimeoutSeconds(deadline));
            }
            return ps;
        };
    }

    static int queryTimeoutSeconds(Deadline deadline) {
        long millis = deadline.timeRemaining(TimeUnit.MILLISECONDS);
        long seconds = (millis + 999) / 1000;
        return (int) Math.min(Integer.MAX_VALUE, Math.max(1, seconds));
    }

    private static StatusRuntimeException cancelled(Context context, Throwable cause) {
        Status status = Contexts.statusFromCancelled(context);
        if (status == null) {
            status = Status.CANCELLED.withDescription("context cancelled");
        }
        return status.withCause(cause).asRuntimeException();
    }
}
