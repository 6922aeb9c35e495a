package offramp.adapter.in.problem;

import java.time.Duration;

import jakarta.ws.rs.core.Response.Status;

import io.quarkiverse.resteasy.problem.HttpProblem;

import offramp.core.model.ratelimit.RateLimitResult;

/**
 * RFC 7807 Problem Details factory for off-ramp errors.
 *
 * <p>Provides static factory methods that create {@link HttpProblem} instances
 * from quarkus-resteasy-problem for consistent error responses.
 */
public final class OfframpProblem {

    private OfframpProblem() {
        // Utility class - prevent instantiation
    }

    // ========== Rate Limiting ==========

    /**
     * Problem for a rate limit denial. Carries {@code message} and, when the
     * progressive delay stage assigned one, {@code attempt}.
     */
    public static HttpProblem tooManyRequests(RateLimitResult result) {
        final var builder = HttpProblem.builder()
                .withTitle("Too Many Requests")
                .withStatus(Status.TOO_MANY_REQUESTS)
                .withDetail(result.message())
                .with("message", result.message());
        if (result.hasAttempt()) {
            builder.with("attempt", result.attempt());
        }
        if (result.hasRetryAfter()) {
            builder.with("retryAfter", result.retryAfterSeconds());
        }
        return builder.build();
    }

    public static HttpProblem rateLimiterMisconfigured(String detail) {
        return HttpProblem.builder()
                .withTitle("Internal Server Error")
                .withStatus(Status.INTERNAL_SERVER_ERROR)
                .withDetail("Rate limiter configuration error: " + detail)
                .build();
    }

    // ========== Authentication Errors ==========

    public static HttpProblem accountLocked(Duration lockoutDuration) {
        return HttpProblem.builder()
                .withTitle("Account Locked")
                .withStatus(Status.FORBIDDEN)
                .withDetail("Too many failed attempts. Account locked for %d minutes"
                        .formatted(lockoutDuration.toMinutes()))
                .build();
    }

    // ========== Conflict Errors ==========

    public static HttpProblem conflict(String detail) {
        return HttpProblem.builder()
                .withTitle("Conflict")
                .withStatus(Status.CONFLICT)
                .withDetail(detail)
                .build();
    }

    // ========== Not Found Errors ==========

    public static HttpProblem notFound(String detail) {
        return HttpProblem.builder()
                .withTitle("Not Found")
                .withStatus(Status.NOT_FOUND)
                .withDetail(detail)
                .build();
    }

    // ========== Server Errors ==========

    public static HttpProblem serviceUnavailable(String detail) {
        return HttpProblem.builder()
                .withTitle("Service Unavailable")
                .withStatus(Status.SERVICE_UNAVAILABLE)
                .withDetail(detail)
                .build();
    }

    public static HttpProblem internalError(String detail) {
        return HttpProblem.builder()
                .withTitle("Internal Server Error")
                .withStatus(Status.INTERNAL_SERVER_ERROR)
                .withDetail(detail)
                .build();
    }
}
