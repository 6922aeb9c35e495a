package offramp.adapter.in.http;

import java.util.function.Function;
import java.util.function.Supplier;

import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import offramp.adapter.in.problem.OfframpProblem;
import offramp.core.model.ratelimit.RateLimitResult;
import offramp.core.model.ratelimit.StoreFailureMode;
import offramp.core.port.out.Metrics;
import offramp.core.port.out.StoreException;
import offramp.core.service.ratelimit.RateLimitCoordinator;

/**
 * Guards a request handler with the rate limits of one subject.
 *
 * <p>On denial the handler is never invoked and the caller receives
 * {@code 429 Too Many Requests} with a problem body carrying {@code message}
 * (and {@code attempt} when known) plus a {@code Retry-After} header when a
 * retry time is known. On allow the handler's response is returned unchanged.
 *
 * <p>A request without an identifier is a wiring error and answers
 * {@code 500}. When the store is unavailable the subject's
 * {@link StoreFailureMode} decides: {@code OPEN} forwards the request,
 * {@code CLOSED} propagates the {@link StoreException}.
 *
 * @param <T> the request type the identifier is extracted from
 */
public class RateLimitInterceptor<T> {

    private static final Logger LOG = Logger.getLogger(RateLimitInterceptor.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    private final RateLimitCoordinator coordinator;
    private final String subject;
    private final Function<T, String> identifierExtractor;
    private final StoreFailureMode storeFailureMode;
    private final Metrics metrics;

    public RateLimitInterceptor(
            RateLimitCoordinator coordinator,
            String subject,
            Function<T, String> identifierExtractor,
            StoreFailureMode storeFailureMode,
            Metrics metrics) {
        this.coordinator = coordinator;
        this.subject = subject;
        this.identifierExtractor = identifierExtractor;
        this.storeFailureMode = storeFailureMode;
        this.metrics = metrics;
    }

    /**
     * Check the request's limits and run the handler if allowed.
     *
     * @param clientIp the client IP
     * @param request the request the identifier is extracted from
     * @param handler produces the response of an allowed request
     * @return Uni with the handler's response or a rejection
     */
    public Uni<Response> intercept(String clientIp, T request, Supplier<Uni<Response>> handler) {
        final var identifier = request != null ? identifierExtractor.apply(request) : null;
        if (identifier == null || identifier.isBlank()) {
            LOG.errorv("Missing rate limit identifier for subject {0}", subject);
            return Uni.createFrom().item(problemResponse(OfframpProblem.rateLimiterMisconfigured(
                    "Missing identifier for subject '%s'".formatted(subject))));
        }

        return coordinator
                .checkLimit(subject, identifier, clientIp)
                .onFailure(StoreException.class)
                .recoverWithUni(this::onStoreFailure)
                .flatMap(result ->
                        result.allowed() ? handler.get() : Uni.createFrom().item(tooManyRequests(result)));
    }

    public String subject() {
        return subject;
    }

    public StoreFailureMode storeFailureMode() {
        return storeFailureMode;
    }

    private Uni<RateLimitResult> onStoreFailure(Throwable failure) {
        if (storeFailureMode == StoreFailureMode.OPEN) {
            LOG.warnv(
                    "Store unavailable, forwarding unchecked request for subject {0}: {1}",
                    subject, failure.getMessage());
            metrics.recordStoreFailOpen(subject);
            return Uni.createFrom().item(RateLimitResult.allow());
        }
        LOG.errorv("Store unavailable, rejecting request for subject {0}: {1}", subject, failure.getMessage());
        return Uni.createFrom().failure(failure);
    }

    static Response tooManyRequests(RateLimitResult result) {
        final var builder = Response.status(Response.Status.TOO_MANY_REQUESTS)
                .type(PROBLEM_JSON)
                .entity(OfframpProblem.tooManyRequests(result));
        if (result.hasRetryAfter()) {
            builder.header("Retry-After", result.retryAfterSeconds());
        }
        return builder.build();
    }

    private static Response problemResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
