package offramp.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import offramp.core.port.out.StoreException;
import offramp.core.service.lock.LockAlreadyHeldException;
import offramp.core.service.lock.LockOwnershipMismatchException;

/**
 * Global exception mappers for converting exceptions to RFC 7807 Problem Details.
 *
 * <p>Store failures and invalid arguments never expose their messages to the
 * client; the cause is only logged. Problems raised deliberately for the
 * client are {@link OfframpProblem} instances and keep their detail.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";
    static final String INVALID_REQUEST_DETAIL = "The request could not be processed";

    @ServerExceptionMapper
    public Response mapStoreException(StoreException e) {
        LOG.errorv(e, "Store unavailable during {0}", e.operation());
        return toResponse(OfframpProblem.serviceUnavailable("Service temporarily unavailable, please retry"));
    }

    @ServerExceptionMapper
    public Response mapLockAlreadyHeld(LockAlreadyHeldException e) {
        LOG.debugv("Lock contention: {0}", e.getMessage());
        return toResponse(OfframpProblem.conflict("Resource is being processed, please retry"));
    }

    @ServerExceptionMapper
    public Response mapLockOwnershipMismatch(LockOwnershipMismatchException e) {
        LOG.errorv("Lock lost before release: {0}", e.getMessage());
        return toResponse(OfframpProblem.internalError("Processing did not complete safely"));
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv(e, "Rejected invalid argument: {0}", e.getMessage());
        return toResponse(HttpProblem.builder()
                .withTitle("Bad Request")
                .withStatus(Response.Status.BAD_REQUEST)
                .withDetail(INVALID_REQUEST_DETAIL)
                .build());
    }

    static Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
