package offramp.adapter.in.rest;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.quarkus.security.PermissionsAllowed;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import offramp.adapter.in.problem.OfframpProblem;
import offramp.core.model.auth.Permission;
import offramp.core.service.auth.AccountLockoutService;

/**
 * REST resource for account lockout administration.
 *
 * <p>Provides endpoints for:
 * <ul>
 *   <li>Checking and clearing the lockout of an email within a subject (operators)</li>
 *   <li>Recording and resetting failed verifications (OTP verification flow)</li>
 * </ul>
 *
 * <p>Every endpoint requires an admin API key: reads need {@code lockouts.read},
 * changes need {@code lockouts.write}, and {@code admin} grants both.
 */
@Path("/admin/lockouts")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class LockoutResource {

    private static final Logger LOG = Logger.getLogger(LockoutResource.class);

    private final AccountLockoutService lockoutService;
    private final Clock clock;

    public LockoutResource(AccountLockoutService lockoutService, Clock clock) {
        this.lockoutService = lockoutService;
        this.clock = clock;
    }

    /**
     * Get the lockout status of an email.
     *
     * @param subject the subject, e.g. {@code otp}
     * @param email the account email
     * @return lockout status
     */
    @GET
    @PermissionsAllowed({Permission.LOCKOUTS_READ_VALUE, Permission.ADMIN_VALUE})
    @Path("/{subject}/{email}")
    public Uni<Response> getLockoutStatus(@PathParam("subject") String subject, @PathParam("email") String email) {
        return lockoutService.status(subject, email).map(status -> {
            final var response = new LinkedHashMap<String, Object>();
            response.put("subject", subject);
            response.put("email", email);
            response.put("locked", status.locked());
            response.put("failedAttempts", status.failedAttempts());
            response.put("maxAttempts", lockoutService.maxFailedAttempts());
            if (status.lockedAt() != null) {
                response.put("lockedAt", status.lockedAt().toString());
                response.put("lockoutExpires", status.lockedAt().plus(lockoutService.lockoutDuration()).toString());
            }
            response.put("checkedAt", Instant.now(clock).toString());
            return Response.ok(response).build();
        });
    }

    /**
     * Clear the lockout and failed attempts of an email.
     *
     * @param subject the subject
     * @param email the account email
     * @return 204 No Content on success, 404 if there was nothing to clear
     */
    @DELETE
    @PermissionsAllowed({Permission.LOCKOUTS_WRITE_VALUE, Permission.ADMIN_VALUE})
    @Path("/{subject}/{email}")
    public Uni<Response> clearLockout(@PathParam("subject") String subject, @PathParam("email") String email) {
        LOG.infof("Clearing lockout: subject=%s", subject);

        return lockoutService.clearLockout(subject, email).map(cleared -> {
            if (!cleared) {
                throw OfframpProblem.notFound("No lockout or failed attempts recorded");
            }
            return Response.noContent().build();
        });
    }

    /**
     * Record a failed verification, locking the account at the threshold.
     *
     * @param subject the subject
     * @param email the account email
     * @return attempt count and lock state
     */
    @POST
    @PermissionsAllowed({Permission.LOCKOUTS_WRITE_VALUE, Permission.ADMIN_VALUE})
    @Path("/{subject}/{email}/failed-attempts")
    public Uni<Response> recordFailedAttempt(
            @PathParam("subject") String subject, @PathParam("email") String email) {
        return lockoutService.isLocked(subject, email).flatMap(locked -> {
            if (locked) {
                return Uni.createFrom()
                        .<Response>failure(OfframpProblem.accountLocked(lockoutService.lockoutDuration()));
            }
            return lockoutService.recordFailedAttempt(subject, email).map(outcome -> Response.ok(Map.of(
                            "failedAttempts", outcome.attempts(),
                            "locked", outcome.locked(),
                            "maxAttempts", lockoutService.maxFailedAttempts()))
                    .build());
        });
    }

    /**
     * Reset failed verifications after a successful one.
     *
     * @param subject the subject
     * @param email the account email
     * @return 204 No Content
     */
    @DELETE
    @PermissionsAllowed({Permission.LOCKOUTS_WRITE_VALUE, Permission.ADMIN_VALUE})
    @Path("/{subject}/{email}/failed-attempts")
    public Uni<Response> resetFailedAttempts(
            @PathParam("subject") String subject, @PathParam("email") String email) {
        return lockoutService.resetFailedAttempts(subject, email).replaceWith(Response.noContent().build());
    }
}
