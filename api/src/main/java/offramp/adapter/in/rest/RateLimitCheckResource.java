package offramp.adapter.in.rest;

import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;

import offramp.adapter.in.http.ClientIpExtractor;
import offramp.adapter.in.http.RateLimitInterceptor;
import offramp.adapter.in.http.RateLimitInterceptors;

/**
 * REST resource that lets collaborating services ask whether a request may proceed.
 *
 * <p>An OTP or withdrawal handler calls {@code POST /rate-limit/{subject}/check}
 * with the caller's email before doing any work. The answer is {@code 200}
 * with {@code allowed=true} when the request passes every limit, or the
 * {@code 429} problem produced by {@link RateLimitInterceptor} otherwise.
 * The client IP is the socket peer of this call, or the forwarded client
 * address when the peer is a trusted proxy.
 */
@Path("/rate-limit")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class RateLimitCheckResource {

    private final RateLimitInterceptors interceptors;
    private final ClientIpExtractor clientIpExtractor;

    public RateLimitCheckResource(RateLimitInterceptors interceptors, ClientIpExtractor clientIpExtractor) {
        this.interceptors = interceptors;
        this.clientIpExtractor = clientIpExtractor;
    }

    @POST
    @Path("/{subject}/check")
    @Consumes(MediaType.APPLICATION_JSON)
    public Uni<Response> check(
            @PathParam("subject") String subject, CheckRequest request, @Context HttpServerRequest httpRequest) {
        final var remoteAddress =
                httpRequest.remoteAddress() != null ? httpRequest.remoteAddress().host() : null;
        final var clientIp = clientIpExtractor.extract(httpRequest::getHeader, remoteAddress);

        final RateLimitInterceptor<CheckRequest> interceptor = interceptors.forSubject(subject, CheckRequest::email);
        return interceptor.intercept(clientIp, request, () -> Uni.createFrom()
                .item(Response.ok(Map.of("allowed", true, "subject", subject)).build()));
    }

    /**
     * Body of a check call.
     *
     * @param email the identifier being limited
     */
    public record CheckRequest(String email) {}
}
