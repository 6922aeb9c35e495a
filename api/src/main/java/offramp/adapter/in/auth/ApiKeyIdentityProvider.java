package offramp.adapter.in.auth;

import java.security.Principal;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.security.AuthenticationFailedException;
import io.quarkus.security.StringPermission;
import io.quarkus.security.identity.AuthenticationRequestContext;
import io.quarkus.security.identity.IdentityProvider;
import io.quarkus.security.identity.SecurityIdentity;
import io.quarkus.security.runtime.QuarkusSecurityIdentity;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import offramp.core.model.auth.ApiKey;
import offramp.core.port.out.Metrics;
import offramp.core.service.auth.ApiKeyService;

/**
 * Quarkus identity provider that validates admin API keys.
 *
 * <p>Each permission of the key becomes both a role and a
 * {@link StringPermission}, so {@code @RolesAllowed} and
 * {@code @PermissionsAllowed} checks see the same grants.
 */
@ApplicationScoped
public class ApiKeyIdentityProvider implements IdentityProvider<ApiKeyAuthenticationRequest> {

    private static final Logger LOG = Logger.getLogger(ApiKeyIdentityProvider.class);

    private final ApiKeyService apiKeyService;
    private final Metrics metrics;

    @Inject
    public ApiKeyIdentityProvider(ApiKeyService apiKeyService, Metrics metrics) {
        this.apiKeyService = apiKeyService;
        this.metrics = metrics;
    }

    @Override
    public Class<ApiKeyAuthenticationRequest> getRequestType() {
        return ApiKeyAuthenticationRequest.class;
    }

    @Override
    public Uni<SecurityIdentity> authenticate(
            ApiKeyAuthenticationRequest request, AuthenticationRequestContext context) {
        return Uni.createFrom().item(() -> apiKeyService
                .validate(request.getApiKey())
                .map(this::buildIdentity)
                .orElseThrow(() -> {
                    LOG.debug("Rejected admin request with an unknown API key");
                    metrics.recordAuthFailure("invalid_key");
                    return new AuthenticationFailedException("Invalid API key");
                }));
    }

    private SecurityIdentity buildIdentity(ApiKey apiKey) {
        final var builder = QuarkusSecurityIdentity.builder()
                .setPrincipal(new ApiKeyPrincipal(apiKey.name()))
                .addRoles(apiKey.permissions());

        for (final var permission : apiKey.permissions()) {
            builder.addPermission(new StringPermission(permission));
        }

        return builder.build();
    }

    /**
     * Principal representing an authenticated admin API key.
     */
    public static class ApiKeyPrincipal implements Principal {
        private final String name;

        public ApiKeyPrincipal(String name) {
            this.name = name;
        }

        @Override
        public String getName() {
            return name;
        }
    }
}
