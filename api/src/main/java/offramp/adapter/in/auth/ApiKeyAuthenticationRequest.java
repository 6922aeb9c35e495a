package offramp.adapter.in.auth;

import io.quarkus.security.identity.request.BaseAuthenticationRequest;

/**
 * Authentication request carrying an admin API key.
 *
 * <p>Passed from {@link ApiKeyAuthenticationMechanism} to {@link ApiKeyIdentityProvider}.
 */
public class ApiKeyAuthenticationRequest extends BaseAuthenticationRequest {

    private final String apiKey;

    public ApiKeyAuthenticationRequest(String apiKey) {
        this.apiKey = apiKey;
    }

    /**
     * Returns the plaintext API key to validate.
     *
     * @return the API key
     */
    public String getApiKey() {
        return apiKey;
    }
}
