package offramp.core.model.auth;

import java.util.Set;

/**
 * An admin API key that passed validation.
 *
 * @param name        the configured name of the key, used as principal
 * @param permissions permission values granted to the key
 */
public record ApiKey(String name, Set<String> permissions) {

    public ApiKey {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("API key name cannot be null or blank");
        }
        permissions = permissions != null ? Set.copyOf(permissions) : Set.of();
    }
}
