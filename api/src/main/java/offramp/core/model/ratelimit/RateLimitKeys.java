package offramp.core.model.ratelimit;

/**
 * Store key layout for rate limit state.
 *
 * <p>All keys share the {@code rate-limit:{subject}:} prefix so that the
 * state of one subject never collides with another.
 */
public final class RateLimitKeys {

    private static final String PREFIX = "rate-limit:";

    private RateLimitKeys() {}

    public static String email(String subject, String email) {
        return PREFIX + subject + ":email:" + email;
    }

    public static String ip(String subject, String ip) {
        return PREFIX + subject + ":ip:" + ip;
    }

    public static String attempts(String subject, String identifier) {
        return PREFIX + subject + ":attempts:" + identifier;
    }

    public static String lastAttempt(String subject, String identifier) {
        return PREFIX + subject + ":last:" + identifier;
    }

    public static String global(String subject) {
        return PREFIX + subject + ":global";
    }
}
