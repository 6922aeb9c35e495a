package offramp.core.model.ratelimit;

/**
 * Fixed-window cap on the total traffic of one subject.
 *
 * @param count maximum requests per window
 * @param windowSeconds window length, also the counter's expiry
 */
public record GlobalCapPolicy(long count, long windowSeconds) {

    public GlobalCapPolicy {
        if (count < 1) {
            throw new IllegalArgumentException("global count must be at least 1");
        }
        if (windowSeconds <= 0) {
            throw new IllegalArgumentException("global windowSeconds must be positive");
        }
    }
}
