package offramp.core.model.ratelimit;

/**
 * How a request is treated when the key-value store cannot be reached
 * while checking its rate limits.
 */
public enum StoreFailureMode {

    /** Forward the request unchecked. */
    OPEN,

    /** Reject the request with a server error. */
    CLOSED
}
