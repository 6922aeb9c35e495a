package offramp.core.model.ratelimit;

/**
 * Sub-limiters evaluated by the rate limit coordinator, in evaluation order.
 */
public enum LimitStage {
    EMAIL,
    IP,
    PROGRESSIVE_DELAY,
    GLOBAL
}
