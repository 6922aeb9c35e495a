package offramp.core.service.lock;

/**
 * Another holder owns the lock. Acquisition never waits, so callers decide
 * whether to retry or give up.
 */
public class LockAlreadyHeldException extends LockException {

    public LockAlreadyHeldException(String category, String resourceId) {
        super("Lock already held: %s/%s".formatted(category, resourceId), category, resourceId);
    }
}
