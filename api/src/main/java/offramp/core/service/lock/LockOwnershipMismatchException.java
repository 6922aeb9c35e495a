package offramp.core.service.lock;

/**
 * A release was attempted with a token that does not own the lock, typically
 * because the caller's lock expired and another holder acquired it since.
 * The lock is left untouched.
 */
public class LockOwnershipMismatchException extends LockException {

    public LockOwnershipMismatchException(String category, String resourceId) {
        super("Lock ownership mismatch: %s/%s".formatted(category, resourceId), category, resourceId);
    }
}
