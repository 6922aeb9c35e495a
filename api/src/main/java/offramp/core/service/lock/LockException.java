package offramp.core.service.lock;

/**
 * Base type for distributed lock failures.
 */
public abstract class LockException extends RuntimeException {

    private final String category;
    private final String resourceId;

    protected LockException(String message, String category, String resourceId) {
        super(message);
        this.category = category;
        this.resourceId = resourceId;
    }

    public String category() {
        return category;
    }

    public String resourceId() {
        return resourceId;
    }
}
