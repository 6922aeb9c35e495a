package offramp.core.port.out;

/**
 * The key-value store could not complete an operation.
 *
 * <p>Raised for connection failures, server errors and timeouts. Callers
 * outside the store adapters see only this type, never client-specific
 * exceptions.
 */
public class StoreException extends RuntimeException {

    private final String operation;

    public StoreException(String operation, String message) {
        super(message);
        this.operation = operation;
    }

    public StoreException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    /**
     * Name of the store operation that failed.
     */
    public String operation() {
        return operation;
    }
}
