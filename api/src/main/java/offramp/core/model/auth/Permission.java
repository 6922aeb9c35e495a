package offramp.core.model.auth;

/**
 * Permissions an admin API key can carry.
 *
 * <p>The {@code *_VALUE} constants are compile-time copies of the enum
 * values for use in {@code @PermissionsAllowed} annotations.
 */
public enum Permission {

    /** Full access to every admin endpoint. */
    ADMIN("admin"),

    /** Read lockout status. */
    LOCKOUTS_READ("lockouts.read"),

    /** Record, reset and clear failed attempts and lockouts. */
    LOCKOUTS_WRITE("lockouts.write");

    /** Admin permission value. */
    public static final String ADMIN_VALUE = "admin";
    /** Lockouts read permission value. */
    public static final String LOCKOUTS_READ_VALUE = "lockouts.read";
    /** Lockouts write permission value. */
    public static final String LOCKOUTS_WRITE_VALUE = "lockouts.write";

    private final String value;

    Permission(String value) {
        this.value = value;
    }

    /**
     * Get the string value of this permission.
     *
     * @return the permission string
     */
    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
