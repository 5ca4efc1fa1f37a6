package io.rosterstore.core;

/**
 * Base class for roster store failures.
 *
 * <p>A caller that receives one of these from a mutating operation must treat the roster as
 * unchanged: stores roll back before throwing.
 */
public abstract class RosterStoreException extends RuntimeException {

    protected RosterStoreException(String message) {
        super(message);
    }

    protected RosterStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when a store is opened without a backing location.
     */
    public static class NotConfigured extends RosterStoreException {
        public NotConfigured(String message) {
            super(message);
        }
    }

    /**
     * Raised when the underlying engine fails. The message names the failing operation.
     */
    public static class StorageFailure extends RosterStoreException {
        public StorageFailure(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when an address cannot be resolved to, or allocated as, an identity.
     */
    public static class IdentityResolutionFailure extends RosterStoreException {
        public IdentityResolutionFailure(String message) {
            super(message);
        }

        public IdentityResolutionFailure(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when a transaction finds a precondition violated, e.g. an expected row is missing.
     */
    public static class InconsistentState extends RosterStoreException {
        public InconsistentState(String message) {
            super(message);
        }
    }
}
