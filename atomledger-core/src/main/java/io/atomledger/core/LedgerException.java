package io.atomledger.core;

/**
 * Base class for atomledger exceptions.
 *
 * <p>Provides a common hierarchy for model, codec and connection errors.
 * Subclasses are specific to the error condition and preserve the original cause when applicable.
 */
public abstract class LedgerException extends RuntimeException {

    protected LedgerException(String message) {
        super(message);
    }

    protected LedgerException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when an identifier cannot be built from the given value, bytes or text.
     */
    public static class MalformedIdentifier extends LedgerException {
        public MalformedIdentifier(String message) {
            super(message);
        }

        public MalformedIdentifier(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when a serializer tag (or a Java type) has no registered schema.
     */
    public static class UnknownType extends LedgerException {
        private final String tag;

        public UnknownType(String tag, String message) {
            super(message);
            this.tag = tag;
        }

        /**
         * The offending serializer tag, or {@code null} when the tag was absent.
         */
        public String tag() {
            return tag;
        }
    }

    /**
     * Raised when a wire value does not have the shape its schema requires.
     */
    public static class SchemaMismatch extends LedgerException {
        public SchemaMismatch(String message) {
            super(message);
        }

        public SchemaMismatch(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
