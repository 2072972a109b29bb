package io.oidcendpoint.message;

/**
 * Base class for problems found while decoding or verifying a protocol message.
 *
 * <p>{@link MissingRequiredAttribute}, {@link MissingRequiredValue} and {@link InvalidValue} are
 * protocol validation failures: the client sent something the message schema does not accept.
 * {@link DecodingFailed} means the wire form itself could not be read.
 */
public abstract class MessageException extends RuntimeException {

    protected MessageException(String message) {
        super(message);
    }

    protected MessageException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when a required parameter is absent.
     */
    public static class MissingRequiredAttribute extends MessageException {
        private final String parameter;

        public MissingRequiredAttribute(String parameter) {
            super("Missing required attribute '" + parameter + "'");
            this.parameter = parameter;
        }

        public String parameter() {
            return parameter;
        }
    }

    /**
     * Raised when a required parameter is present but empty.
     */
    public static class MissingRequiredValue extends MessageException {
        private final String parameter;

        public MissingRequiredValue(String parameter) {
            super("Missing value for required attribute '" + parameter + "'");
            this.parameter = parameter;
        }

        public String parameter() {
            return parameter;
        }
    }

    /**
     * Raised when a parameter value does not fit its declared type or a message level rule.
     */
    public static class InvalidValue extends MessageException {
        public InvalidValue(String message) {
            super(message);
        }
    }

    /**
     * Raised when a JSON document or a JWT cannot be decoded, decrypted or verified.
     */
    public static class DecodingFailed extends MessageException {
        public DecodingFailed(String message) {
            super(message);
        }

        public DecodingFailed(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
