package org.tanzu.vcenterperf.error;

/**
 * Base type for all failures raised by the vSphere client.
 *
 * None of these are retried internally; retry policy belongs to the caller.
 * Validation and session failures are always raised before any network call.
 */
public abstract class VCenterApiException extends RuntimeException {

    private final ErrorKind kind;

    protected VCenterApiException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected VCenterApiException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Gets the error classification.
     * @return the kind of failure
     */
    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Re-raises this failure with a prefix describing the step that produced it,
     * keeping the original classification.
     *
     * @param context text prepended to the message
     * @return a new exception of the same kind
     */
    public VCenterApiException withContext(String context) {
        String message = context + ": " + getMessage();
        switch (kind) {
            case CONFIG:
                return new ConfigException(message, this);
            case VALIDATION:
                return new ValidationException(message, this);
            case SESSION:
                return new SessionException(message, this);
            case TRANSPORT:
                return new TransportException(message, this);
            default:
                return new ProtocolException(message, this);
        }
    }
}
