package org.tanzu.vcenterperf.error;

/** Caller-supplied arguments failed their preconditions. */
public class ValidationException extends VCenterApiException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION, message, cause);
    }
}
