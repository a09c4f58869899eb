package org.tanzu.vcenterperf.error;

/** Raised when no authenticated session is available for an operation. */
public class SessionException extends VCenterApiException {

    public SessionException(String message) {
        super(ErrorKind.SESSION, message);
    }

    public SessionException(String message, Throwable cause) {
        super(ErrorKind.SESSION, message, cause);
    }
}
