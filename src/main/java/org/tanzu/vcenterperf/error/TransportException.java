package org.tanzu.vcenterperf.error;

/** Network, TLS or timeout failure at the HTTP boundary. */
public class TransportException extends VCenterApiException {

    public TransportException(String message) {
        super(ErrorKind.TRANSPORT, message);
    }

    public TransportException(String message, Throwable cause) {
        super(ErrorKind.TRANSPORT, message, cause);
    }
}
