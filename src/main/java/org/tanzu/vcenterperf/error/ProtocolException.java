package org.tanzu.vcenterperf.error;

/** The server answer could not be decoded or did not have the expected shape. */
public class ProtocolException extends VCenterApiException {

    public ProtocolException(String message) {
        super(ErrorKind.PROTOCOL, message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(ErrorKind.PROTOCOL, message, cause);
    }
}
