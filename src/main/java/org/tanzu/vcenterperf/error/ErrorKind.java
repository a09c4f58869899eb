package org.tanzu.vcenterperf.error;

/**
 * Classification of every failure the client reports.
 */
public enum ErrorKind {
    /** Endpoint or credentials missing before login. */
    CONFIG,
    /** Caller-supplied arguments failed their preconditions. */
    VALIDATION,
    /** Operation attempted before authentication, or login produced no token. */
    SESSION,
    /** Network or TLS failure, including call timeouts. */
    TRANSPORT,
    /** Response could not be transcoded or lacked the expected shape. */
    PROTOCOL
}
