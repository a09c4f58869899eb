package org.tanzu.vcenterperf.session;

/**
 * Lifecycle of a {@link Session}. A failed step leaves the state unchanged.
 */
public enum SessionState {
    UNAUTHENTICATED,
    SERVICE_DISCOVERED,
    AUTHENTICATED
}
