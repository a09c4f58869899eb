package org.tanzu.vcenterperf.session;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.tanzu.vcenterperf.error.SessionException;
import org.tanzu.vcenterperf.soap.ObjectRef;

/**
 * Immutable view of the client session: service endpoint references, the
 * session cookie and the lifecycle state.
 */
public final class Session {

    public static final String PROPERTY_COLLECTOR = "propertyCollector";
    public static final String PERF_MANAGER = "perfManager";
    public static final String ROOT_FOLDER = "rootFolder";
    public static final String SESSION_MANAGER = "sessionManager";

    static final Session INITIAL = new Session(SessionState.UNAUTHENTICATED, Collections.emptyMap(), null, null);

    private final SessionState state;
    private final Map<String, ObjectRef> serviceEndpointRefs;
    private final String cookie;
    private final String serverName;

    Session(SessionState state, Map<String, ObjectRef> serviceEndpointRefs, String cookie, String serverName) {
        this.state = state;
        this.serviceEndpointRefs = Collections.unmodifiableMap(new LinkedHashMap<>(serviceEndpointRefs));
        this.cookie = cookie;
        this.serverName = serverName;
    }

    /** Re-discovery refreshes the endpoints but keeps an authenticated session. */
    Session discovered(Map<String, ObjectRef> endpoints, String serverName) {
        SessionState next = state == SessionState.AUTHENTICATED ? SessionState.AUTHENTICATED : SessionState.SERVICE_DISCOVERED;
        return new Session(next, endpoints, cookie, serverName);
    }

    Session authenticated(String cookie) {
        return new Session(SessionState.AUTHENTICATED, serviceEndpointRefs, cookie, serverName);
    }

    public SessionState getState() { return state; }
    public Map<String, ObjectRef> getServiceEndpointRefs() { return serviceEndpointRefs; }
    public String getCookie() { return cookie; }

    /** Product name reported by the server during discovery, if any. */
    public String getServerName() { return serverName; }

    public boolean isAuthenticated() {
        return state == SessionState.AUTHENTICATED;
    }

    /**
     * @param name one of the endpoint name constants
     * @return the endpoint reference
     * @throws SessionException if service discovery has not stored it
     */
    public ObjectRef endpoint(String name) {
        ObjectRef ref = serviceEndpointRefs.get(name);
        if (ref == null) {
            throw new SessionException("Service endpoint '" + name + "' is not known; discover the service first");
        }
        return ref;
    }

    @Override
    public String toString() {
        return "Session{state=" + state + ", endpoints=" + serviceEndpointRefs +
               ", cookie=" + (cookie != null ? "[SET]" : "null") + "}";
    }
}
