package org.tanzu.vcenterperf.session;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.tanzu.vcenterperf.error.ConfigException;
import org.tanzu.vcenterperf.error.ProtocolException;
import org.tanzu.vcenterperf.error.SessionException;
import org.tanzu.vcenterperf.error.VCenterApiException;
import org.tanzu.vcenterperf.soap.ObjectRef;
import org.tanzu.vcenterperf.soap.SoapCall;
import org.tanzu.vcenterperf.soap.SoapClient;
import org.tanzu.vcenterperf.soap.SoapFaultException;
import org.tanzu.vcenterperf.soap.SoapRequest;

/**
 * Service discovery and authentication state machine.
 * 
 * The session moves from UNAUTHENTICATED to SERVICE_DISCOVERED once the service
 * content has been retrieved, and to AUTHENTICATED once a login returned a session
 * cookie. A failing step leaves the state where it was. Every inventory or metric
 * operation first asks {@link #requireAuthenticated()}, which fails without any
 * network call while no session exists.
 * 
 * State transitions are serialized on this instance; the current {@link Session}
 * is an immutable value, so readers always see a consistent endpoint/cookie pair.
 */
@Component
public class SessionManager {

    private static final Logger logger = LoggerFactory.getLogger(SessionManager.class);

    /** Endpoints taken from the service content, with their managed object types */
    private static final Map<String, String> ENDPOINT_KINDS = new LinkedHashMap<>();

    static {
        ENDPOINT_KINDS.put(Session.PROPERTY_COLLECTOR, "PropertyCollector");
        ENDPOINT_KINDS.put(Session.PERF_MANAGER, "PerformanceManager");
        ENDPOINT_KINDS.put(Session.ROOT_FOLDER, "Folder");
        ENDPOINT_KINDS.put(Session.SESSION_MANAGER, "SessionManager");
    }

    private final SoapClient soapClient;

    private Session session = Session.INITIAL;

    public SessionManager(SoapClient soapClient) {
        this.soapClient = soapClient;
    }

    /**
     * Retrieves the service content and stores the endpoint references.
     * 
     * @return the discovery call
     * @throws ProtocolException if the answer lacks the service content or one of the endpoints
     */
    public synchronized SoapCall discoverService() {
        logger.info("=== SERVICE DISCOVERY ===");
        SoapCall call = soapClient.invoke(new ServiceContentRequest(), Collections.emptyMap());

        JsonNode content = call.getValue().path("returnval");
        if (!content.isObject()) {
            throw new ProtocolException("Service content missing from RetrieveServiceContent response");
        }
        Map<String, ObjectRef> endpoints = new LinkedHashMap<>();
        for (Map.Entry<String, String> endpoint : ENDPOINT_KINDS.entrySet()) {
            String id = content.path(endpoint.getKey()).asText("");
            if (id.isEmpty()) {
                throw new ProtocolException("Service content is missing '" + endpoint.getKey() + "'");
            }
            endpoints.put(endpoint.getKey(), new ObjectRef(endpoint.getValue(), id));
        }
        String serverName = content.path("about").path("fullName").asText(null);

        session = session.discovered(endpoints, serverName);
        logger.info("Discovered vSphere service: {} (endpoints={})", serverName, endpoints.keySet());
        return call;
    }

    /**
     * Logs in, discovering the service first when needed.
     * 
     * @param username user name
     * @param password password
     * @return the login call
     * @throws ConfigException if a credential is blank
     * @throws SessionException if the login is refused or returns no session cookie
     */
    public synchronized SoapCall login(String username, String password) {
        if (isBlank(username) || isBlank(password)) {
            throw new ConfigException("Must set URL, Username, and Password");
        }
        if (session.getState() == SessionState.UNAUTHENTICATED) {
            try {
                discoverService();
            } catch (VCenterApiException e) {
                throw e.withContext("From discoverService()");
            }
        }

        logger.info("=== LOGIN as '{}' ===", username);
        LoginRequest request = new LoginRequest(session.endpoint(Session.SESSION_MANAGER), username, password);
        SoapCall call;
        try {
            call = soapClient.invoke(request, Collections.emptyMap());
        } catch (SoapFaultException e) {
            throw new SessionException("Login failed: " + e.getFaultString(), e);
        }

        String cookie = extractCookie(call.getHeaders());
        if (cookie == null) {
            logger.error("Login response carried no session cookie");
            throw new SessionException("Session cookie not found during login.");
        }
        session = session.authenticated(cookie);
        logger.info("Successfully logged in to vSphere service as '{}'", username);
        return call;
    }

    /**
     * @return the authenticated session
     * @throws SessionException if no login has succeeded yet
     */
    public synchronized Session requireAuthenticated() {
        if (!session.isAuthenticated()) {
            throw new SessionException("Must log in before issuing commands");
        }
        return session;
    }

    /**
     * Issues a request within an authenticated session, carrying its cookie.
     * 
     * @param authenticated session obtained from {@link #requireAuthenticated()}
     * @param request typed request
     * @return the decoded call
     */
    public SoapCall call(Session authenticated, SoapRequest request) {
        if (!authenticated.isAuthenticated()) {
            throw new SessionException("Must log in before issuing commands");
        }
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(HttpHeaders.COOKIE, authenticated.getCookie());
        return soapClient.invoke(request, headers);
    }

    public synchronized Session getSession() {
        return session;
    }

    /**
     * Takes the first {@code name=value} pair of the first usable Set-Cookie header.
     */
    static String extractCookie(HttpHeaders headers) {
        List<String> values = headers != null ? headers.get(HttpHeaders.SET_COOKIE) : null;
        if (values == null) {
            return null;
        }
        for (String value : values) {
            String pair = value.split(";", 2)[0].trim();
            if (pair.indexOf('=') > 0) {
                return pair;
            }
        }
        return null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
