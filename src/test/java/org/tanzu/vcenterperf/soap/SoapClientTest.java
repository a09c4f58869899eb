package org.tanzu.vcenterperf.soap;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.tanzu.vcenterperf.error.ErrorKind;
import org.tanzu.vcenterperf.error.ProtocolException;
import org.tanzu.vcenterperf.session.ServiceContentRequest;
import org.tanzu.vcenterperf.support.ScriptedTransport;
import org.tanzu.vcenterperf.support.SoapFixtures;
import org.tanzu.vcenterperf.transport.PacedTransport;
import org.tanzu.vcenterperf.transport.TransportResponse;

import static org.junit.jupiter.api.Assertions.*;

class SoapClientTest {

    private ScriptedTransport transport;
    private PacedTransport paced;
    private SoapClient client;

    @BeforeEach
    void setUp() {
        transport = new ScriptedTransport();
        paced = new PacedTransport(transport, Duration.ZERO);
        client = new SoapClient(paced, new DocumentTranscoder());
    }

    @Test
    void unwrapsOperationResponseElement() {
        transport.respond("RetrieveServiceContent", SoapFixtures.SERVICE_CONTENT);

        SoapCall call = client.invoke(new ServiceContentRequest(), Collections.emptyMap());

        assertEquals(SoapOperation.RETRIEVE_SERVICE_CONTENT, call.getOperation());
        assertEquals(200, call.getStatus());
        assertEquals("group-d1", call.getValue().path("returnval").path("rootFolder").asText());
        assertTrue(call.getRaw().contains("<rootFolder type=\"Folder\">group-d1</rootFolder>"));
        assertEquals(1, paced.statistics().getTotalCalls());
    }

    @Test
    void passesBodyThroughWhenResponseElementIsMissing() {
        transport.respond("RetrieveServiceContent", "<Unexpected><x>1</x></Unexpected>");

        SoapCall call = client.invoke(new ServiceContentRequest(), Collections.emptyMap());

        assertEquals("1", call.getValue().path("Unexpected").path("x").asText());
    }

    @Test
    void faultInBodyBecomesSoapFaultException() {
        transport.on("RetrieveServiceContent", payload -> new TransportResponse(500, new HttpHeaders(),
            SoapFixtures.envelope(SoapFixtures.fault("Cannot complete login due to an incorrect user name or password."))
                .getBytes(StandardCharsets.UTF_8)));

        SoapFaultException e = assertThrows(SoapFaultException.class,
            () -> client.invoke(new ServiceContentRequest(), Collections.emptyMap()));

        assertEquals(ErrorKind.PROTOCOL, e.getKind());
        assertEquals("ServerFaultCode", e.getFaultCode());
        assertEquals("SOAP fault: Cannot complete login due to an incorrect user name or password.", e.getMessage());
    }

    @Test
    void undecodableErrorPageCarriesHttpStatus() {
        transport.on("RetrieveServiceContent", payload -> new TransportResponse(503, new HttpHeaders(),
            "Service Unavailable".getBytes(StandardCharsets.UTF_8)));

        ProtocolException e = assertThrows(ProtocolException.class,
            () -> client.invoke(new ServiceContentRequest(), Collections.emptyMap()));

        assertTrue(e.getMessage().startsWith("HTTP 503: Response is not a well-formed XML document"), e.getMessage());
    }

    @Test
    void errorStatusWithoutResponseElementIsRejected() {
        transport.on("RetrieveServiceContent", payload -> new TransportResponse(500, new HttpHeaders(),
            SoapFixtures.envelope("<Unexpected><x>1</x></Unexpected>").getBytes(StandardCharsets.UTF_8)));

        ProtocolException e = assertThrows(ProtocolException.class,
            () -> client.invoke(new ServiceContentRequest(), Collections.emptyMap()));

        assertEquals("HTTP 500: No <RetrieveServiceContentResponse> element in SOAP body", e.getMessage());
        assertEquals(ErrorKind.PROTOCOL, e.getKind());
    }

    @Test
    void documentWithoutSoapBodyIsRejected() {
        transport.on("RetrieveServiceContent", payload -> new TransportResponse(200, new HttpHeaders(),
            "<html><body>proxy login</body></html>".getBytes(StandardCharsets.UTF_8)));

        ProtocolException e = assertThrows(ProtocolException.class,
            () -> client.invoke(new ServiceContentRequest(), Collections.emptyMap()));

        assertEquals("Response is not a SOAP envelope", e.getMessage());
    }

    @Test
    void perCallHeadersReachTheTransport() {
        transport.respond("RetrieveServiceContent", SoapFixtures.SERVICE_CONTENT);

        client.invoke(new ServiceContentRequest(), Collections.singletonMap(HttpHeaders.COOKIE, "a=b"));

        assertEquals("a=b", transport.getRequests().get(0).getHeaders().get(HttpHeaders.COOKIE));
        assertTrue(transport.getRequests().get(0).getPayload()
            .contains("<_this type=\"ServiceInstance\">ServiceInstance</_this>"));
    }
}
