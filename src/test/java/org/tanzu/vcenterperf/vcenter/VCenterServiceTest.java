package org.tanzu.vcenterperf.vcenter;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.tanzu.vcenterperf.error.ValidationException;
import org.tanzu.vcenterperf.perf.MetricCatalogResult;
import org.tanzu.vcenterperf.perf.MetricSeries;
import org.tanzu.vcenterperf.support.ScriptedTransport;
import org.tanzu.vcenterperf.support.SoapFixtures;
import org.tanzu.vcenterperf.support.VimFixture;
import org.tanzu.vcenterperf.transport.CallStatistics;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class VCenterServiceTest {

    private static final String CSV_ANSWER =
        "<QueryPerfResponse xmlns=\"urn:vim25\">" +
        "<returnval xsi:type=\"PerfEntityMetricCSV\"><entity type=\"HostSystem\">host-12</entity>" +
        "<sampleInfoCSV>300,2024-03-01T10:05:00Z,300,2024-03-01T10:10:00Z</sampleInfoCSV>" +
        "<value><id><counterId>2</counterId><instance></instance></id><value>1250,1310</value></value>" +
        "</returnval></QueryPerfResponse>";

    @Test
    void firstToolCallLogsInWithConfiguredCredentials() {
        VimFixture vim = new VimFixture(ScriptedTransport.withSession()
            .respond("RetrieveProperties", SoapFixtures.namedObjects("vm-A", "alpha")));
        VCenterService service = new VCenterService(vim.apiClient);

        List<VCenterService.InventoryItem> first = service.listVirtualMachines();
        service.listVirtualMachines();

        assertEquals(1, first.size());
        assertEquals("vm-A", first.get(0).getId());
        assertEquals("alpha", first.get(0).getName());
        assertEquals(1, vim.transport.requestsFor("Login").size());
        assertTrue(vim.transport.requestsFor("Login").get(0).getPayload()
            .contains("<userName>administrator@vsphere.local</userName>"));
    }

    @Test
    void failedLoginSurfacesAsToolError() {
        VimFixture vim = new VimFixture(new ScriptedTransport()
            .respond("RetrieveServiceContent", SoapFixtures.SERVICE_CONTENT)
            .respond("Login", SoapFixtures.LOGIN_RESPONSE));
        VCenterService service = new VCenterService(vim.apiClient);

        RuntimeException e = assertThrows(RuntimeException.class, service::listHosts);

        assertEquals("Failed to log in to vCenter: Session cookie not found during login.", e.getMessage());
        assertTrue(vim.transport.requestsFor("RetrieveProperties").isEmpty());
    }

    @Test
    void metricCatalogRejectsUnknownRootWithoutNetworkCall() {
        VimFixture vim = new VimFixture(ScriptedTransport.withSession());
        VCenterService service = new VCenterService(vim.apiClient);

        RuntimeException e = assertThrows(RuntimeException.class, () -> service.getMetricCatalog("datastore"));

        assertTrue(e.getMessage().startsWith("Unknown inventory root 'datastore'"));
        assertEquals(0, vim.transport.getCallCount());
    }

    @Test
    void metricCatalogAcceptsRootNamesCaseInsensitively() {
        VimFixture vim = new VimFixture(ScriptedTransport.withSession()
            .respond("RetrieveProperties", SoapFixtures.namedObjects("domain-c7", "Cluster A"))
            .respond("QueryAvailablePerfMetric", SoapFixtures.availableMetrics(2))
            .respond("QueryPerfCounter", SoapFixtures.counterInfo(2)));
        VCenterService service = new VCenterService(vim.apiClient);

        MetricCatalogResult result = service.getMetricCatalog("compute_resource");

        assertEquals("Cluster A", result.getObjects().get(0).getName());
    }

    @Test
    void metricSeriesToolBuildsTheQuery() {
        VimFixture vim = new VimFixture(ScriptedTransport.withSession().respond("QueryPerf", CSV_ANSWER));
        VCenterService service = new VCenterService(vim.apiClient);

        List<MetricSeries> series = service.getMetricSeries("HostSystem", "host-12", Arrays.asList(2), null,
                                                            "2024-03-01T10:00:00Z", null, 12, 300);

        assertEquals(2, series.get(0).getSamples().size());
        assertEquals(1310, series.get(0).getSamples().get(1).getValue());
        String payload = vim.transport.requestsFor("QueryPerf").get(0).getPayload();
        assertTrue(payload.contains("<entity type=\"HostSystem\">host-12</entity><startTime>2024-03-01T10:00:00Z</startTime>" +
                                    "<maxSample>12</maxSample>"), payload);
        assertTrue(payload.contains("<intervalId>300</intervalId><format>csv</format>"));
    }

    @Test
    void metricValuesToolSendsRequestedFormat() {
        VimFixture vim = new VimFixture(ScriptedTransport.withSession().respond("QueryPerf",
            "<QueryPerfResponse xmlns=\"urn:vim25\"><returnval xsi:type=\"PerfEntityMetric\">" +
            "<entity type=\"VirtualMachine\">vm-A</entity></returnval></QueryPerfResponse>"));
        VCenterService service = new VCenterService(vim.apiClient);

        JsonNode values = service.getMetricValues("VirtualMachine", "vm-A", Arrays.asList(2), "", " Normal ");

        assertEquals("vm-A", values.path("returnval").get(0).path("entity").asText());
        assertTrue(vim.transport.requestsFor("QueryPerf").get(0).getPayload()
            .contains("</metricId><format>normal</format>"));
    }

    @Test
    void unknownFormatIsRejectedBeforeLogin() {
        VimFixture vim = new VimFixture(ScriptedTransport.withSession());
        VCenterService service = new VCenterService(vim.apiClient);

        ValidationException e = assertThrows(ValidationException.class,
            () -> service.getMetricValues("VirtualMachine", "vm-A", Arrays.asList(2), "", "xml"));

        assertEquals("Unknown performance data format 'xml', expected csv or normal", e.getMessage());
        assertEquals(0, vim.transport.getCallCount());
    }

    @Test
    void invalidTimestampIsRejected() {
        VimFixture vim = new VimFixture(ScriptedTransport.withSession());
        VCenterService service = new VCenterService(vim.apiClient);

        RuntimeException e = assertThrows(RuntimeException.class, () -> service.getMetricSeries(
            "HostSystem", "host-12", Arrays.asList(2), "", "yesterday", null, null, null));

        assertTrue(e.getMessage().startsWith("Invalid startTime 'yesterday'"));
        assertEquals(0, vim.transport.getCallCount());
    }

    @Test
    void apiStatisticsDoNotRequireASession() {
        VimApiClient apiClient = mock(VimApiClient.class);
        CallStatistics stats = new CallStatistics(3, Duration.ofMillis(90), Duration.ofMillis(30), Duration.ofMillis(25));
        when(apiClient.apiStats()).thenReturn(stats);
        VCenterService service = new VCenterService(apiClient);

        assertSame(stats, service.getApiStatistics());
        verify(apiClient, never()).login(any(ResultOptions.class));
        verify(apiClient, never()).isLoggedIn();
    }
}
