package org.tanzu.vcenterperf.perf;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.tanzu.vcenterperf.error.ProtocolException;
import org.tanzu.vcenterperf.error.SessionException;
import org.tanzu.vcenterperf.error.ValidationException;
import org.tanzu.vcenterperf.soap.ObjectRef;
import org.tanzu.vcenterperf.support.ScriptedTransport;
import org.tanzu.vcenterperf.support.SoapFixtures;
import org.tanzu.vcenterperf.support.VimFixture;

import static org.junit.jupiter.api.Assertions.*;

class PerformanceManagerTest {

    private static final ObjectRef VM = new ObjectRef("VirtualMachine", "vm-101");

    static final String CSV_ANSWER =
        "<QueryPerfResponse xmlns=\"urn:vim25\">" +
        "<returnval xsi:type=\"PerfEntityMetricCSV\"><entity type=\"VirtualMachine\">vm-101</entity>" +
        "<sampleInfoCSV>20,2024-03-01T10:00:20Z,20,2024-03-01T10:00:40Z</sampleInfoCSV>" +
        "<value><id><counterId>2</counterId><instance></instance></id><value>512,1024</value></value>" +
        "<value><id><counterId>6</counterId><instance>vmnic0</instance></id><value>7,-1</value></value>" +
        "</returnval></QueryPerfResponse>";

    @Test
    void availableMetricsSendsEntityAndOptionalWindow() {
        VimFixture vim = new VimFixture(ScriptedTransport.withSession()
            .respond("QueryAvailablePerfMetric",
                     "<QueryAvailablePerfMetricResponse xmlns=\"urn:vim25\">" +
                     "<returnval><counterId>2</counterId><instance></instance></returnval>" +
                     "<returnval><counterId>6</counterId><instance>vmnic0</instance></returnval>" +
                     "</QueryAvailablePerfMetricResponse>")).login();

        List<MetricId> ids = vim.performanceManager.availableMetrics(
            VM, Instant.parse("2024-03-01T10:00:00Z"), null, 20);

        assertEquals(Arrays.asList(new MetricId(2, ""), new MetricId(6, "vmnic0")), ids);
        String payload = vim.transport.requestsFor("QueryAvailablePerfMetric").get(0).getPayload();
        assertTrue(payload.contains("<_this type=\"PerformanceManager\">PerfMgr</_this>" +
                                    "<entity type=\"VirtualMachine\">vm-101</entity>" +
                                    "<beginTime>2024-03-01T10:00:00Z</beginTime>" +
                                    "<intervalId>20</intervalId>"), payload);
        assertFalse(payload.contains("endTime"));
    }

    @Test
    void entityWithoutMetricsYieldsEmptyList() {
        VimFixture vim = new VimFixture(ScriptedTransport.withSession()
            .respond("QueryAvailablePerfMetric", "<QueryAvailablePerfMetricResponse xmlns=\"urn:vim25\"/>")).login();

        assertTrue(vim.performanceManager.availableMetrics(VM).isEmpty());
    }

    @Test
    void counterMetadataIsFetchedInOneBatch() {
        VimFixture vim = new VimFixture(ScriptedTransport.withSession()
            .respond("QueryPerfCounter", SoapFixtures.counterInfo(2, 6))).login();

        List<MetricDescriptor> descriptors = vim.performanceManager.counterMetadata(Arrays.asList(2, 6));

        assertEquals(2, descriptors.size());
        MetricDescriptor first = descriptors.get(0);
        assertEquals(2, first.getCounterId());
        assertEquals("Group - Counter 2", first.getDisplayName());
        assertEquals("Summary of counter 2", first.getDescription());
        assertEquals("%", first.getUnit());
        assertEquals("average", first.getRollupType());
        assertEquals("rate", first.getStatsType());
        assertEquals(1, first.getLevel());
        assertTrue(vim.transport.requestsFor("QueryPerfCounter").get(0).getPayload()
            .contains("<counterId>2</counterId><counterId>6</counterId>"));
    }

    @Test
    void emptyCounterListIsRejectedBeforeTheSessionCheck() {
        VimFixture vim = new VimFixture(ScriptedTransport.withSession());

        ValidationException e = assertThrows(ValidationException.class,
            () -> vim.performanceManager.counterMetadata(Collections.emptyList()));

        assertEquals("Invalid function call, must supply array of counterIds", e.getMessage());
        assertEquals(0, vim.transport.getCallCount());
    }

    @Test
    void metricQueriesAreValidated() {
        VimFixture vim = new VimFixture(ScriptedTransport.withSession());

        assertThrows(ValidationException.class, () -> vim.performanceManager.metricValues(null));
        assertThrows(ValidationException.class,
            () -> vim.performanceManager.metricValues(PerfQuery.builder(VM).build()));
        ValidationException malformed = assertThrows(ValidationException.class,
            () -> vim.performanceManager.metricValues(PerfQuery.builder(VM).metric(-1, "").build()));
        assertEquals("Malformed array of metric definitions.  Each entry must have id and instance.",
                     malformed.getMessage());
        assertThrows(ValidationException.class,
            () -> vim.performanceManager.metricValues(PerfQuery.builder(new ObjectRef("VirtualMachine", ""))
                .metric(2, "").build()));
        assertThrows(SessionException.class,
            () -> vim.performanceManager.metricValues(PerfQuery.builder(VM).metric(2, "").build()));
        assertEquals(0, vim.transport.getCallCount());
    }

    @Test
    void metricValuesRequestFollowsQuerySpecOrder() {
        VimFixture vim = new VimFixture(ScriptedTransport.withSession()
            .respond("QueryPerf", "<QueryPerfResponse xmlns=\"urn:vim25\"/>")).login();

        vim.performanceManager.metricValues(PerfQuery.builder(VM)
            .metric(2, "")
            .metric(6, "vmnic0")
            .startTime(Instant.parse("2024-03-01T10:00:00Z"))
            .endTime(Instant.parse("2024-03-01T11:00:00Z"))
            .maxSample(30)
            .intervalId(20)
            .format(PerfFormat.NORMAL)
            .build());

        String payload = vim.transport.requestsFor("QueryPerf").get(0).getPayload();
        assertTrue(payload.contains("<querySpec><entity type=\"VirtualMachine\">vm-101</entity>" +
                                    "<startTime>2024-03-01T10:00:00Z</startTime><endTime>2024-03-01T11:00:00Z</endTime>" +
                                    "<maxSample>30</maxSample>" +
                                    "<metricId><counterId>2</counterId><instance></instance></metricId>" +
                                    "<metricId><counterId>6</counterId><instance>vmnic0</instance></metricId>" +
                                    "<intervalId>20</intervalId><format>normal</format></querySpec>"), payload);
    }

    @Test
    void metricSeriesParsesCsvSamples() {
        VimFixture vim = new VimFixture(ScriptedTransport.withSession().respond("QueryPerf", CSV_ANSWER)).login();

        List<MetricSeries> series = vim.performanceManager.metricSeries(PerfQuery.builder(VM)
            .metric(2, "").metric(6, "vmnic0").format(PerfFormat.NORMAL).build());

        assertTrue(vim.transport.requestsFor("QueryPerf").get(0).getPayload().contains("<format>csv</format>"));
        assertEquals(2, series.size());

        MetricSeries memory = series.get(0);
        assertEquals(VM, memory.getEntity());
        assertEquals(new MetricId(2, ""), memory.getMetricId());
        assertEquals(2, memory.getSamples().size());
        assertEquals(Instant.parse("2024-03-01T10:00:20Z"), memory.getSamples().get(0).getTimestamp());
        assertEquals(20, memory.getSamples().get(0).getInterval());
        assertEquals(512, memory.getSamples().get(0).getValue());
        assertEquals(1024, memory.getSamples().get(1).getValue());

        MetricSeries network = series.get(1);
        assertEquals(new MetricId(6, "vmnic0"), network.getMetricId());
        assertEquals(-1, network.getSamples().get(1).getValue());
    }

    @Test
    void misalignedCsvIsAProtocolError() {
        String answer = CSV_ANSWER.replace("<value>512,1024</value>", "<value>512</value>");
        VimFixture vim = new VimFixture(ScriptedTransport.withSession().respond("QueryPerf", answer)).login();

        ProtocolException e = assertThrows(ProtocolException.class,
            () -> vim.performanceManager.metricSeries(PerfQuery.builder(VM).metric(2, "").build()));

        assertEquals("Counter 2 has 1 values for 2 samples", e.getMessage());
    }
}
