package org.tanzu.vcenterperf.perf;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import org.tanzu.vcenterperf.error.ProtocolException;
import org.tanzu.vcenterperf.soap.ObjectRef;

/**
 * Turns a CSV-format {@code QueryPerf} answer into typed series.
 * 
 * {@code sampleInfoCSV} alternates interval and timestamp
 * ({@code "20,2024-01-01T00:00:20Z,20,2024-01-01T00:00:40Z"}), and each value
 * entry carries one comma separated number per sample, in the same order.
 */
final class PerfSeriesParser {

    private PerfSeriesParser() {
    }

    /**
     * @param entity the queried entity
     * @param value transcoded {@code QueryPerfResponse}
     * @return one series per metric, in answer order
     * @throws ProtocolException if the sample info and values do not line up
     */
    static List<MetricSeries> parse(ObjectRef entity, JsonNode value) {
        JsonNode returnval = value.path("returnval");
        if (!returnval.isArray()) {
            throw new ProtocolException("QueryPerf response has no returnval list");
        }
        List<MetricSeries> series = new ArrayList<>();
        for (JsonNode entityMetric : returnval) {
            List<SampleInfo> infos = parseSampleInfo(entityMetric.path("sampleInfoCSV").asText(""));
            for (JsonNode metric : entityMetric.path("value")) {
                MetricId id = parseId(metric.path("id"));
                String[] values = split(text(metric.path("value")));
                if (values.length != infos.size()) {
                    throw new ProtocolException("Counter " + id + " has " + values.length +
                                                " values for " + infos.size() + " samples");
                }
                List<PerfSample> samples = new ArrayList<>(infos.size());
                for (int i = 0; i < values.length; i++) {
                    samples.add(new PerfSample(infos.get(i).timestamp, infos.get(i).interval,
                                               parseLong(values[i], "value of counter " + id)));
                }
                series.add(new MetricSeries(entity, id, samples));
            }
        }
        return series;
    }

    private static List<SampleInfo> parseSampleInfo(String csv) {
        String[] fields = split(csv);
        if (fields.length % 2 != 0) {
            throw new ProtocolException("Malformed sampleInfoCSV: odd number of fields");
        }
        List<SampleInfo> infos = new ArrayList<>(fields.length / 2);
        for (int i = 0; i < fields.length; i += 2) {
            int interval = (int) parseLong(fields[i], "sample interval");
            try {
                infos.add(new SampleInfo(OffsetDateTime.parse(fields[i + 1]).toInstant(), interval));
            } catch (DateTimeParseException e) {
                throw new ProtocolException("Malformed sample timestamp '" + fields[i + 1] + "'", e);
            }
        }
        return infos;
    }

    private static MetricId parseId(JsonNode id) {
        return new MetricId((int) parseLong(id.path("counterId").asText(""), "counter id"),
                            id.path("instance").asText(""));
    }

    /** The inner value is a list when the transcoder saw it as an array field. */
    private static String text(JsonNode node) {
        if (node.isArray()) {
            StringBuilder joined = new StringBuilder();
            for (JsonNode part : node) {
                if (joined.length() > 0) {
                    joined.append(',');
                }
                joined.append(part.asText(""));
            }
            return joined.toString();
        }
        return node.asText("");
    }

    private static String[] split(String csv) {
        String trimmed = csv.trim();
        return trimmed.isEmpty() ? new String[0] : trimmed.split("\\s*,\\s*");
    }

    private static long parseLong(String text, String what) {
        try {
            return Long.parseLong(text.trim());
        } catch (NumberFormatException e) {
            throw new ProtocolException("Malformed " + what + " '" + text + "'", e);
        }
    }

    private static final class SampleInfo {
        private final Instant timestamp;
        private final int interval;

        private SampleInfo(Instant timestamp, int interval) {
            this.timestamp = timestamp;
            this.interval = interval;
        }
    }
}
