package org.tanzu.vcenterperf.soap;

/**
 * vim25 operations issued by the client, with the cardinality of their answers.
 */
public enum SoapOperation {

    RETRIEVE_SERVICE_CONTENT("RetrieveServiceContent", CardinalitySchema.NONE),
    LOGIN("Login", CardinalitySchema.NONE),
    RETRIEVE_PROPERTIES("RetrieveProperties", CardinalitySchema.builder()
        .arrayUnder("RetrievePropertiesResponse", "returnval")
        .array("propSet")
        .build()),
    QUERY_AVAILABLE_PERF_METRIC("QueryAvailablePerfMetric", CardinalitySchema.builder()
        .arrayUnder("QueryAvailablePerfMetricResponse", "returnval")
        .build()),
    QUERY_PERF_COUNTER("QueryPerfCounter", CardinalitySchema.builder()
        .arrayUnder("QueryPerfCounterResponse", "returnval")
        .build()),
    QUERY_PERF("QueryPerf", CardinalitySchema.builder()
        .arrayUnder("QueryPerfResponse", "returnval")
        .array("value", "sampleInfo")
        .build());

    private final String operationName;
    private final CardinalitySchema responseSchema;

    SoapOperation(String operationName, CardinalitySchema responseSchema) {
        this.operationName = operationName;
        this.responseSchema = responseSchema;
    }

    /** Element name of the request body, e.g. {@code RetrieveProperties}. */
    public String getOperationName() {
        return operationName;
    }

    /** Element name wrapping the answer, e.g. {@code RetrievePropertiesResponse}. */
    public String getResponseElement() {
        return operationName + "Response";
    }

    public CardinalitySchema getResponseSchema() {
        return responseSchema;
    }
}
