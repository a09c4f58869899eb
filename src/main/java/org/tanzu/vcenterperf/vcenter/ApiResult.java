package org.tanzu.vcenterperf.vcenter;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.tanzu.vcenterperf.error.ErrorKind;
import org.tanzu.vcenterperf.error.VCenterApiException;

/**
 * Result of a public API operation.
 * 
 * {@code error} is always present and empty on success. The other parts are
 * only filled when enabled in the call's {@link ResultOptions}; when the error
 * is not empty none of them should be trusted as complete.
 *
 * @param <T> type of the decoded value
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ApiResult<T> {

    private final String raw;
    private final Map<String, List<String>> headers;
    private final String json;
    private final T value;
    private final String error;
    private final ErrorKind errorKind;

    private ApiResult(String raw, Map<String, List<String>> headers, String json, T value,
                      String error, ErrorKind errorKind) {
        this.raw = raw;
        this.headers = headers;
        this.json = json;
        this.value = value;
        this.error = error;
        this.errorKind = errorKind;
    }

    static <T> ApiResult<T> success(ResultOptions options, String raw, Map<String, List<String>> headers,
                                    String json, T value) {
        return new ApiResult<>(
            options.isRaw() ? raw : null,
            options.isHeaders() ? headers : null,
            options.isJson() ? json : null,
            options.isStructured() ? value : null,
            "",
            null);
    }

    static <T> ApiResult<T> failure(VCenterApiException e) {
        return new ApiResult<>(null, null, null, null, e.getMessage() != null ? e.getMessage() : e.toString(), e.getKind());
    }

    /** The raw response document. */
    public String getRaw() { return raw; }

    public Map<String, List<String>> getHeaders() { return headers; }

    /** JSON text of the structured answer. */
    public String getJson() { return json; }

    public T getValue() { return value; }

    public String getError() { return error; }

    /** Category of the error, null on success. */
    public ErrorKind getErrorKind() { return errorKind; }

    public boolean hasError() {
        return !error.isEmpty();
    }

    @Override
    public String toString() {
        return hasError()
            ? "ApiResult{error='" + error + "', kind=" + errorKind + "}"
            : "ApiResult{value=" + value + "}";
    }
}
