package org.tanzu.vcenterperf.vcenter;

import org.tanzu.vcenterperf.config.VCenterConfig;

/**
 * Which parts of a call are copied into its {@link ApiResult}.
 * Any subset may be enabled; options are given per call.
 */
public final class ResultOptions {

    private final boolean raw;
    private final boolean headers;
    private final boolean json;
    private final boolean structured;

    public ResultOptions(boolean raw, boolean headers, boolean json, boolean structured) {
        this.raw = raw;
        this.headers = headers;
        this.json = json;
        this.structured = structured;
    }

    public static ResultOptions all() {
        return new ResultOptions(true, true, true, true);
    }

    /** Only the decoded value, as used by the MCP tools. */
    public static ResultOptions valueOnly() {
        return new ResultOptions(false, false, false, true);
    }

    public static ResultOptions fromConfig(VCenterConfig.Output output) {
        return new ResultOptions(output.isRaw(), output.isHeaders(), output.isJson(), output.isStructured());
    }

    public boolean isRaw() { return raw; }
    public boolean isHeaders() { return headers; }
    public boolean isJson() { return json; }
    public boolean isStructured() { return structured; }

    @Override
    public String toString() {
        return "ResultOptions{raw=" + raw + ", headers=" + headers + ", json=" + json + ", structured=" + structured + "}";
    }
}
