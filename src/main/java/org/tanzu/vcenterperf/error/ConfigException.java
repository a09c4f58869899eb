package org.tanzu.vcenterperf.error;

/** Endpoint URL or credentials are missing. */
public class ConfigException extends VCenterApiException {

    public ConfigException(String message) {
        super(ErrorKind.CONFIG, message);
    }

    public ConfigException(String message, Throwable cause) {
        super(ErrorKind.CONFIG, message, cause);
    }
}
