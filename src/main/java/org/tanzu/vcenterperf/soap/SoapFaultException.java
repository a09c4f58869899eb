package org.tanzu.vcenterperf.soap;

import org.tanzu.vcenterperf.error.ProtocolException;

/**
 * The server answered with a SOAP {@code Fault} instead of a response element.
 */
public class SoapFaultException extends ProtocolException {

    private final String faultCode;
    private final String faultString;

    public SoapFaultException(String faultCode, String faultString) {
        super("SOAP fault: " + faultString);
        this.faultCode = faultCode;
        this.faultString = faultString;
    }

    public String getFaultCode() { return faultCode; }
    public String getFaultString() { return faultString; }
}
