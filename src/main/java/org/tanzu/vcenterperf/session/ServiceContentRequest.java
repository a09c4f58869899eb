package org.tanzu.vcenterperf.session;

import javax.xml.stream.XMLStreamException;

import org.tanzu.vcenterperf.soap.ObjectRef;
import org.tanzu.vcenterperf.soap.SoapBodyWriter;
import org.tanzu.vcenterperf.soap.SoapOperation;
import org.tanzu.vcenterperf.soap.SoapRequest;

/**
 * {@code RetrieveServiceContent} on the well-known service instance.
 */
public class ServiceContentRequest extends SoapRequest {

    static final ObjectRef SERVICE_INSTANCE = new ObjectRef("ServiceInstance", "ServiceInstance");

    public ServiceContentRequest() {
        super(SoapOperation.RETRIEVE_SERVICE_CONTENT);
    }

    @Override
    protected void writeContent(SoapBodyWriter body) throws XMLStreamException {
        body.ref("_this", SERVICE_INSTANCE);
    }
}
