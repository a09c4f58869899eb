package org.tanzu.vcenterperf.perf;

import java.util.ArrayList;
import java.util.List;

import javax.xml.stream.XMLStreamException;

import org.tanzu.vcenterperf.soap.ObjectRef;
import org.tanzu.vcenterperf.soap.SoapBodyWriter;
import org.tanzu.vcenterperf.soap.SoapOperation;
import org.tanzu.vcenterperf.soap.SoapRequest;

/**
 * {@code QueryPerfCounter} for a batch of counter ids.
 */
class PerfCounterRequest extends SoapRequest {

    private final ObjectRef perfManager;
    private final List<Integer> counterIds;

    PerfCounterRequest(ObjectRef perfManager, List<Integer> counterIds) {
        super(SoapOperation.QUERY_PERF_COUNTER);
        this.perfManager = perfManager;
        this.counterIds = new ArrayList<>(counterIds);
    }

    @Override
    protected void writeContent(SoapBodyWriter body) throws XMLStreamException {
        body.ref("_this", perfManager);
        for (Integer counterId : counterIds) {
            body.text("counterId", counterId.longValue());
        }
    }
}
