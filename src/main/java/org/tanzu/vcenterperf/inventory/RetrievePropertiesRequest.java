package org.tanzu.vcenterperf.inventory;

import java.util.ArrayList;
import java.util.List;

import javax.xml.stream.XMLStreamException;

import org.tanzu.vcenterperf.soap.ObjectRef;
import org.tanzu.vcenterperf.soap.SoapBodyWriter;
import org.tanzu.vcenterperf.soap.SoapOperation;
import org.tanzu.vcenterperf.soap.SoapRequest;

/**
 * {@code RetrieveProperties} with one property filter and one object set rooted at a folder.
 */
public class RetrievePropertiesRequest extends SoapRequest {

    private final ObjectRef propertyCollector;
    private final ObjectRef root;
    private final String objectType;
    private final List<String> pathSet;
    private final boolean all;
    private final List<TraversalSpec> traversal;

    public RetrievePropertiesRequest(ObjectRef propertyCollector, ObjectRef root, String objectType,
                                     List<String> pathSet, boolean all, List<TraversalSpec> traversal) {
        super(SoapOperation.RETRIEVE_PROPERTIES);
        this.propertyCollector = propertyCollector;
        this.root = root;
        this.objectType = objectType;
        this.pathSet = new ArrayList<>(pathSet);
        this.all = all;
        this.traversal = traversal;
    }

    @Override
    protected void writeContent(SoapBodyWriter body) throws XMLStreamException {
        body.ref("_this", propertyCollector);
        body.start("specSet");

        body.start("propSet")
            .text("type", objectType)
            .text("all", all);
        for (String path : pathSet) {
            body.text("pathSet", path);
        }
        body.end();

        body.start("objectSet")
            .ref("obj", root)
            .text("skip", false);
        for (TraversalSpec spec : traversal) {
            body.startTyped("selectSet", "TraversalSpec")
                .text("name", spec.getName())
                .text("type", spec.getType())
                .text("path", spec.getPath())
                .text("skip", spec.isSkip());
            for (String next : spec.getSelectSet()) {
                body.start("selectSet").text("name", next).end();
            }
            body.end();
        }
        body.end();

        body.end();
    }
}
