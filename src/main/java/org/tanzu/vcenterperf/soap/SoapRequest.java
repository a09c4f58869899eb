package org.tanzu.vcenterperf.soap;

import javax.xml.stream.XMLStreamException;

/**
 * Typed request for one vim25 operation.
 *
 * Subclasses hold strongly typed parameters and write the operation's child
 * elements; the envelope, the operation element and all escaping are handled by
 * {@link SoapEnvelopeWriter}.
 */
public abstract class SoapRequest {

    private final SoapOperation operation;

    protected SoapRequest(SoapOperation operation) {
        this.operation = operation;
    }

    public SoapOperation getOperation() {
        return operation;
    }

    /**
     * Writes the children of the operation element, starting with {@code _this}.
     *
     * @param body writer positioned inside the operation element
     * @throws XMLStreamException if the underlying writer fails
     */
    protected abstract void writeContent(SoapBodyWriter body) throws XMLStreamException;
}
