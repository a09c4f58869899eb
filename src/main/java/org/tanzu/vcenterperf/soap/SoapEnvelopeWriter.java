package org.tanzu.vcenterperf.soap;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tanzu.vcenterperf.error.ProtocolException;

/**
 * Serializes a {@link SoapRequest} into a SOAP 1.1 envelope.
 *
 * Output shape: {@code soapenv:Envelope > soapenv:Body > Operation xmlns="urn:vim25"},
 * with the {@code xsd} and {@code xsi} prefixes declared on the envelope.
 */
public final class SoapEnvelopeWriter {

    public static final String SOAPENV_NS = "http://schemas.xmlsoap.org/soap/envelope/";
    public static final String XSD_NS = "http://www.w3.org/2001/XMLSchema";
    public static final String XSI_NS = "http://www.w3.org/2001/XMLSchema-instance";
    public static final String VIM25_NS = "urn:vim25";

    private static final Logger logger = LoggerFactory.getLogger(SoapEnvelopeWriter.class);

    private static final XMLOutputFactory OUTPUT_FACTORY = XMLOutputFactory.newInstance();

    private SoapEnvelopeWriter() {
    }

    /**
     * @param request the typed request
     * @return UTF-8 envelope bytes
     * @throws ProtocolException if the request cannot be serialized
     */
    public static byte[] write(SoapRequest request) {
        String operation = request.getOperation().getOperationName();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        XMLStreamWriter writer = null;
        try {
            writer = OUTPUT_FACTORY.createXMLStreamWriter(out, StandardCharsets.UTF_8.name());
            writer.writeStartDocument(StandardCharsets.UTF_8.name(), "1.0");
            writer.writeStartElement("soapenv", "Envelope", SOAPENV_NS);
            writer.writeNamespace("soapenv", SOAPENV_NS);
            writer.writeNamespace("xsd", XSD_NS);
            writer.writeNamespace("xsi", XSI_NS);
            writer.writeStartElement("soapenv", "Body", SOAPENV_NS);
            writer.writeStartElement(operation);
            writer.writeDefaultNamespace(VIM25_NS);
            request.writeContent(new SoapBodyWriter(writer));
            writer.writeEndElement();
            writer.writeEndElement();
            writer.writeEndElement();
            writer.writeEndDocument();
            writer.flush();
        } catch (XMLStreamException e) {
            throw new ProtocolException("Could not serialize " + operation + " request: " + e.getMessage(), e);
        } finally {
            closeQuietly(writer);
        }
        return out.toByteArray();
    }

    private static void closeQuietly(XMLStreamWriter writer) {
        if (writer == null) {
            return;
        }
        try {
            writer.close();
        } catch (XMLStreamException e) {
            logger.debug("Could not close XML writer: {}", e.getMessage());
        }
    }
}
