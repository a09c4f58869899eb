package org.tanzu.vcenterperf.soap;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;

/**
 * Small element-level helper over a StAX writer for request bodies.
 * All text and attribute values pass through the writer's escaping.
 */
public class SoapBodyWriter {

    /** vim25 timestamps are sent in UTC with second precision. */
    public static final DateTimeFormatter TIMESTAMP =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    private final XMLStreamWriter writer;

    SoapBodyWriter(XMLStreamWriter writer) {
        this.writer = writer;
    }

    public SoapBodyWriter start(String element) throws XMLStreamException {
        writer.writeStartElement(element);
        return this;
    }

    /**
     * Starts an element carrying an {@code xsi:type} attribute.
     */
    public SoapBodyWriter startTyped(String element, String xsiType) throws XMLStreamException {
        writer.writeStartElement(element);
        writer.writeAttribute("xsi", SoapEnvelopeWriter.XSI_NS, "type", xsiType);
        return this;
    }

    public SoapBodyWriter end() throws XMLStreamException {
        writer.writeEndElement();
        return this;
    }

    public SoapBodyWriter text(String element, String value) throws XMLStreamException {
        writer.writeStartElement(element);
        writer.writeCharacters(value);
        writer.writeEndElement();
        return this;
    }

    public SoapBodyWriter text(String element, long value) throws XMLStreamException {
        return text(element, Long.toString(value));
    }

    public SoapBodyWriter text(String element, boolean value) throws XMLStreamException {
        return text(element, Boolean.toString(value));
    }

    /** Writes {@code <element type="kind">id</element>}. */
    public SoapBodyWriter ref(String element, ObjectRef ref) throws XMLStreamException {
        writer.writeStartElement(element);
        writer.writeAttribute("type", ref.getKind());
        writer.writeCharacters(ref.getId());
        writer.writeEndElement();
        return this;
    }

    /** Writes a UTC timestamp element, or nothing when the instant is null. */
    public SoapBodyWriter timestamp(String element, Instant instant) throws XMLStreamException {
        if (instant != null) {
            text(element, TIMESTAMP.format(instant));
        }
        return this;
    }

    /** Writes an integer element, or nothing when the value is null. */
    public SoapBodyWriter optional(String element, Integer value) throws XMLStreamException {
        if (value != null) {
            text(element, value.longValue());
        }
        return this;
    }
}
