package org.tanzu.vcenterperf.soap;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.tanzu.vcenterperf.error.ProtocolException;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

/**
 * Schema-free conversion of XML documents into Jackson trees.
 *
 * <p>Rules, applied to local names (namespaces are ignored):
 * <ul>
 *   <li>the result is an object holding the document element under its name;</li>
 *   <li>an element without child elements becomes its text content, untouched;</li>
 *   <li>an element with child elements becomes an object keyed by child names, with
 *       its attributes (namespace declarations excluded) under the {@value #ATTRIBUTES_KEY} key;</li>
 *   <li>elements declared as arrays in the {@link CardinalitySchema} are always arrays,
 *       placed where their first occurrence is;</li>
 *   <li>other repeated siblings collapse to the last occurrence.</li>
 * </ul>
 *
 * <p>Transcoding is a pure function of its inputs and holds no state between calls.
 */
@Component
public class DocumentTranscoder {

    private static final Logger logger = LoggerFactory.getLogger(DocumentTranscoder.class);

    /** Reserved key holding the attributes of an object element. */
    public static final String ATTRIBUTES_KEY = "@";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Transcodes a UTF-8 (or self-declared encoding) XML document.
     *
     * @param document raw document bytes
     * @param schema declared array fields
     * @return the structured value
     * @throws ProtocolException if the document is not well-formed XML
     */
    public JsonNode transcode(byte[] document, CardinalitySchema schema) {
        Element root = parse(document).getDocumentElement();
        ObjectNode result = NODES.objectNode();
        List<Element> roots = new ArrayList<>();
        roots.add(root);
        appendChildren(result, roots, schema);
        return result;
    }

    public JsonNode transcode(String document, CardinalitySchema schema) {
        return transcode(document.getBytes(StandardCharsets.UTF_8), schema);
    }

    /**
     * Serializes a structured value as JSON text. Control characters, backslashes
     * and double quotes in leaf text are escaped, so the output re-parses to the same tree.
     *
     * @param value the structured value
     * @return JSON text
     */
    public String toJson(JsonNode value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Could not serialize structured value: " + e.getOriginalMessage(), e);
        }
    }

    private JsonNode convert(Element element, CardinalitySchema schema) {
        List<Element> children = childElements(element);
        Set<String> required = schema.requiredArraysOf(localName(element));
        if (children.isEmpty() && required.isEmpty()) {
            return TextNode.valueOf(element.getTextContent());
        }

        ObjectNode node = NODES.objectNode();
        ObjectNode attributes = attributesOf(element);
        if (attributes.size() > 0) {
            node.set(ATTRIBUTES_KEY, attributes);
        }
        appendChildren(node, children, schema);
        for (String field : required) {
            if (!node.has(field)) {
                node.set(field, NODES.arrayNode());
            }
        }
        return node;
    }

    private void appendChildren(ObjectNode target, List<Element> children, CardinalitySchema schema) {
        for (Element child : children) {
            String name = localName(child);
            JsonNode value = convert(child, schema);
            if (schema.isArray(name)) {
                JsonNode existing = target.get(name);
                ArrayNode array = existing instanceof ArrayNode ? (ArrayNode) existing : target.putArray(name);
                array.add(value);
            } else {
                if (target.has(name)) {
                    // undeclared repeated element: only the last one survives
                    logger.debug("Collapsing repeated element <{}>, keeping the last occurrence", name);
                }
                target.set(name, value);
            }
        }
    }

    private static ObjectNode attributesOf(Element element) {
        ObjectNode attributes = NODES.objectNode();
        NamedNodeMap map = element.getAttributes();
        for (int i = 0; i < map.getLength(); i++) {
            Attr attr = (Attr) map.item(i);
            if (XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(attr.getNamespaceURI())) {
                continue;
            }
            attributes.put(localName(attr), attr.getValue());
        }
        return attributes;
    }

    private static List<Element> childElements(Element element) {
        List<Element> children = new ArrayList<>();
        NodeList nodes = element.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                children.add((Element) node);
            }
        }
        return children;
    }

    private static String localName(Node node) {
        return node.getLocalName() != null ? node.getLocalName() : node.getNodeName();
    }

    private Document parse(byte[] document) {
        try {
            DocumentBuilder builder = newDocumentBuilderFactory().newDocumentBuilder();
            builder.setErrorHandler(new RaisingErrorHandler());
            return builder.parse(new ByteArrayInputStream(document));
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser cannot be configured", e);
        } catch (SAXException | IOException e) {
            throw new ProtocolException("Response is not a well-formed XML document: " + e.getMessage(), e);
        }
    }

    private static DocumentBuilderFactory newDocumentBuilderFactory() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setXIncludeAware(false);
        factory.setExpandEntityReferences(false);
        return factory;
    }

    private static final class RaisingErrorHandler implements ErrorHandler {

        @Override
        public void warning(SAXParseException exception) {
            logger.debug("XML parser warning: {}", exception.getMessage());
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    }
}
