package org.tanzu.vcenterperf.soap;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.tanzu.vcenterperf.error.ErrorKind;
import org.tanzu.vcenterperf.error.ProtocolException;

import static org.junit.jupiter.api.Assertions.*;

class DocumentTranscoderTest {

    private final DocumentTranscoder transcoder = new DocumentTranscoder();

    private static final CardinalitySchema RETURNVAL = CardinalitySchema.builder()
        .arrayUnder("Response", "returnval")
        .build();

    @Test
    void leafElementsBecomeStringsAndNestedElementsBecomeObjects() {
        JsonNode node = transcoder.transcode(
            "<about><name>VMware VirtualCenter</name><build>22617221</build><version><major>8</major></version></about>",
            CardinalitySchema.NONE);

        JsonNode about = node.get("about");
        assertEquals("VMware VirtualCenter", about.get("name").asText());
        assertTrue(about.get("build").isTextual(), "numbers stay text");
        assertEquals("8", about.get("version").get("major").asText());
    }

    @Test
    void forcedArrayFieldIsAnArrayForZeroOneAndManyOccurrences() {
        JsonNode none = transcoder.transcode("<Response/>", RETURNVAL).get("Response");
        JsonNode one = transcoder.transcode("<Response><returnval>a</returnval></Response>", RETURNVAL).get("Response");
        JsonNode many = transcoder.transcode(
            "<Response><returnval>a</returnval><returnval>b</returnval><returnval>c</returnval></Response>",
            RETURNVAL).get("Response");

        assertTrue(none.get("returnval").isArray());
        assertEquals(0, none.get("returnval").size());
        assertTrue(one.get("returnval").isArray());
        assertEquals(1, one.get("returnval").size());
        assertEquals("a", one.get("returnval").get(0).asText());
        assertEquals(3, many.get("returnval").size());
        assertEquals("c", many.get("returnval").get(2).asText());
    }

    @Test
    void forcedArrayKeepsPositionOfFirstOccurrence() {
        JsonNode node = transcoder.transcode(
            "<r><a>1</a><item>x</item><b>2</b><item>y</item></r>", CardinalitySchema.arrays("item")).get("r");

        assertEquals("[\"a\",\"item\",\"b\"]", fieldNames(node));
        assertEquals(2, node.get("item").size());
    }

    @Test
    void undeclaredRepeatedSiblingsCollapseToTheLastOne() {
        JsonNode node = transcoder.transcode(
            "<r><propSet><name>first</name></propSet><propSet><name>second</name></propSet></r>",
            CardinalitySchema.NONE).get("r");

        assertTrue(node.get("propSet").isObject());
        assertEquals("second", node.get("propSet").get("name").asText());
    }

    @Test
    void attributesAreNestedUnderReservedKeyAndNamespaceDeclarationsAreSkipped() {
        JsonNode node = transcoder.transcode(
            "<returnval xmlns=\"urn:vim25\" xmlns:xsi=\"http://www.w3.org/2001/XMLSchema-instance\" " +
            "xsi:type=\"PerfEntityMetricCSV\"><entity type=\"VirtualMachine\">vm-42</entity></returnval>",
            CardinalitySchema.NONE).get("returnval");

        assertEquals("[\"@\",\"entity\"]", fieldNames(node));
        JsonNode attributes = node.get(DocumentTranscoder.ATTRIBUTES_KEY);
        assertEquals(1, attributes.size());
        assertEquals("PerfEntityMetricCSV", attributes.get("type").asText());
        assertEquals("vm-42", node.get("entity").asText(), "leaf attributes are not represented");
    }

    @Test
    void elementNamesAreLocalNames() {
        JsonNode node = transcoder.transcode(
            "<soapenv:Envelope xmlns:soapenv=\"http://schemas.xmlsoap.org/soap/envelope/\">" +
            "<soapenv:Body><x>1</x></soapenv:Body></soapenv:Envelope>", CardinalitySchema.NONE);

        assertEquals("1", node.path("Envelope").path("Body").path("x").asText());
    }

    @Test
    void jsonOutputEscapesControlCharactersBackslashAndQuote() throws Exception {
        JsonNode node = transcoder.transcode(
            "<r><v>tab\there&#13;\nline \\ \"quoted\"</v></r>", CardinalitySchema.NONE);

        String json = transcoder.toJson(node);

        assertFalse(json.contains("\t"));
        assertFalse(json.contains("\n"));
        assertFalse(json.contains("\r"));
        assertTrue(json.contains("\\t"));
        assertTrue(json.contains("\\r\\n"));
        assertTrue(json.contains("\\\\"));
        assertTrue(json.contains("\\\"quoted\\\""));
        assertEquals(node, new ObjectMapper().readTree(json));
    }

    @Test
    void transcodingIsDeterministic() {
        String xml = "<r><returnval><a>1</a></returnval><returnval><a>2</a></returnval><z>last</z></r>";
        CardinalitySchema schema = CardinalitySchema.arrays("returnval");

        String first = transcoder.toJson(transcoder.transcode(xml, schema));
        String second = transcoder.toJson(transcoder.transcode(xml, schema));

        assertEquals(first, second);
    }

    @Test
    void malformedDocumentIsAProtocolError() {
        ProtocolException e = assertThrows(ProtocolException.class,
            () -> transcoder.transcode("<r><unclosed></r>", CardinalitySchema.NONE));
        assertEquals(ErrorKind.PROTOCOL, e.getKind());

        assertThrows(ProtocolException.class,
            () -> transcoder.transcode("Service Unavailable", CardinalitySchema.NONE));
    }

    @Test
    void doctypeDeclarationsAreRejected() {
        String xml = "<?xml version=\"1.0\"?><!DOCTYPE r [<!ENTITY x \"boom\">]><r>&x;</r>";

        assertThrows(ProtocolException.class, () -> transcoder.transcode(xml, CardinalitySchema.NONE));
    }

    private static String fieldNames(JsonNode node) {
        StringBuilder names = new StringBuilder("[");
        node.fieldNames().forEachRemaining(name -> {
            if (names.length() > 1) {
                names.append(',');
            }
            names.append('"').append(name).append('"');
        });
        return names.append(']').toString();
    }
}
