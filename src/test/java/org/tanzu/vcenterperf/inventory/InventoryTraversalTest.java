package org.tanzu.vcenterperf.inventory;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.tanzu.vcenterperf.error.ProtocolException;
import org.tanzu.vcenterperf.error.SessionException;
import org.tanzu.vcenterperf.error.ValidationException;
import org.tanzu.vcenterperf.soap.ObjectRef;
import org.tanzu.vcenterperf.support.ScriptedTransport;
import org.tanzu.vcenterperf.support.SoapFixtures;
import org.tanzu.vcenterperf.support.VimFixture;

import static org.junit.jupiter.api.Assertions.*;

class InventoryTraversalTest {

    private static final String TWO_VMS =
        "<RetrievePropertiesResponse xmlns=\"urn:vim25\">" +
        "<returnval><obj type=\"VirtualMachine\">vm-101</obj>" +
        "<propSet><name>name</name><val xsi:type=\"xsd:string\">web-01</val></propSet>" +
        "<propSet><name>runtime</name><val xsi:type=\"VirtualMachineRuntimeInfo\">" +
        "<powerState>poweredOn</powerState><host type=\"HostSystem\">host-12</host></val></propSet>" +
        "</returnval>" +
        "<returnval><obj type=\"VirtualMachine\">vm-102</obj>" +
        "<propSet><name>name</name><val xsi:type=\"xsd:string\">db-01</val></propSet>" +
        "</returnval>" +
        "</RetrievePropertiesResponse>";

    @Test
    void blankObjectTypeIsRejectedBeforeTheSessionCheck() {
        VimFixture vim = new VimFixture(ScriptedTransport.withSession());

        ValidationException e = assertThrows(ValidationException.class,
            () -> vim.inventory.retrieve("", Collections.singletonList("name"), false));

        assertEquals("Invalid function call, must supply itemType", e.getMessage());
        assertThrows(ValidationException.class, () -> vim.inventory.retrieve("VirtualMachine", null, false));
        assertEquals(0, vim.transport.getCallCount());
    }

    @Test
    void retrievalBeforeLoginIsASessionErrorWithoutNetworkCall() {
        VimFixture vim = new VimFixture(ScriptedTransport.withSession());

        assertThrows(SessionException.class,
            () -> vim.inventory.retrieve("VirtualMachine", Collections.singletonList("name"), false));

        assertEquals(0, vim.transport.getCallCount());
    }

    @Test
    void requestCarriesPropertyFilterAndTraversalGraph() {
        VimFixture vim = new VimFixture(ScriptedTransport.withSession()
            .respond("RetrieveProperties", "<RetrievePropertiesResponse xmlns=\"urn:vim25\"/>")).login();

        vim.inventory.retrieve("VirtualMachine", Arrays.asList("name", "runtime.powerState"), false);

        String payload = vim.transport.requestsFor("RetrieveProperties").get(0).getPayload();
        assertTrue(payload.contains(
            "<RetrieveProperties xmlns=\"urn:vim25\"><_this type=\"PropertyCollector\">propertyCollector</_this>" +
            "<specSet><propSet><type>VirtualMachine</type><all>false</all>" +
            "<pathSet>name</pathSet><pathSet>runtime.powerState</pathSet></propSet>" +
            "<objectSet><obj type=\"Folder\">group-d1</obj><skip>false</skip>" +
            "<selectSet xsi:type=\"TraversalSpec\"><name>folderTraversalSpec</name><type>Folder</type>" +
            "<path>childEntity</path><skip>false</skip><selectSet><name>folderTraversalSpec</name></selectSet>"),
            payload);
        assertTrue(payload.contains(
            "<selectSet xsi:type=\"TraversalSpec\"><name>hostVmTraversalSpec</name><type>HostSystem</type>" +
            "<path>vm</path><skip>false</skip><selectSet><name>folderTraversalSpec</name></selectSet></selectSet>"));
        assertEquals(InventoryTraversal.DEFAULT_SPECS.size(), count(payload, "xsi:type=\"TraversalSpec\""));
        assertEquals(ScriptedTransport.SESSION_COOKIE,
                     vim.transport.requestsFor("RetrieveProperties").get(0).getHeaders().get("Cookie"));
    }

    @Test
    void propertySetsKeepServerOrderAndUninterpretedValues() {
        VimFixture vim = new VimFixture(ScriptedTransport.withSession().respond("RetrieveProperties", TWO_VMS)).login();

        List<PropertySet> sets = vim.inventory.retrieve("VirtualMachine", Arrays.asList("name", "runtime"), false);

        assertEquals(2, sets.size());
        PropertySet web = sets.get(0);
        assertEquals(new ObjectRef("VirtualMachine", "vm-101"), web.getObj());
        assertEquals("web-01", web.getName());
        assertEquals("poweredOn", web.getProperties().get("runtime").path("powerState").asText());
        assertEquals("VirtualMachineRuntimeInfo", web.getProperties().get("runtime").path("@").path("type").asText());

        PropertySet db = sets.get(1);
        assertEquals("vm-102", db.getObj().getId());
        assertEquals(Collections.singleton("name"), db.getProperties().keySet());
    }

    @Test
    void objectKindIsTheRequestedType() {
        VimFixture vim = new VimFixture(ScriptedTransport.withSession()
            .respond("RetrieveProperties", SoapFixtures.namedObjects("domain-c7", "Cluster A"))).login();

        List<PropertySet> sets = vim.inventory.retrieve("ComputeResource", Collections.singletonList("name"), false);

        assertEquals(new ObjectRef("ComputeResource", "domain-c7"), sets.get(0).getObj());
    }

    @Test
    void emptyInventoryYieldsNoPropertySets() {
        VimFixture vim = new VimFixture(ScriptedTransport.withSession()
            .respond("RetrieveProperties", "<RetrievePropertiesResponse xmlns=\"urn:vim25\"/>")).login();

        assertTrue(vim.inventory.retrieve("HostSystem", Collections.singletonList("name"), true).isEmpty());
        assertTrue(vim.transport.requestsFor("RetrieveProperties").get(0).getPayload().contains("<all>true</all>"));
    }

    @Test
    void answerWithoutResponseElementIsAProtocolError() {
        VimFixture vim = new VimFixture(ScriptedTransport.withSession()
            .respond("RetrieveProperties", "<Something/>")).login();

        assertThrows(ProtocolException.class,
            () -> vim.inventory.retrieve("VirtualMachine", Collections.singletonList("name"), false));
    }

    @Test
    void traversalGraphReferencesOnlyDefinedSpecs() {
        InventoryTraversal.checkGraph(InventoryTraversal.DEFAULT_SPECS);

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> InventoryTraversal.checkGraph(
            Collections.singletonList(TraversalSpec.of("a", "Folder", "childEntity", "missing"))));
        assertEquals("a references unknown traversal spec missing", e.getMessage());
    }

    private static int count(String text, String needle) {
        int count = 0;
        for (int i = text.indexOf(needle); i >= 0; i = text.indexOf(needle, i + 1)) {
            count++;
        }
        return count;
    }
}
