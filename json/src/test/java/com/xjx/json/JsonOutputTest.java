package com.xjx.json;

import com.xjx.config.JsonOutputConfig;
import com.xjx.config.JsonSourceConfig;
import com.xjx.xnode.XNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class JsonOutputTest {

    private static final JsonOutput COMPACT = new JsonOutput(new JsonOutputConfig(false, 2, "@"));

    private static XNode items() {
        return XNode.record("root")
                .addChild(XNode.record("item").setAttribute("id", "1").setValue("A"))
                .addChild(XNode.record("item").setAttribute("id", "2").setValue("B"));
    }

    @Nested
    class Standard {
        @Test
        @DisplayName("same-named siblings are grouped into an array, attributes are prefixed")
        void groupsRepeatedChildren() {
            assertEquals("{\"root\":{\"item\":[{\"@id\":\"1\",\"#value\":\"A\"},{\"@id\":\"2\",\"#value\":\"B\"}]}}",
                    COMPACT.toJsonString(items()));
        }

        @Test
        void recordWithOnlyAValueIsAScalar() {
            assertEquals("{\"flag\":true}", COMPACT.toJsonString(XNode.record("flag").setValue(true)));
            assertEquals("{\"flag\":\"true\"}", COMPACT.toJsonString(XNode.record("flag").setValue("true")));
        }

        @Test
        void loneChildrenAreNotWrapped() {
            XNode root = XNode.record("root")
                    .addChild(XNode.value("a", 1))
                    .addChild(XNode.field("none"))
                    .addChild(XNode.record("empty"));
            assertEquals("{\"root\":{\"a\":1,\"none\":null,\"empty\":{}}}", COMPACT.toJsonString(root));
        }

        @Test
        void collectionsBecomeArrays() {
            XNode tags = XNode.collection("tags").addChild(XNode.value("item", "a")).addChild(XNode.value("item", "b"));
            assertEquals("{\"root\":{\"tags\":[\"a\",\"b\"]}}", COMPACT.toJsonString(XNode.record("root").addChild(tags)));
            assertEquals("{\"tags\":[\"a\",\"b\"]}", COMPACT.toJsonString(tags.detach()));
        }

        @Test
        void fieldWithChildrenBecomesAnObject() {
            XNode f = XNode.field("f", "v").addChild(XNode.value("x", 1));
            assertEquals("{\"f\":{\"x\":1,\"#value\":\"v\"}}", COMPACT.toJsonString(f));
        }

        @Test
        void markupUsesMarkerKeys() {
            XNode p = XNode.record("p")
                    .addChild(XNode.text("Hello "))
                    .addChild(XNode.record("b").setValue("big"))
                    .addChild(XNode.text(" world"))
                    .addChild(XNode.comment("c"))
                    .addChild(XNode.data("<x>"))
                    .addChild(XNode.instruction("pi", "go"));
            assertEquals("{\"p\":{\"#text\":[\"Hello \",\" world\"],\"b\":\"big\",\"#comment\":\"c\",\"#cdata\":\"<x>\",\"?pi\":\"go\"}}",
                    COMPACT.toJsonString(p));
        }

        @Test
        void numbersAreWrittenPlain() {
            XNode r = XNode.record("r").addChild(XNode.value("big", new BigDecimal("1E+3"))).addChild(XNode.value("d", 2.5));
            assertEquals("{\"r\":{\"big\":1000,\"d\":2.5}}", COMPACT.toJsonString(r));
        }

        @Test
        void attributePrefixIsConfigurable() {
            JsonOutput out = new JsonOutput(new JsonOutputConfig(false, 2, "_"));
            assertEquals("{\"r\":{\"_a\":\"1\"}}", out.toJsonString(XNode.record("r").setAttribute("a", "1")));
        }

        @Test
        void prettyPrintIndents() {
            String pretty = new JsonOutput(JsonOutputConfig.defaults()).toJsonString(items());
            assertTrue(pretty.startsWith("{\n  \"root\""), pretty);
            assertEquals(Json.parse(COMPACT.toJsonString(items())), Json.parse(pretty));
        }

        @Test
        @DisplayName("standard output reads back to the same record-shaped tree")
        void readsBack() {
            XNode read = new JsonSource(JsonSourceConfig.defaults()).fromJson(COMPACT.toJsonString(items()));
            assertEquals("root", read.name());
            XNode group = read.findChild("item").orElseThrow();
            assertEquals(2, group.children().size());
            assertEquals("B", group.children().get(1).value());
            assertEquals("2", group.children().get(1).findAttribute("id").orElseThrow().value());
        }
    }

    @Nested
    class HighFidelity {
        @Test
        void writesEveryMarker() {
            XNode root = XNode.record("root").setNs("urn:x").setLabel("x").setId("r1")
                    .setAttribute("a", "1")
                    .addChild(XNode.field("f", null));
            assertEquals("{\"#type\":\"record\",\"#name\":\"root\",\"#id\":\"r1\",\"#ns\":\"urn:x\",\"#label\":\"x\","
                            + "\"#attributes\":[{\"#type\":\"attribute\",\"#name\":\"a\",\"#value\":\"1\"}],"
                            + "\"#children\":[{\"#type\":\"field\",\"#name\":\"f\",\"#value\":null}]}",
                    COMPACT.toHiFiString(root));
        }

        @Test
        void absentValueIsOmitted() {
            assertFalse(COMPACT.toHiFi(XNode.field("f")).has(JsonMarkers.VALUE));
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "{\"root\":{\"item\":[{\"@id\":\"1\",\"#value\":\"A\"},{\"@id\":\"2\",\"#value\":\"B\"}]}}",
                "{\"a\":1,\"b\":[true,null,\"x\",{\"c\":1.25}],\"d\":{}}",
                "{\"p\":{\"#text\":[\"Hello \",\" world\"],\"#comment\":\"c\",\"?pi\":\"go\",\"#cdata\":\"<x>\"}}",
                "[1,[2,3],\"x\"]",
                "42"
        })
        @DisplayName("hi-fi output reads back to an equal tree")
        void idempotent(String json) {
            JsonSource source = new JsonSource(JsonSourceConfig.defaults());
            XNode tree = source.fromJson(json);
            XNode again = source.fromHiFi(COMPACT.toHiFiString(tree));
            assertEquals(tree, again);
            assertEquals(COMPACT.toHiFiString(tree), COMPACT.toHiFiString(again));
        }

        @Test
        void idsAndNamespacesSurvive() {
            XNode tree = XNode.record("p:root").setNs("urn:p").setLabel("p").setId("n1")
                    .addChild(XNode.instruction("go", "now"));
            XNode again = new JsonSource(JsonSourceConfig.defaults()).fromHiFi(COMPACT.toHiFi(tree));
            assertEquals(tree, again);
            assertEquals("n1", again.id());
        }
    }
}
