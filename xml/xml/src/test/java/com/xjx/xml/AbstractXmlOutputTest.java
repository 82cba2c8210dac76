package com.xjx.xml;

import com.xjx.common.exceptions.XjxProcessingException;
import com.xjx.config.CollectionHandling;
import com.xjx.config.NamespacePrefixHandling;
import com.xjx.config.XmlOutputConfig;
import com.xjx.config.XmlSourceConfig;
import com.xjx.xnode.XNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.w3c.dom.Document;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Node tree to XML behaviour, run against each DOM provider.
 */
public abstract class AbstractXmlOutputTest {

    protected final DomTypeClass dom;

    protected AbstractXmlOutputTest(DomTypeClass dom) {
        this.dom = dom;
    }

    protected static final XmlOutputConfig COMPACT = XmlOutputConfig.defaults().withPrettyPrint(false).withDeclaration(false);

    protected String write(XNode root) {
        return write(root, COMPACT);
    }

    protected String write(XNode root, XmlOutputConfig config) {
        return new XmlOutput(dom, config).toXmlString(root);
    }

    private static XmlOutputConfig compactWith(NamespacePrefixHandling handling) {
        return new XmlOutputConfig(false, 2, false, "UTF-8", true, handling, CollectionHandling.REPEAT);
    }

    private XNode items() {
        XNode items = XNode.collection("item");
        items.addChild(XNode.record("item").setAttribute("id", "1").setValue("A"));
        items.addChild(XNode.record("item").setAttribute("id", "2").setValue("B"));
        return XNode.record("root").addChild(items);
    }

    @Nested
    class Elements {
        @Test
        void recordsFieldsAndValuesBecomeElements() {
            XNode root = XNode.record("root").setAttribute("id", "1")
                    .addChild(XNode.value("a", "x"))
                    .addChild(XNode.field("n", 5))
                    .addChild(XNode.field("b", true))
                    .addChild(XNode.field("none", null))
                    .addChild(XNode.record("empty"));
            assertEquals("<root id=\"1\"><a>x</a><n>5</n><b>true</b><none/><empty/></root>", write(root));
        }

        @Test
        void specialCharactersAreEscaped() {
            assertEquals("<r a=\"&lt;&amp;&quot;\">1 &lt; 2 &amp; 3</r>",
                    write(XNode.record("r").setAttribute("a", "<&\"").setValue("1 < 2 & 3")));
        }

        @Test
        @DisplayName("an @-prefixed field becomes an attribute of its parent")
        void markerFieldsBecomeAttributes() {
            XNode item = XNode.record("item").setValue("A").addChild(XNode.field("@id", "1"));
            assertEquals("<item id=\"1\">A</item>", write(item));
        }

        @Test
        @DisplayName("#text, #cdata and #comment children become markup, in order")
        void markerChildrenBecomeMarkup() {
            XNode p = XNode.record("p")
                    .addChild(XNode.value(XNode.TEXT, "Hello "))
                    .addChild(XNode.record("b").setValue("big"))
                    .addChild(XNode.value(XNode.COMMENT, "c"))
                    .addChild(XNode.field(XNode.CDATA, "<x>"))
                    .addChild(XNode.instruction("pi", "go"));
            assertEquals("<p>Hello <b>big</b><!--c--><![CDATA[<x>]]><?pi go?></p>", write(p));
        }

        @Test
        void mixedContentRoundTrips() {
            String xml = "<p>Hello <b>big</b> world<!--c--></p>";
            assertEquals(xml, write(new XmlSource(dom, XmlSourceConfig.defaults()).fromXml(xml)));
        }
    }

    @Nested
    class Collections {
        @Test
        @DisplayName("repeat writes collection items as repeated siblings")
        void repeat() {
            assertEquals("<root><item id=\"1\">A</item><item id=\"2\">B</item></root>", write(items()));
        }

        @Test
        void repeatUsesTheCollectionNameForItems() {
            XNode tags = XNode.collection("tags").addChild(XNode.value("item", "a")).addChild(XNode.value("item", "b"));
            assertEquals("<root><tags>a</tags><tags>b</tags></root>", write(XNode.record("root").addChild(tags)));
        }

        @Test
        void wrapKeepsTheCollectionElement() {
            XNode tags = XNode.collection("tags").addChild(XNode.value("tag", "a")).addChild(XNode.value("tag", "b"));
            assertEquals("<root><tags><tag>a</tag><tag>b</tag></tags></root>",
                    write(XNode.record("root").addChild(tags), COMPACT.withCollectionHandling(CollectionHandling.WRAP)));
        }

        @ParameterizedTest
        @ValueSource(strings = {"repeat", "wrap"})
        void rootCollectionIsAlwaysWrapped(String handling) {
            XNode list = XNode.collection("list").addChild(XNode.value("item", 1)).addChild(XNode.value("item", 2));
            assertEquals("<list><item>1</item><item>2</item></list>",
                    write(list, COMPACT.withCollectionHandling(CollectionHandling.fromCode(handling))));
        }
    }

    @Nested
    class Namespaces {
        @Test
        void preserveDeclaresEachBindingOnce() {
            XNode root = XNode.record("p:root").setNs("urn:p")
                    .addChild(XNode.record("p:child").setNs("urn:p").setValue("x"))
                    .addChild(XNode.record("plain").setNs("urn:d").setValue("y"));
            assertEquals("<p:root xmlns:p=\"urn:p\"><p:child>x</p:child><plain xmlns=\"urn:d\">y</plain></p:root>",
                    write(root, compactWith(NamespacePrefixHandling.PRESERVE)));
        }

        @Test
        void labelSuppliesThePrefix() {
            XNode root = XNode.record("root").setNs("urn:p").setLabel("p");
            assertEquals("<p:root xmlns:p=\"urn:p\"/>", write(root, compactWith(NamespacePrefixHandling.LABEL)));
        }

        @Test
        void stripUsesTheDefaultNamespace() {
            XNode root = XNode.record("p:root").setNs("urn:p").addChild(XNode.record("p:child").setNs("urn:p").setValue("x"));
            assertEquals("<root xmlns=\"urn:p\"><child>x</child></root>", write(root, compactWith(NamespacePrefixHandling.STRIP)));
        }

        @Test
        void defaultNamespaceIsUndeclaredForUnqualifiedChildren() {
            XNode root = XNode.record("root").setNs("urn:d").addChild(XNode.value("a", "v"));
            assertEquals("<root xmlns=\"urn:d\"><a xmlns=\"\">v</a></root>", write(root));
        }

        @Test
        void namespacedAttributeWithoutPrefixGetsOne() {
            XNode root = XNode.record("r").addAttribute(XNode.attribute("a", "1").setNs("urn:x"));
            assertEquals("<r xmlns:ns0=\"urn:x\" ns0:a=\"1\"/>", write(root));
        }

        @Test
        void xmlPrefixIsNeverDeclared() {
            XNode root = XNode.record("r").addAttribute(XNode.attribute("xml:lang", "en").setNs("http://www.w3.org/XML/1998/namespace"));
            assertEquals("<r xml:lang=\"en\"/>", write(root));
        }

        @Test
        void namespacesCanBeDropped() {
            XmlOutputConfig noNs = new XmlOutputConfig(false, 2, false, "UTF-8", false, NamespacePrefixHandling.PRESERVE,
                    CollectionHandling.REPEAT);
            assertEquals("<root/>", write(XNode.record("p:root").setNs("urn:p"), noNs));
        }

        @Test
        void namespacedDocumentRoundTrips() {
            String xml = "<p:root xmlns:p=\"urn:p\"><p:child p:a=\"1\">x</p:child></p:root>";
            XNode tree = new XmlSource(dom, XmlSourceConfig.defaults()).fromXml(xml);
            assertEquals(tree, new XmlSource(dom, XmlSourceConfig.defaults()).fromXml(write(tree)));
        }
    }

    @Nested
    class Printing {
        @Test
        @DisplayName("default output is pretty printed with a declaration")
        void prettyWithDeclaration() {
            XNode root = XNode.record("root").addChild(XNode.record("a").addChild(XNode.value("b", "1")))
                    .addChild(XNode.record("p").addChild(XNode.text("x ")).addChild(XNode.value("i", "y")));
            assertEquals("""
                    <?xml version="1.0" encoding="UTF-8"?>
                    <root>
                      <a>
                        <b>1</b>
                      </a>
                      <p>x <i>y</i></p>
                    </root>""", write(root, XmlOutputConfig.defaults()));
        }

        @Test
        void declarationUsesTheConfiguredEncoding() {
            XmlOutputConfig c = new XmlOutputConfig(false, 2, true, "ISO-8859-1", true, NamespacePrefixHandling.PRESERVE,
                    CollectionHandling.REPEAT);
            assertEquals("<?xml version=\"1.0\" encoding=\"ISO-8859-1\"?><r/>", write(XNode.record("r"), c));
        }

        @Test
        void toDocumentBuildsADom() {
            Document doc = new XmlOutput(dom, COMPACT).toDocument(items());
            assertEquals("root", doc.getDocumentElement().getTagName());
            assertEquals(2, doc.getDocumentElement().getElementsByTagName("item").getLength());
        }
    }

    @Nested
    class Failures {
        @Test
        void badCommentFails() {
            assertThrows(XjxProcessingException.class, () -> write(XNode.record("r").addChild(XNode.comment("a--b"))));
        }

        @Test
        void badCDataFails() {
            assertThrows(XjxProcessingException.class, () -> write(XNode.record("r").addChild(XNode.data("a]]>b"))));
        }

        @Test
        void badInstructionFails() {
            assertThrows(XjxProcessingException.class, () -> write(XNode.record("r").addChild(XNode.instruction("pi", "?>"))));
        }

        @Test
        void invalidCharacterFails() {
            assertThrows(XjxProcessingException.class, () -> write(XNode.record("r").setValue("a\u0000b")));
        }

        @Test
        void invalidElementNameFails() {
            assertThrows(XjxProcessingException.class, () -> write(XNode.record("r").addChild(XNode.value("1bad", "x"))));
        }

        @Test
        void nonElementRootFails() {
            assertThrows(XjxProcessingException.class, () -> write(XNode.comment("c")));
            assertThrows(XjxProcessingException.class, () -> write(XNode.text("t")));
        }
    }

    @Test
    @DisplayName("xml -> tree -> xml -> tree is stable for record-shaped documents")
    void roundTrip() {
        String xml = """
                <root>
                  <a x="1">t</a>
                  <b>
                    <c>2</c>
                    <c>3</c>
                  </b>
                </root>""";
        XmlSource source = new XmlSource(dom, XmlSourceConfig.defaults());
        XNode first = source.fromXml(xml);
        XNode second = source.fromXml(write(first, XmlOutputConfig.defaults()));
        assertEquals(first, second);
        assertEquals(xml, write(second, XmlOutputConfig.defaults().withDeclaration(false)));
    }
}
