package com.xjx.xml;

import com.xjx.common.exceptions.XjxParseException;
import com.xjx.common.exceptions.XjxProcessingException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.w3c.dom.ProcessingInstruction;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Provider-agnostic tests for DomTypeClass implementations.
 * Concrete providers extend this and add provider-specific assertions.
 */
public abstract class AbstractDomTypeClassTest {

    protected final DomTypeClass dom;

    protected AbstractDomTypeClassTest(DomTypeClass dom) {
        this.dom = dom;
        assertNotNull(this.dom, "provider must not be null");
    }

    @Test
    @DisplayName("parse builds a namespace-aware DOM with attributes")
    void parse_elements_and_attributes() {
        Document doc = dom.parse("<p:root xmlns:p=\"urn:p\" id=\"1\"><p:child>text</p:child></p:root>");
        Element root = doc.getDocumentElement();
        assertEquals("p:root", root.getTagName());
        assertEquals("root", root.getLocalName());
        assertEquals("p", root.getPrefix());
        assertEquals("urn:p", root.getNamespaceURI());
        assertEquals("1", root.getAttribute("id"));
        Element child = (Element) root.getElementsByTagNameNS("urn:p", "child").item(0);
        assertEquals("text", child.getTextContent());
    }

    @Test
    @DisplayName("CDATA, comments and processing instructions are kept as their own nodes")
    void parse_keeps_markup_nodes() {
        Document doc = dom.parse("<r>a<![CDATA[<b>]]><!--c--><?pi data?></r>");
        NodeList kids = doc.getDocumentElement().getChildNodes();
        assertEquals(4, kids.getLength());
        assertEquals(Node.TEXT_NODE, kids.item(0).getNodeType());
        assertEquals(Node.CDATA_SECTION_NODE, kids.item(1).getNodeType());
        assertEquals("<b>", kids.item(1).getNodeValue());
        assertEquals(Node.COMMENT_NODE, kids.item(2).getNodeType());
        assertEquals("c", kids.item(2).getNodeValue());
        ProcessingInstruction pi = (ProcessingInstruction) kids.item(3);
        assertEquals("pi", pi.getTarget());
        assertEquals("data", pi.getData());
    }

    @Test
    void parse_decodes_entities() {
        Document doc = dom.parse("<r>a &lt; b &amp; c &#65;&#x42;</r>");
        assertEquals("a < b & c AB", doc.getDocumentElement().getTextContent());
    }

    @Test
    @DisplayName("an unescaped & is tolerated")
    void parse_escapes_stray_ampersand() {
        Document doc = dom.parse("<r>Fish & Chips</r>");
        assertEquals("Fish & Chips", doc.getDocumentElement().getTextContent());
    }

    @Test
    void malformed_xml_is_a_parse_exception() {
        assertThrows(XjxParseException.class, () -> dom.parse("<r><a></r>"));
        assertThrows(XjxParseException.class, () -> dom.parse("not xml"));
    }

    @Test
    @DisplayName("DTDs do not pull in external entities")
    void external_entities_are_not_resolved() {
        String xxe = "<!DOCTYPE r [<!ENTITY x SYSTEM \"file:///etc/passwd\">]><r>&x;</r>";
        try {
            Document doc = dom.parse(xxe);
            assertFalse(doc.getDocumentElement().getTextContent().contains("root:"));
        } catch (XjxParseException expected) {
            // rejecting the document is fine too
        }
    }

    @Test
    void serialize_round_trips_compact_xml() {
        String xml = "<r a=\"1\"><b>x &amp; y</b><c/><!--note--><![CDATA[raw]]></r>";
        assertEquals(xml, dom.serialize(dom.parse(xml)));
    }

    @Test
    void serialize_writes_namespace_declarations() {
        String xml = "<p:r xmlns:p=\"urn:p\"><p:a/></p:r>";
        assertEquals(xml, dom.serialize(dom.parse(xml)));
    }

    @Test
    void serialize_rejects_comment_with_double_hyphen() {
        Document doc = dom.newDocument();
        Element r = dom.createElement(doc, "r");
        doc.appendChild(r);
        r.appendChild(dom.createComment(doc, "a -- b"));
        assertThrows(XjxProcessingException.class, () -> dom.serialize(doc));
    }

    @Test
    void serialize_rejects_cdata_end_marker() {
        Document doc = dom.newDocument();
        Element r = dom.createElement(doc, "r");
        doc.appendChild(r);
        r.appendChild(dom.createCData(doc, "a ]]> b"));
        assertThrows(XjxProcessingException.class, () -> dom.serialize(doc));
    }

    @Test
    @DisplayName("indented output puts structured children one per line")
    void serialize_indented_structured_content() {
        assertEquals("""
                <a>
                  <b>
                    <c>1</c>
                  </b>
                  <d/>
                </a>""", dom.serialize(dom.parse("<a><b><c>1</c></b><d/></a>"), 2));
        assertEquals("<a>\n    <b>x</b>\n</a>", dom.serialize(dom.parse("<a><b>x</b></a>"), 4));
    }

    @Test
    void serialize_indented_keeps_mixed_content_inline() {
        String xml = "<p>Hello <b>big</b> world</p>";
        assertEquals(xml, dom.serialize(dom.parse(xml), 2));
    }

    @Test
    void serialize_indented_replaces_existing_layout_whitespace() {
        assertEquals("<a>\n  <b/>\n</a>", dom.serialize(dom.parse("<a>\n\n      <b></b>   </a>"), 2));
    }

    @Test
    void serialize_indented_escapes_and_keeps_markup() {
        String out = dom.serialize(dom.parse("<a><!--c--><?pi x?><b>1 &lt; 2 &amp; 3</b><e><![CDATA[<raw>]]></e></a>"), 2);
        assertEquals("""
                <a>
                  <!--c-->
                  <?pi x?>
                  <b>1 &lt; 2 &amp; 3</b>
                  <e><![CDATA[<raw>]]></e>
                </a>""", out);
        assertEquals("<a t=\"&quot;x&quot; &amp;\"/>", dom.serialize(dom.parse("<a t='\"x\" &amp;'/>"), 2));
    }

    @Test
    void serialize_indented_writes_namespace_declarations() {
        String xml = "<p:r xmlns:p=\"urn:p\">\n  <p:a/>\n</p:r>";
        assertEquals(xml, dom.serialize(dom.parse("<p:r xmlns:p=\"urn:p\"><p:a/></p:r>"), 2));
    }

    @Test
    @DisplayName("a carriage return in text survives writing and reading back")
    void serialize_keeps_carriage_returns() {
        Document doc = dom.newDocument();
        Element r = dom.createElement(doc, "r");
        doc.appendChild(r);
        r.appendChild(dom.createText(doc, "a\rb"));
        assertEquals("a\rb", dom.parse(dom.serialize(doc, 2)).getDocumentElement().getTextContent());
        assertEquals("a\rb", dom.parse(dom.serialize(doc)).getDocumentElement().getTextContent());
    }

    @Test
    void serialize_indented_rejects_comment_with_double_hyphen() {
        Document doc = dom.newDocument();
        Element r = dom.createElement(doc, "r");
        doc.appendChild(r);
        r.appendChild(dom.createElement(doc, "a"));
        r.appendChild(dom.createComment(doc, "a -- b"));
        assertThrows(XjxProcessingException.class, () -> dom.serialize(doc, 2));
    }

    @Test
    void construction_helpers_build_namespaced_nodes() {
        Document doc = dom.newDocument();
        Element r = dom.createElement(doc, "urn:x", "x:r");
        doc.appendChild(r);
        dom.setAttribute(r, "http://www.w3.org/2000/xmlns/", "xmlns:x", "urn:x");
        dom.setAttribute(r, "plain", "v");
        r.appendChild(dom.createText(doc, "t"));
        r.appendChild(dom.createInstruction(doc, "go", "now"));
        assertEquals("urn:x", r.getNamespaceURI());
        assertEquals("v", r.getAttribute("plain"));
        assertEquals("<x:r xmlns:x=\"urn:x\" plain=\"v\">t<?go now?></x:r>", dom.serialize(doc));
    }
}
