package com.xjx.xml;

import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.xml.sax.InputSource;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.StringReader;

import static org.junit.jupiter.api.Assertions.*;

class XmlFormatterTest {

    private static Document parse(String xml) throws Exception {
        DocumentBuilderFactory f = DocumentBuilderFactory.newInstance();
        f.setNamespaceAware(true);
        return f.newDocumentBuilder().parse(new InputSource(new StringReader(xml)));
    }

    @Test
    void classify() throws Exception {
        assertEquals(XmlFormatter.Content.EMPTY, XmlFormatter.classify(parse("<a/>").getDocumentElement()));
        assertEquals(XmlFormatter.Content.TEXT_ONLY, XmlFormatter.classify(parse("<a>t</a>").getDocumentElement()));
        assertEquals(XmlFormatter.Content.MIXED, XmlFormatter.classify(parse("<a>t<b/></a>").getDocumentElement()));
        assertEquals(XmlFormatter.Content.STRUCTURED, XmlFormatter.classify(parse("<a> <b/> </a>").getDocumentElement()));
    }

    @Test
    void cdataCountsAsText() throws Exception {
        assertEquals(XmlFormatter.Content.TEXT_ONLY, XmlFormatter.classify(parse("<a><![CDATA[x]]></a>").getDocumentElement()));
        assertEquals(XmlFormatter.Content.MIXED, XmlFormatter.classify(parse("<a><![CDATA[x]]><b/></a>").getDocumentElement()));
    }

    @Test
    void commentsAndInstructionsAreMarkup() throws Exception {
        assertEquals(XmlFormatter.Content.STRUCTURED, XmlFormatter.classify(parse("<a><!--c--><?pi x?></a>").getDocumentElement()));
    }
}
