package com.xjx.xnode;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class XNodesTest {

    @Test
    void attributeOrderIsIrrelevant() {
        XNode a = XNode.record("n").setAttribute("x", "1").setAttribute("y", "2");
        XNode b = XNode.record("n").setAttribute("y", "2").setAttribute("x", "1");
        assertTrue(XNodes.structurallyEqual(a, b));
        assertEquals(a.hashCode(), b.hashCode());
    }

    @Test
    void childOrderIsSignificant() {
        XNode a = XNode.record("n").addChild(XNode.value("x", 1)).addChild(XNode.value("y", 2));
        XNode b = XNode.record("n").addChild(XNode.value("y", 2)).addChild(XNode.value("x", 1));
        assertFalse(XNodes.structurallyEqual(a, b));
    }

    @Test
    void kindNamespaceAndLabelMatter() {
        assertFalse(XNodes.structurallyEqual(XNode.field("a", 1), XNode.value("a", 1)));
        assertFalse(XNodes.structurallyEqual(XNode.record("a").setNs("urn:x"), XNode.record("a")));
        assertFalse(XNodes.structurallyEqual(XNode.record("a").setLabel("p"), XNode.record("a")));
    }

    @Test
    void idIsIgnored() {
        assertTrue(XNodes.structurallyEqual(XNode.record("a").setId("1"), XNode.record("a").setId("2")));
    }

    @Test
    void nullsAreHandled() {
        assertTrue(XNodes.structurallyEqual(null, null));
        assertFalse(XNodes.structurallyEqual(XNode.record("a"), null));
    }
}
