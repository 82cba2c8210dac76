package com.xjx.xnode;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

public interface XNodes {

    /**
     * Kind, name, value, namespace, label, attributes and children must match.
     * Attribute order does not matter; child order does. Ids and parents are ignored.
     * Numbers compare by numeric value, so {@code 1} equals {@code 1L}.
     */
    static boolean structurallyEqual(XNode a, XNode b) {
        if (a == b) return true;
        if (a == null || b == null) return false;
        if (a.type() != b.type() || !a.name().equals(b.name())) return false;
        if (a.hasValue() != b.hasValue() || !valuesEqual(a.value(), b.value())) return false;
        if (!Objects.equals(a.ns(), b.ns()) || !Objects.equals(a.label(), b.label())) return false;
        if (!attributesEqual(a.attributes(), b.attributes())) return false;
        List<XNode> ac = a.children();
        List<XNode> bc = b.children();
        if (ac.size() != bc.size()) return false;
        for (int i = 0; i < ac.size(); i++) if (!structurallyEqual(ac.get(i), bc.get(i))) return false;
        return true;
    }

    private static boolean attributesEqual(List<XNode> as, List<XNode> bs) {
        if (as.size() != bs.size()) return false;
        for (XNode a : as) {
            XNode match = null;
            for (XNode b : bs) {
                if (b.name().equals(a.name()) && Objects.equals(b.ns(), a.ns())) {
                    match = b;
                    break;
                }
            }
            if (match == null || !structurallyEqual(a, match)) return false;
        }
        return true;
    }

    static boolean valuesEqual(Object a, Object b) {
        return Objects.equals(normalise(a), normalise(b));
    }

    static Object normalise(Object value) {
        if (value instanceof Number n && !(value instanceof BigDecimal)) {
            try {
                return new BigDecimal(n.toString()).stripTrailingZeros();
            } catch (NumberFormatException e) {
                return n.doubleValue(); // NaN, Infinity
            }
        }
        if (value instanceof BigDecimal bd) return bd.stripTrailingZeros();
        return value;
    }
}
