package com.xjx.xml;

import com.xjx.common.exceptions.XjxProcessingException;

/**
 * Well-formedness checks for character data written as XML. Escaping is left to the
 * provider's writer. Checks throw {@link XjxProcessingException}; nothing is silently repaired.
 */
public interface XmlEscapes {

    /** Every character must be allowed by XML 1.0: tab, LF, CR, and the ranges from #x20. */
    static String checkChars(String s, String where) {
        for (int i = 0; i < s.length(); ) {
            int cp = s.codePointAt(i);
            if (!isXmlChar(cp))
                throw new XjxProcessingException("Invalid XML character U+" + String.format("%04X", cp) + " in " + where);
            i += Character.charCount(cp);
        }
        return s;
    }

    static boolean isXmlChar(int cp) {
        return cp == 0x9 || cp == 0xA || cp == 0xD
                || (cp >= 0x20 && cp <= 0xD7FF)
                || (cp >= 0xE000 && cp <= 0xFFFD)
                || (cp >= 0x10000 && cp <= 0x10FFFF);
    }

    static String checkComment(String s) {
        checkChars(s, "comment");
        if (s.contains("--")) throw new XjxProcessingException("Comment must not contain '--': " + s);
        if (s.endsWith("-")) throw new XjxProcessingException("Comment must not end with '-': " + s);
        return s;
    }

    static String checkCData(String s) {
        checkChars(s, "CDATA section");
        if (s.contains("]]>")) throw new XjxProcessingException("CDATA section must not contain ']]>'");
        return s;
    }

    static String checkInstruction(String target, String data) {
        if (target == null || target.isBlank() || target.equalsIgnoreCase("xml"))
            throw new XjxProcessingException("Invalid processing instruction target '" + target + "'");
        checkChars(data, "processing instruction " + target);
        if (data.contains("?>")) throw new XjxProcessingException("Processing instruction data must not contain '?>'");
        return data;
    }
}
