package com.xjx.common.exceptions;

/** Malformed XML or JSON text, or a JSON value that refers to itself. */
public final class XjxParseException extends XjxException {
    public XjxParseException(String message, Throwable cause) { super(message, cause); }
    public XjxParseException(String message) { super(message); }
}
