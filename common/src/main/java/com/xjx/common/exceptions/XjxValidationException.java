package com.xjx.common.exceptions;

/** Input rejected before any tree is built. */
public final class XjxValidationException extends XjxException {
    public XjxValidationException(String message, Throwable cause) { super(message, cause); }
    public XjxValidationException(String message) { super(message); }
}
