package com.xjx.common.exceptions;

/** Failure while converting or transforming an already valid input. */
public final class XjxProcessingException extends XjxException {
    public XjxProcessingException(String message, Throwable cause) { super(message, cause); }
    public XjxProcessingException(String message) { super(message); }
}
