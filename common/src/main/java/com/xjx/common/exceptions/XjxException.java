package com.xjx.common.exceptions;

/** Root of every failure a conversion can raise. */
public abstract class XjxException extends RuntimeException {
    protected XjxException(String message, Throwable cause) { super(message, cause); }
    protected XjxException(String message) { super(message); }
}
