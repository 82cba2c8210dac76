package com.xjx.transform.transforms;

import com.xjx.xnode.context.Format;

/** Direction of a typed value transform. */
public enum Intent {
    /** Parse when writing JSON, format when writing XML. */
    AUTO,
    /** Strings become typed values. */
    PARSE,
    /** Typed values become strings. */
    FORMAT;

    Intent resolve(Format target) {
        if (this != AUTO) return this;
        return target == Format.JSON ? PARSE : FORMAT;
    }
}
