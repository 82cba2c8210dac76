package com.xjx.xnode.context;

/** The format a conversion writes to. Transformers use it to pick a direction. */
public enum Format {
    XML,
    JSON
}
