package com.xjx.transform;

/** Pipeline stages, in the order they run for each node. */
public enum Stage {
    NODE,
    VALUE,
    ATTRIBUTE,
    CHILDREN
}
