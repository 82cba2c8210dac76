package com.xjx.converter;

import com.xjx.xnode.XNode;

import java.util.function.UnaryOperator;

/**
 * Optional hooks around a source: {@code before} sees the raw input, {@code after} the tree built from it.
 * Either may return null to keep its input. A failing hook is logged and its input kept.
 */
public record SourceHooks<I>(UnaryOperator<I> before, UnaryOperator<XNode> after) {

    public static <I> SourceHooks<I> none() {
        return new SourceHooks<>(null, null);
    }

    public static <I> SourceHooks<I> beforeOnly(UnaryOperator<I> before) {
        return new SourceHooks<>(before, null);
    }

    public static <I> SourceHooks<I> afterOnly(UnaryOperator<XNode> after) {
        return new SourceHooks<>(null, after);
    }

    I applyBefore(I input) {
        return Hooks.apply("source.before", before, input);
    }

    XNode applyAfter(XNode tree) {
        return Hooks.apply("source.after", after, tree);
    }
}
