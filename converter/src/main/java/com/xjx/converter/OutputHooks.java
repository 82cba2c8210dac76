package com.xjx.converter;

import com.xjx.xnode.XNode;

import java.util.function.UnaryOperator;

/**
 * Optional hooks around an output: {@code before} sees the transformed tree, {@code after} the produced output.
 * Either may return null to keep its input. A failing hook is logged and its input kept.
 */
public record OutputHooks<O>(UnaryOperator<XNode> before, UnaryOperator<O> after) {

    public static <O> OutputHooks<O> none() {
        return new OutputHooks<>(null, null);
    }

    public static <O> OutputHooks<O> beforeOnly(UnaryOperator<XNode> before) {
        return new OutputHooks<>(before, null);
    }

    public static <O> OutputHooks<O> afterOnly(UnaryOperator<O> after) {
        return new OutputHooks<>(null, after);
    }

    XNode applyBefore(XNode tree) {
        return Hooks.apply("output.before", before, tree);
    }

    O applyAfter(O output) {
        return Hooks.apply("output.after", after, output);
    }
}
