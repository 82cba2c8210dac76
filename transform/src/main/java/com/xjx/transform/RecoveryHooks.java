package com.xjx.transform;

import com.xjx.xnode.XNode;
import com.xjx.xnode.context.TransformContext;

import java.util.List;

/**
 * Per-stage recovery for transformer failures. A stage without a hook propagates the failure.
 * When a hook is present its result replaces the failed step and a warning is recorded.
 * If the hook itself fails, the input is kept unchanged.
 */
public record RecoveryHooks(
        StageRecovery<XNode> node,
        StageRecovery<Object> value,
        StageRecovery<AttributeValue> attribute,
        StageRecovery<List<XNode>> children) {

    @FunctionalInterface
    public interface StageRecovery<T> {
        TransformResult<T> recover(RuntimeException error, T input, TransformContext context);

        /** Keeps the input as it was before the failing transformer ran. */
        static <T> StageRecovery<T> keepInput() {
            return (error, input, context) -> TransformResult.keep(input);
        }
    }

    public static RecoveryHooks none() {
        return new RecoveryHooks(null, null, null, null);
    }

    /** Every stage keeps its input when a transformer fails. */
    public static RecoveryHooks keepInputs() {
        return new RecoveryHooks(StageRecovery.keepInput(), StageRecovery.keepInput(),
                StageRecovery.keepInput(), StageRecovery.keepInput());
    }

    public RecoveryHooks withNode(StageRecovery<XNode> hook) {
        return new RecoveryHooks(hook, value, attribute, children);
    }

    public RecoveryHooks withValue(StageRecovery<Object> hook) {
        return new RecoveryHooks(node, hook, attribute, children);
    }

    public RecoveryHooks withAttribute(StageRecovery<AttributeValue> hook) {
        return new RecoveryHooks(node, value, hook, children);
    }

    public RecoveryHooks withChildren(StageRecovery<List<XNode>> hook) {
        return new RecoveryHooks(node, value, attribute, hook);
    }
}
