package com.xjx.transform;

import com.xjx.xnode.XNode;
import com.xjx.xnode.context.TransformContext;
import com.xjx.xnode.path.PathMatcher;

import java.util.function.Predicate;

/** Replaces or removes a whole node. Removing a node drops its subtree. */
@FunctionalInterface
public non-sealed interface NodeTransformer extends Transformer {

    TransformResult<XNode> transform(XNode node, TransformContext context);

    @Override
    default Stage stage() {
        return Stage.NODE;
    }

    default NodeTransformer when(Predicate<TransformContext> condition) {
        NodeTransformer self = this;
        return (node, context) -> condition.test(context) ? self.transform(node, context) : TransformResult.keep(node);
    }

    default NodeTransformer scopedTo(String... patterns) {
        return when(PathMatcher.compile(patterns)::matches);
    }
}
