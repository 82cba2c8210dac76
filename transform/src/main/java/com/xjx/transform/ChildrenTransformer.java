package com.xjx.transform;

import com.xjx.xnode.XNode;
import com.xjx.xnode.context.TransformContext;
import com.xjx.xnode.path.PathMatcher;

import java.util.List;
import java.util.function.Predicate;

/**
 * Sees a node's ordered children as one list and returns the list to keep. It may reorder,
 * merge, synthesise or drop entries; returning an empty list removes them all.
 * The context is the owning node's.
 */
@FunctionalInterface
public non-sealed interface ChildrenTransformer extends Transformer {

    List<XNode> transform(List<XNode> children, TransformContext context);

    @Override
    default Stage stage() {
        return Stage.CHILDREN;
    }

    default ChildrenTransformer when(Predicate<TransformContext> condition) {
        ChildrenTransformer self = this;
        return (children, context) -> condition.test(context) ? self.transform(children, context) : children;
    }

    default ChildrenTransformer scopedTo(String... patterns) {
        return when(PathMatcher.compile(patterns)::matches);
    }
}
