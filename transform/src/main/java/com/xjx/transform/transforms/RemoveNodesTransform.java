package com.xjx.transform.transforms;

import com.xjx.transform.NodeTransformer;
import com.xjx.transform.TransformResult;
import com.xjx.xnode.XNode;
import com.xjx.xnode.context.TransformContext;

import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/** Removes every node, with its subtree, that matches a predicate. */
public final class RemoveNodesTransform implements NodeTransformer {
    private final Predicate<XNode> predicate;

    public RemoveNodesTransform(Predicate<XNode> predicate) {
        this.predicate = Objects.requireNonNull(predicate, "predicate");
    }

    public static RemoveNodesTransform named(String... names) {
        Set<String> set = Set.of(names);
        return new RemoveNodesTransform(n -> set.contains(n.name()));
    }

    public static RemoveNodesTransform matching(Predicate<XNode> predicate) {
        return new RemoveNodesTransform(predicate);
    }

    @Override
    public TransformResult<XNode> transform(XNode node, TransformContext context) {
        return predicate.test(node) ? TransformResult.remove() : TransformResult.keep(node);
    }
}
