package com.xjx.transform.transforms;

import com.xjx.transform.ChildrenTransformer;
import com.xjx.xnode.XNode;
import com.xjx.xnode.context.TransformContext;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/** Keeps only the children that match a predicate. */
public final class FilterChildrenTransform implements ChildrenTransformer {
    private final Predicate<XNode> keep;

    public FilterChildrenTransform(Predicate<XNode> keep) {
        this.keep = Objects.requireNonNull(keep, "keep");
    }

    public static FilterChildrenTransform keeping(Predicate<XNode> keep) {
        return new FilterChildrenTransform(keep);
    }

    @Override
    public List<XNode> transform(List<XNode> children, TransformContext context) {
        return children.stream().filter(keep).toList();
    }
}
