package com.xjx.transform;

import com.xjx.xnode.context.TransformContext;
import com.xjx.xnode.path.PathMatcher;

import java.util.function.Predicate;

/** Renames or removes one attribute. Never touches the owning node or its other attributes. */
@FunctionalInterface
public non-sealed interface AttributeTransformer extends Transformer {

    TransformResult<AttributeValue> transform(AttributeValue attribute, TransformContext context);

    @Override
    default Stage stage() {
        return Stage.ATTRIBUTE;
    }

    default AttributeTransformer when(Predicate<TransformContext> condition) {
        AttributeTransformer self = this;
        return (attribute, context) -> condition.test(context) ? self.transform(attribute, context) : TransformResult.keep(attribute);
    }

    default AttributeTransformer scopedTo(String... patterns) {
        return when(PathMatcher.compile(patterns)::matches);
    }
}
