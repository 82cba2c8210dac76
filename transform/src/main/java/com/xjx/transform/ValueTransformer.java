package com.xjx.transform;

import com.xjx.xnode.context.TransformContext;
import com.xjx.xnode.path.PathMatcher;

import java.util.function.Predicate;

/**
 * Rewrites or deletes a scalar value. Runs for node values and, before any attribute
 * transformer, for attribute values. Deleting a value leaves the node in place.
 */
@FunctionalInterface
public non-sealed interface ValueTransformer extends Transformer {

    TransformResult<Object> transform(Object value, TransformContext context);

    @Override
    default Stage stage() {
        return Stage.VALUE;
    }

    default ValueTransformer when(Predicate<TransformContext> condition) {
        ValueTransformer self = this;
        return (value, context) -> condition.test(context) ? self.transform(value, context) : TransformResult.keep(value);
    }

    default ValueTransformer scopedTo(String... patterns) {
        return when(PathMatcher.compile(patterns)::matches);
    }
}
