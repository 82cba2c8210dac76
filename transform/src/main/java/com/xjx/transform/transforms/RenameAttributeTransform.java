package com.xjx.transform.transforms;

import com.xjx.transform.AttributeTransformer;
import com.xjx.transform.AttributeValue;
import com.xjx.transform.TransformResult;
import com.xjx.xnode.context.TransformContext;

import java.util.Objects;

public final class RenameAttributeTransform implements AttributeTransformer {
    private final String from;
    private final String to;

    public RenameAttributeTransform(String from, String to) {
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
        if (to.isBlank()) throw new IllegalArgumentException("Attribute name must not be blank");
    }

    @Override
    public TransformResult<AttributeValue> transform(AttributeValue attribute, TransformContext context) {
        return TransformResult.keep(attribute.name().equals(from) ? attribute.withName(to) : attribute);
    }
}
