package com.xjx.transform;

/**
 * A unit of user logic run by the {@link TransformPipeline}. The stage a transformer runs in
 * is fixed by which of the permitted interfaces it implements.
 */
public sealed interface Transformer permits NodeTransformer, ValueTransformer, AttributeTransformer, ChildrenTransformer {

    Stage stage();
}
