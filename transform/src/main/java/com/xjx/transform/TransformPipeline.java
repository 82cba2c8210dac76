package com.xjx.transform;

import com.xjx.common.exceptions.XjxException;
import com.xjx.common.exceptions.XjxProcessingException;
import com.xjx.config.XjxConfig;
import com.xjx.xnode.XNode;
import com.xjx.xnode.context.Format;
import com.xjx.xnode.context.TransformContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Runs transformers over a tree, depth-first, mutating it in place. For each node:
 * node stage, value stage, attribute stage (values first, then attribute transformers),
 * children stage, then the surviving children. Within a stage transformers run in
 * registration order and each sees the previous one's output.
 * <p>
 * A pipeline is immutable and may be shared; a single {@link #run} must own its tree.
 */
public final class TransformPipeline {
    private static final Logger log = LoggerFactory.getLogger(TransformPipeline.class);

    private final List<NodeTransformer> nodeTransformers;
    private final List<ValueTransformer> valueTransformers;
    private final List<AttributeTransformer> attributeTransformers;
    private final List<ChildrenTransformer> childrenTransformers;
    private final RecoveryHooks recovery;

    private TransformPipeline(Builder b) {
        this.nodeTransformers = List.copyOf(b.nodeTransformers);
        this.valueTransformers = List.copyOf(b.valueTransformers);
        this.attributeTransformers = List.copyOf(b.attributeTransformers);
        this.childrenTransformers = List.copyOf(b.childrenTransformers);
        this.recovery = b.recovery;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static TransformPipeline of(List<? extends Transformer> transformers) {
        return builder().add(transformers).build();
    }

    public boolean isEmpty() {
        return nodeTransformers.isEmpty() && valueTransformers.isEmpty()
                && attributeTransformers.isEmpty() && childrenTransformers.isEmpty();
    }

    public record Outcome(XNode root, List<TransformWarning> warnings) {
    }

    /**
     * @return the (possibly replaced) root and the warnings recorded by recovery
     * @throws XjxProcessingException if a transformer fails without a recovery hook, or the root is removed
     */
    public Outcome run(XNode root, Format format, XjxConfig config) {
        Objects.requireNonNull(root, "root");
        if (isEmpty()) return new Outcome(root, List.of());
        log.debug("Transforming {} for {} with {} node, {} value, {} attribute, {} children transformers",
                root.name(), format, nodeTransformers.size(), valueTransformers.size(),
                attributeTransformers.size(), childrenTransformers.size());
        Run run = new Run();
        XNode result = run.visit(root, TransformContext.root(root, format, config));
        if (result == null) throw new XjxProcessingException("Transform removed the root node '" + root.name() + "'");
        return new Outcome(result, List.copyOf(run.warnings));
    }

    private final class Run {
        private final List<TransformWarning> warnings = new ArrayList<>();

        /** Returns the node now standing in this position, or null if it was removed. */
        XNode visit(XNode node, TransformContext nodeContext) {
            // Node stage
            for (NodeTransformer t : nodeTransformers) {
                XNode current = node;
                TransformContext ctx = nodeContext;
                TransformResult<XNode> r = apply(Stage.NODE, ctx, node, recovery.node(), in -> t.transform(in, ctx));
                if (r.removed()) {
                    log.debug("Removed {}", ctx.path());
                    // an earlier replacement may hold the position now
                    if (node.parent() != null) node.detach();
                    return null;
                }
                node = r.value() == null ? current : r.value();
                if (node != current) {
                    if (current.parent() != null) current.replaceWith(node);
                    nodeContext = nodeContext.withNode(node);
                }
            }
            TransformContext context = nodeContext;

            // Value stage
            if (node.hasValue() && !valueTransformers.isEmpty()) {
                TransformResult<Object> r = transformValue(node.value(), context);
                if (r.removed()) node.clearValue();
                else node.setValue(r.value());
            }

            // Attribute stage
            if (node.hasAttributes() && (!valueTransformers.isEmpty() || !attributeTransformers.isEmpty())) {
                List<XNode> kept = new ArrayList<>();
                Set<String> names = new HashSet<>();
                for (XNode attr : node.attributes()) {
                    XNode updated = transformAttribute(attr, context.attribute(attr));
                    if (updated == null) continue;
                    if (!names.add(updated.name()))
                        throw new XjxProcessingException("Attribute '" + updated.name() + "' appears twice on '"
                                + context.path() + "' after the attribute stage");
                    kept.add(updated);
                }
                node.replaceAttributes(kept);
            }

            // Children stage
            if (!childrenTransformers.isEmpty()) {
                List<XNode> children = new ArrayList<>(node.children());
                for (ChildrenTransformer t : childrenTransformers) {
                    List<XNode> input = children;
                    TransformResult<List<XNode>> r = apply(Stage.CHILDREN, context, input, recovery.children(),
                            in -> TransformResult.keep(t.transform(in, context)));
                    children = r.removed() || r.value() == null ? new ArrayList<>() : new ArrayList<>(r.value());
                }
                node.replaceChildren(children);
            }

            // Recurse
            for (XNode child : new ArrayList<>(node.children())) {
                XNode result = visit(child, context.child(child));
                if (result == null) node.removeChild(child);
            }
            return node;
        }

        private TransformResult<Object> transformValue(Object value, TransformContext context) {
            for (ValueTransformer t : valueTransformers) {
                TransformResult<Object> r = apply(Stage.VALUE, context, value, recovery.value(), in -> t.transform(in, context));
                if (r.removed()) return r;
                value = r.value();
            }
            return TransformResult.keep(value);
        }

        private XNode transformAttribute(XNode attr, TransformContext context) {
            Object value = attr.value();
            boolean hasValue = attr.hasValue();
            if (hasValue) {
                TransformResult<Object> r = transformValue(value, context);
                if (r.removed()) hasValue = false;
                value = r.removed() ? null : r.value();
            }
            AttributeValue current = new AttributeValue(attr.name(), value);
            for (AttributeTransformer t : attributeTransformers) {
                AttributeValue input = current;
                TransformResult<AttributeValue> r = apply(Stage.ATTRIBUTE, context, input, recovery.attribute(),
                        in -> t.transform(in, context));
                if (r.removed()) {
                    log.debug("Removed attribute {}", context.path());
                    return null;
                }
                if (r.value() != null) current = r.value();
            }
            if (!current.name().equals(attr.name())) attr.setName(current.name());
            if (hasValue || current.value() != null) attr.setValue(current.value());
            else attr.clearValue();
            return attr;
        }

        private <T> TransformResult<T> apply(Stage stage, TransformContext context, T input,
                                             RecoveryHooks.StageRecovery<T> hook,
                                             Function<T, TransformResult<T>> step) {
            try {
                TransformResult<T> r = step.apply(input);
                return r == null ? TransformResult.keep(input) : r;
            } catch (RuntimeException e) {
                if (hook == null) {
                    if (e instanceof XjxException xe) throw xe;
                    throw new XjxProcessingException("Transformer failed in " + stage + " stage at '"
                            + context.path() + "': " + e.getMessage(), e);
                }
                try {
                    TransformResult<T> recovered = hook.recover(e, input, context);
                    String message = "recovered from " + e.getClass().getSimpleName() + ": " + e.getMessage();
                    log.warn("Transformer failed in {} stage at '{}', {}", stage, context.path(), message);
                    warnings.add(new TransformWarning(stage, context.path(), message));
                    return recovered == null ? TransformResult.keep(input) : recovered;
                } catch (RuntimeException hookError) {
                    log.warn("Recovery hook failed in {} stage at '{}', keeping input", stage, context.path(), hookError);
                    warnings.add(new TransformWarning(stage, context.path(),
                            "recovery hook failed: " + hookError.getMessage() + "; input kept"));
                    return TransformResult.keep(input);
                }
            }
        }
    }

    public static final class Builder {
        private final List<NodeTransformer> nodeTransformers = new ArrayList<>();
        private final List<ValueTransformer> valueTransformers = new ArrayList<>();
        private final List<AttributeTransformer> attributeTransformers = new ArrayList<>();
        private final List<ChildrenTransformer> childrenTransformers = new ArrayList<>();
        private RecoveryHooks recovery = RecoveryHooks.none();

        private Builder() {
        }

        public Builder add(Transformer... transformers) {
            return add(List.of(transformers));
        }

        public Builder add(List<? extends Transformer> transformers) {
            for (Transformer t : transformers) {
                Objects.requireNonNull(t, "transformer");
                if (t instanceof NodeTransformer n) nodeTransformers.add(n);
                else if (t instanceof ValueTransformer v) valueTransformers.add(v);
                else if (t instanceof AttributeTransformer a) attributeTransformers.add(a);
                else if (t instanceof ChildrenTransformer c) childrenTransformers.add(c);
            }
            return this;
        }

        public Builder recovery(RecoveryHooks recovery) {
            this.recovery = recovery == null ? RecoveryHooks.none() : recovery;
            return this;
        }

        public TransformPipeline build() {
            return new TransformPipeline(this);
        }
    }
}
