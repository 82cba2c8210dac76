package com.xjx.converter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.xjx.common.errorsor.ErrorsOr;
import com.xjx.common.exceptions.XjxProcessingException;
import com.xjx.common.exceptions.XjxValidationException;
import com.xjx.config.XjxConfig;
import com.xjx.json.JsonOutput;
import com.xjx.json.JsonSource;
import com.xjx.transform.RecoveryHooks;
import com.xjx.transform.TransformPipeline;
import com.xjx.transform.TransformWarning;
import com.xjx.transform.Transformer;
import com.xjx.woodstox.WoodstoxDomTypeClass;
import com.xjx.xml.DomTypeClass;
import com.xjx.xml.XmlOutput;
import com.xjx.xml.XmlSource;
import com.xjx.xnode.XNode;
import com.xjx.xnode.context.Format;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Fluent conversion between XML, JSON and node trees. One instance carries one conversion:
 * <pre>{@code
 * String json = Xjx.create()
 *         .fromXml("<flag>true</flag>")
 *         .transform(BooleanTransform.defaults())
 *         .toJsonString();
 * }</pre>
 * Source options are read when the source is set; output options when a terminal runs.
 * Transformers run at each terminal, against the terminal's target format, on a copy of the
 * source tree, so terminals can be called repeatedly.
 * <p>
 * Not thread-safe.
 */
public final class Xjx {
    private static final Logger log = LoggerFactory.getLogger(Xjx.class);

    public static final String RESULTS = "results";

    private final DomTypeClass dom;
    private XjxConfig config = XjxConfig.defaults();
    private final List<Transformer> transformers = new ArrayList<>();
    private RecoveryHooks recovery = RecoveryHooks.none();
    private XNode tree;
    private Format sourceFormat;
    private List<TransformWarning> warnings = List.of();

    private Xjx(DomTypeClass dom) {
        this.dom = Objects.requireNonNull(dom, "dom");
    }

    public static Xjx create() {
        return new Xjx(new WoodstoxDomTypeClass());
    }

    public static Xjx create(DomTypeClass dom) {
        return new Xjx(dom);
    }

    // ---------- configuration ----------

    public Xjx withConfig(XjxConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        return this;
    }

    /**
     * @throws XjxValidationException if the merged configuration is invalid
     */
    public Xjx withConfigOverrides(Map<String, ?> overrides) {
        this.config = config.merge(overrides);
        return this;
    }

    public Xjx withConfigOverrides(JsonNode overrides) {
        this.config = config.merge(overrides);
        return this;
    }

    public XjxConfig config() {
        return config;
    }

    // ---------- sources ----------

    public Xjx fromXml(String xml) {
        return fromXml(xml, SourceHooks.none());
    }

    public Xjx fromXml(String xml, SourceHooks<String> hooks) {
        String input = hooks.applyBefore(xml);
        return source(new XmlSource(dom, config.xml().source()).fromXml(input), Format.XML, hooks);
    }

    /** Standard or high-fidelity shape, per {@link XjxConfig#highFidelity()}. */
    public Xjx fromJson(String json) {
        return fromJson(json, SourceHooks.none());
    }

    public Xjx fromJson(String json, SourceHooks<String> hooks) {
        String input = hooks.applyBefore(json);
        JsonSource source = jsonSource();
        return source(config.highFidelity() ? source.fromHiFi(input) : source.fromJson(input), Format.JSON, hooks);
    }

    public Xjx fromJson(JsonNode json) {
        return fromJson(json, SourceHooks.none());
    }

    public Xjx fromJson(JsonNode json, SourceHooks<JsonNode> hooks) {
        JsonNode input = hooks.applyBefore(json);
        JsonSource source = jsonSource();
        return source(config.highFidelity() ? source.fromHiFi(input) : source.fromJson(input), Format.JSON, hooks);
    }

    /** Plain Java values: maps, lists and scalars. */
    public Xjx fromJsonValue(Object value) {
        return source(jsonSource().fromValue(value), Format.JSON, SourceHooks.none());
    }

    public Xjx fromJsonHiFi(String json) {
        return source(jsonSource().fromHiFi(json), Format.JSON, SourceHooks.none());
    }

    public Xjx fromJsonHiFi(JsonNode json) {
        return source(jsonSource().fromHiFi(json), Format.JSON, SourceHooks.none());
    }

    /** Works on a copy of {@code node}. The tree is treated as JSON when transformers ask for the source format. */
    public Xjx fromXNode(XNode node) {
        return fromXNode(node, SourceHooks.none());
    }

    public Xjx fromXNode(XNode node, SourceHooks<XNode> hooks) {
        if (node == null) throw new XjxValidationException("Node was null");
        XNode input = hooks.applyBefore(node.cloneDeep());
        return source(input, Format.JSON, hooks);
    }

    private JsonSource jsonSource() {
        return new JsonSource(config.json().source());
    }

    private <I> Xjx source(XNode root, Format format, SourceHooks<I> hooks) {
        this.tree = hooks.applyAfter(root);
        this.sourceFormat = format;
        log.debug("Source set from {}: {} '{}'", format, tree.type().code(), tree.name());
        return this;
    }

    // ---------- transforms and functional helpers ----------

    public Xjx transform(Transformer... transformers) {
        for (Transformer t : transformers) this.transformers.add(Objects.requireNonNull(t, "transformer"));
        return this;
    }

    public Xjx transform(List<? extends Transformer> transformers) {
        return transform(transformers.toArray(new Transformer[0]));
    }

    public Xjx recovery(RecoveryHooks recovery) {
        this.recovery = Objects.requireNonNull(recovery, "recovery");
        return this;
    }

    /**
     * Keeps matching nodes together with their ancestors. If nothing matches, only the root remains,
     * without children.
     */
    public Xjx filter(Predicate<XNode> predicate) {
        XNode kept = filtered(requireSource(), predicate);
        tree = kept != null ? kept : tree.cloneShallow();
        return this;
    }

    private static XNode filtered(XNode node, Predicate<XNode> predicate) {
        List<XNode> keptChildren = new ArrayList<>();
        for (XNode child : node.children()) {
            XNode kept = filtered(child, predicate);
            if (kept != null) keptChildren.add(kept);
        }
        if (keptChildren.isEmpty() && !predicate.test(node)) return null;
        XNode copy = node.cloneShallow();
        for (XNode child : keptChildren) copy.addChild(child);
        return copy;
    }

    /** Replaces the tree with a {@code results} record holding copies of every matching node, in document order. */
    public Xjx select(Predicate<XNode> predicate) {
        XNode results = XNode.record(RESULTS);
        for (XNode match : requireSource().findAll(predicate)) results.addChild(match.cloneDeep());
        tree = results;
        return this;
    }

    /** Warnings recorded by recovery hooks during the last terminal. */
    public List<TransformWarning> warnings() {
        return warnings;
    }

    // ---------- terminals ----------

    public Document toXml() {
        return toXml(OutputHooks.none());
    }

    public Document toXml(OutputHooks<Document> hooks) {
        XNode root = hooks.applyBefore(prepared(Format.XML));
        return hooks.applyAfter(new XmlOutput(dom, config.xml().output()).toDocument(root));
    }

    public String toXmlString() {
        return toXmlString(OutputHooks.none());
    }

    public String toXmlString(OutputHooks<String> hooks) {
        XNode root = hooks.applyBefore(prepared(Format.XML));
        return hooks.applyAfter(new XmlOutput(dom, config.xml().output()).toXmlString(root));
    }

    /** Standard or high-fidelity shape, per {@link XjxConfig#highFidelity()}. */
    public JsonNode toJson() {
        return toJson(OutputHooks.none());
    }

    public JsonNode toJson(OutputHooks<JsonNode> hooks) {
        XNode root = hooks.applyBefore(prepared(Format.JSON));
        JsonOutput out = jsonOutput();
        return hooks.applyAfter(config.highFidelity() ? out.toHiFi(root) : out.toJson(root));
    }

    public String toJsonString() {
        return toJsonString(OutputHooks.none());
    }

    public String toJsonString(OutputHooks<String> hooks) {
        XNode root = hooks.applyBefore(prepared(Format.JSON));
        JsonOutput out = jsonOutput();
        return hooks.applyAfter(out.write(config.highFidelity() ? out.toHiFi(root) : out.toJson(root)));
    }

    public ObjectNode toJsonHiFi() {
        return toJsonHiFi(OutputHooks.none());
    }

    public ObjectNode toJsonHiFi(OutputHooks<ObjectNode> hooks) {
        XNode root = hooks.applyBefore(prepared(Format.JSON));
        return hooks.applyAfter(jsonOutput().toHiFi(root));
    }

    public String toJsonHiFiString() {
        return jsonOutput().write(toJsonHiFi());
    }

    /** A copy of the transformed tree. Transformers see the source format as their target. */
    public XNode toXNode() {
        return toXNode(OutputHooks.none());
    }

    public XNode toXNode(OutputHooks<XNode> hooks) {
        XNode root = hooks.applyBefore(prepared(sourceFormat()));
        return hooks.applyAfter(root);
    }

    public ErrorsOr<String> tryToXmlString() {
        return ErrorsOr.trying(() -> toXmlString());
    }

    public ErrorsOr<String> tryToJsonString() {
        return ErrorsOr.trying(() -> toJsonString());
    }

    public ErrorsOr<JsonNode> tryToJson() {
        return ErrorsOr.trying(() -> toJson());
    }

    private JsonOutput jsonOutput() {
        return new JsonOutput(config.json().output());
    }

    private XNode prepared(Format target) {
        XNode copy = requireSource().cloneDeep();
        TransformPipeline pipeline = TransformPipeline.builder().add(transformers).recovery(recovery).build();
        TransformPipeline.Outcome outcome = pipeline.run(copy, target, config);
        warnings = outcome.warnings();
        if (!warnings.isEmpty()) log.debug("{} transformer failures were recovered for {}", warnings.size(), target);
        return outcome.root();
    }

    private Format sourceFormat() {
        requireSource();
        return sourceFormat;
    }

    private XNode requireSource() {
        if (tree == null) throw new XjxProcessingException("No source set: call fromXml, fromJson or fromXNode first");
        return tree;
    }
}
