package com.xjx.transform;

import com.xjx.common.exceptions.XjxProcessingException;
import com.xjx.config.XjxConfig;
import com.xjx.xnode.XNode;
import com.xjx.xnode.context.Format;
import com.xjx.xnode.context.TransformContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class TransformPipelineTest {
    private final XjxConfig config = XjxConfig.defaults();

    private static XNode order() {
        return XNode.record("order")
                .setAttribute("id", "7")
                .setAttribute("status", "open")
                .addChild(XNode.record("deprecated").addChild(XNode.value("old", "x")))
                .addChild(XNode.record("item").setAttribute("sku", "A1").addChild(XNode.field("price", "10")))
                .addChild(XNode.record("item").setAttribute("sku", "B2").addChild(XNode.field("price", "20")));
    }

    private TransformPipeline.Outcome run(XNode root, Transformer... ts) {
        return TransformPipeline.builder().add(ts).build().run(root, Format.JSON, config);
    }

    @Nested
    class NodeStage {
        @Test
        @DisplayName("removing a node removes its whole subtree")
        void removalDropsSubtree() {
            XNode root = run(order(), (NodeTransformer) (n, c) ->
                    n.name().equals("deprecated") ? TransformResult.remove() : TransformResult.keep(n)).root();
            assertTrue(root.findDeep(n -> n.name().equals("deprecated") || n.name().equals("old")).isEmpty());
            assertEquals(2, root.findChildren("item").size());
        }

        @Test
        void removedNodeSkipsLaterStages() {
            List<String> seen = new ArrayList<>();
            run(order(),
                    (NodeTransformer) (n, c) -> n.name().equals("price") ? TransformResult.remove() : TransformResult.keep(n),
                    (ValueTransformer) (v, c) -> { seen.add(c.path()); return TransformResult.keep(v); });
            assertTrue(seen.stream().noneMatch(p -> p.endsWith("price")), seen.toString());
        }

        @Test
        void replacementTakesThePositionAndLaterTransformersSeeIt() {
            List<String> secondSaw = new ArrayList<>();
            XNode root = run(order(),
                    (NodeTransformer) (n, c) -> n.name().equals("deprecated") ? TransformResult.keep(XNode.value("legacy", "gone")) : TransformResult.keep(n),
                    (NodeTransformer) (n, c) -> { secondSaw.add(c.path()); return TransformResult.keep(n); }).root();
            assertEquals("legacy", root.children().get(0).name());
            assertSame(root, root.children().get(0).parent());
            assertTrue(secondSaw.contains("order.legacy"));
        }

        @Test
        @DisplayName("a replacement removed by a later node transformer leaves the output")
        void replacementRemovedByLaterTransformer() {
            XNode root = XNode.record("root").addChild(XNode.record("old")).addChild(XNode.record("kept"));
            XNode out = run(root,
                    (NodeTransformer) (n, c) -> n.name().equals("old") ? TransformResult.keep(XNode.record("deprecated")) : TransformResult.keep(n),
                    (NodeTransformer) (n, c) -> n.name().equals("deprecated") ? TransformResult.remove() : TransformResult.keep(n)).root();
            assertEquals(List.of("kept"), out.children().stream().map(XNode::name).toList());
        }

        @Test
        void replacingTheRootReturnsTheNewRoot() {
            XNode root = run(order(), (NodeTransformer) (n, c) ->
                    c.isRoot() ? TransformResult.keep(XNode.record("wrapped").addChild(n)) : TransformResult.keep(n)).root();
            assertEquals("wrapped", root.name());
            assertEquals("order", root.children().get(0).name());
        }

        @Test
        void removingTheRootIsAProcessingFailure() {
            assertThrows(XjxProcessingException.class, () -> run(order(), (NodeTransformer) (n, c) -> TransformResult.remove()));
        }
    }

    @Nested
    class ValueAndAttributeStages {
        @Test
        void valueTransformersRunInRegistrationOrder() {
            XNode root = run(XNode.record("r").addChild(XNode.value("v", "a")),
                    (ValueTransformer) (v, c) -> TransformResult.keep(v + "b"),
                    (ValueTransformer) (v, c) -> TransformResult.keep(v + "c")).root();
            assertEquals("abc", root.children().get(0).value());
        }

        @Test
        void deletingAValueKeepsTheNode() {
            XNode root = run(XNode.record("r").addChild(XNode.value("v", "a")),
                    (ValueTransformer) (v, c) -> TransformResult.remove()).root();
            XNode v = root.children().get(0);
            assertFalse(v.hasValue());
            assertEquals("r.v", v.path());
        }

        @Test
        @DisplayName("attribute values pass through value transformers before attribute transformers")
        void attributeValuesFirst() {
            List<String> order = new ArrayList<>();
            XNode root = run(XNode.record("r").setAttribute("a", "1"),
                    (AttributeTransformer) (a, c) -> { order.add("attr:" + a.value()); return TransformResult.keep(a); },
                    (ValueTransformer) (v, c) -> { order.add("value:" + v); return TransformResult.keep(v + "!"); }).root();
            assertEquals(List.of("value:1", "attr:1!"), order);
            assertEquals("1!", root.findAttribute("a").orElseThrow().value());
        }

        @Test
        void attributeContextIsFlagged() {
            List<TransformContext> contexts = new ArrayList<>();
            run(XNode.record("r").setAttribute("a", "1"),
                    (AttributeTransformer) (a, c) -> { contexts.add(c); return TransformResult.keep(a); });
            assertEquals(1, contexts.size());
            assertTrue(contexts.get(0).attribute());
            assertEquals("r.a", contexts.get(0).path());
            assertEquals("a", contexts.get(0).attributeName());
        }

        @Test
        @DisplayName("removing an attribute leaves siblings and children alone")
        void attributeRemovalIsLocal() {
            XNode root = run(order(), (AttributeTransformer) (a, c) ->
                    a.name().equals("status") ? TransformResult.remove() : TransformResult.keep(a)).root();
            assertTrue(root.findAttribute("status").isEmpty());
            assertEquals("7", root.findAttribute("id").orElseThrow().value());
            assertEquals(3, root.children().size());
        }

        @Test
        void attributeRename() {
            XNode root = run(order(), (AttributeTransformer) (a, c) ->
                    TransformResult.keep(a.name().equals("sku") ? a.withName("code") : a)).root();
            XNode item = root.findChildren("item").get(1);
            assertEquals("B2", item.findAttribute("code").orElseThrow().value());
            assertTrue(item.findAttribute("sku").isEmpty());
        }

        @Test
        void renameOntoASiblingAttributeIsAProcessingFailure() {
            XjxProcessingException e = assertThrows(XjxProcessingException.class, () -> run(order(), (AttributeTransformer) (a, c) ->
                    TransformResult.keep(a.name().equals("status") ? a.withName("id") : a)));
            assertTrue(e.getMessage().contains("'id'"), e.getMessage());
        }
    }

    @Nested
    class ChildrenStage {
        @Test
        void childrenTransformerSeesTheWholeListAndMayReorder() {
            XNode root = run(XNode.record("r").addChild(XNode.value("a", 1)).addChild(XNode.value("b", 2)),
                    (ChildrenTransformer) (children, c) -> {
                        List<XNode> reversed = new ArrayList<>(children);
                        java.util.Collections.reverse(reversed);
                        return reversed;
                    }).root();
            assertEquals(List.of("b", "a"), root.children().stream().map(XNode::name).toList());
        }

        @Test
        void emptyListRemovesAllChildren() {
            XNode root = run(order(), ((ChildrenTransformer) (children, c) -> List.of()).scopedTo("order")).root();
            assertFalse(root.hasChildren());
        }

        @Test
        void synthesisedChildrenAreVisited() {
            List<String> visited = new ArrayList<>();
            run(XNode.record("r"),
                    ((ChildrenTransformer) (children, c) -> List.of(XNode.value("made", "x"))).scopedTo("r"),
                    (ValueTransformer) (v, c) -> { visited.add(c.path()); return TransformResult.keep(v); });
            assertEquals(List.of("r.made"), visited);
        }
    }

    @Nested
    class Scoping {
        @Test
        void scopedValueTransformerOnlyFiresOnMatchingPaths() {
            XNode root = run(order(), ((ValueTransformer) (v, c) -> TransformResult.keep("X")).scopedTo("order.*.price")).root();
            root.findAll(n -> n.name().equals("price")).forEach(p -> assertEquals("X", p.value()));
            assertEquals("x", root.findDeep(n -> n.name().equals("old")).orElseThrow().value());
            assertEquals("7", root.findAttribute("id").orElseThrow().value());
        }

        @Test
        void scopedToAttributePattern() {
            XNode root = run(order(), ((ValueTransformer) (v, c) -> TransformResult.keep("X")).scopedTo("order.item.@sku")).root();
            root.findChildren("item").forEach(i -> assertEquals("X", i.findAttribute("sku").orElseThrow().value()));
            root.findAll(n -> n.name().equals("price")).forEach(p -> assertNotEquals("X", p.value()));
        }
    }

    @Nested
    class Failures {
        private final ValueTransformer failing = (v, c) -> {
            if ("20".equals(v)) throw new IllegalStateException("bad price");
            return TransformResult.keep(v);
        };

        @Test
        void failureWithoutHookAbortsWithProcessingException() {
            XjxProcessingException e = assertThrows(XjxProcessingException.class, () -> run(order(), failing));
            assertTrue(e.getMessage().contains("order.item.price"), e.getMessage());
            assertInstanceOf(IllegalStateException.class, e.getCause());
        }

        @Test
        void hookResultSubstitutesAndWarningIsRecorded() {
            @SuppressWarnings("unchecked")
            RecoveryHooks.StageRecovery<Object> hook = mock(RecoveryHooks.StageRecovery.class);
            when(hook.recover(any(), eq("20"), any())).thenReturn(TransformResult.keep("0"));

            TransformPipeline.Outcome out = TransformPipeline.builder()
                    .add(failing)
                    .recovery(RecoveryHooks.none().withValue(hook))
                    .build()
                    .run(order(), Format.JSON, config);

            assertEquals("0", out.root().findChildren("item").get(1).findChild("price").orElseThrow().value());
            assertEquals(1, out.warnings().size());
            assertEquals(Stage.VALUE, out.warnings().get(0).stage());
            assertEquals("order.item.price", out.warnings().get(0).path());
            verify(hook, times(1)).recover(any(IllegalStateException.class), eq("20"), any());
        }

        @Test
        void failingHookKeepsTheOriginalValue() {
            RecoveryHooks hooks = RecoveryHooks.none().withValue((e, v, c) -> {
                throw new RuntimeException("hook broke");
            });
            TransformPipeline.Outcome out = TransformPipeline.builder().add(failing).recovery(hooks).build()
                    .run(order(), Format.JSON, config);
            assertEquals("20", out.root().findChildren("item").get(1).findChild("price").orElseThrow().value());
            assertTrue(out.warnings().get(0).message().contains("hook broke"));
        }

        @Test
        void keepInputsRecoversEveryStage() {
            TransformPipeline.Outcome out = TransformPipeline.builder()
                    .add((NodeTransformer) (n, c) -> { throw new IllegalArgumentException("n"); })
                    .add((ChildrenTransformer) (ch, c) -> { throw new IllegalArgumentException("c"); })
                    .recovery(RecoveryHooks.keepInputs())
                    .build()
                    .run(order(), Format.XML, config);
            assertEquals(order(), out.root());
            assertFalse(out.warnings().isEmpty());
        }
    }

    @Test
    void emptyPipelineReturnsTheSameTree() {
        XNode root = order();
        TransformPipeline.Outcome out = TransformPipeline.builder().build().run(root, Format.XML, config);
        assertSame(root, out.root());
        assertTrue(out.warnings().isEmpty());
    }

    @Test
    void contextCarriesTargetFormatAndConfig() {
        List<TransformContext> seen = new ArrayList<>();
        TransformPipeline.builder().add((NodeTransformer) (n, c) -> { seen.add(c); return TransformResult.keep(n); })
                .build().run(XNode.record("r"), Format.XML, config);
        assertEquals(Format.XML, seen.get(0).format());
        assertSame(config, seen.get(0).config());
    }
}
