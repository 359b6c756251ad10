package com.bplens.analyzer.processor;

import com.bplens.analyzer.analysis.AnalysisContext;
import com.bplens.analyzer.analysis.AnalyzerConfig;
import com.bplens.analyzer.ast.expr.FunctionCallExpr;
import com.bplens.analyzer.graph.Graph;
import com.bplens.analyzer.graph.GraphBuilder;
import com.bplens.analyzer.graph.GraphNode;
import com.bplens.analyzer.graph.GraphPin;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.bplens.analyzer.TestGraphs.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * 处理器注册表查找顺序
 */
class ProcessorRegistryTest {

    private ProcessorRegistry registry;

    @BeforeEach
    void setUp() {
        registry = ProcessorRegistry.createDefault();
    }

    private GraphNode single(GraphBuilder builder, String guid) {
        Graph graph = builder.build();
        return graph.getNode(guid);
    }

    @Nested
    @DisplayName("类型键")
    class KindKeyTests {

        @Test
        @DisplayName("长名与短名注册同一处理器")
        void testLongAndShortKeys() {
            assertTrue(registry.contains("K2Node_VariableSet"));
            assertTrue(registry.contains("/Script/BlueprintGraph.K2Node_VariableSet"));
            assertSame(registry.get("K2Node_VariableSet"),
                    registry.get("/Script/BlueprintGraph.K2Node_VariableSet"));
        }

        @Test
        @DisplayName("其它模块前缀的标签按短名找到处理器")
        void testForeignModulePrefix() {
            GraphBuilder b = new GraphBuilder("G");
            b.node("N1", "Latent", "/Script/GameplayAbilitiesEditor.K2Node_LatentAbilityCall")
                    .inputExec("execute", "execute");
            assertInstanceOf(LatentActionProcessor.class, registry.find(single(b, "N1")));
        }

        @Test
        @DisplayName("旧版 K2Node_ArrayGet 别名")
        void testArrayGetAlias() {
            GraphBuilder b = new GraphBuilder("G");
            b.node("N1", "Get", "/Script/BlueprintGraph.K2Node_ArrayGet")
                    .outputData("out", "Output", "int");
            assertInstanceOf(GetArrayItemProcessor.class, registry.find(single(b, "N1")));
        }

        @Test
        @DisplayName("自定义注册覆盖默认处理器")
        void testRegisterOverrides() {
            NodeProcessor custom = new KnotProcessor();
            registry.register("K2Node_VariableSet", custom);

            GraphBuilder b = new GraphBuilder("G");
            variableSet(b, "S1", "Health");
            assertSame(custom, registry.find(single(b, "S1")));
        }
    }

    @Nested
    @DisplayName("宏实例")
    class MacroTests {

        @Test
        @DisplayName("ForEachLoop 走复合键")
        void testForEachCompoundKey() {
            GraphBuilder b = new GraphBuilder("G");
            forEach(b, "L1");
            assertInstanceOf(ForEachProcessor.class, registry.find(single(b, "L1")));
        }

        @Test
        @DisplayName("WhileLoop 走复合键")
        void testWhileCompoundKey() {
            GraphBuilder b = new GraphBuilder("G");
            whileLoop(b, "W1");
            assertInstanceOf(WhileProcessor.class, registry.find(single(b, "W1")));
        }

        @Test
        @DisplayName("未注册的宏回到通用宏处理器")
        void testUnregisteredMacro() {
            GraphBuilder b = new GraphBuilder("G");
            b.node("M1", "Macro", MACRO).property("MacroGraphReference", macroRef("Gate"))
                    .inputExec("execute", "Enter");
            assertInstanceOf(GenericMacroProcessor.class, registry.find(single(b, "M1")));
        }
    }

    @Nested
    @DisplayName("未知类型")
    class UnknownKindTests {

        @Test
        @DisplayName("同时有执行与数据引脚时按通用调用处理")
        void testGenericCallable() {
            GraphBuilder b = new GraphBuilder("G");
            b.node("X1", "X", "/Script/Plugin.K2Node_Whatever")
                    .inputExec("execute", "execute")
                    .inputData("a", "A", "int", "1");
            assertInstanceOf(GenericCallableProcessor.class, registry.find(single(b, "X1")));
        }

        @Test
        @DisplayName("其余节点回退")
        void testFallback() {
            GraphBuilder b = new GraphBuilder("G");
            b.node("X1", "X", "/Script/Plugin.K2Node_Whatever").outputData("a", "A", "int");
            b.node("X2", "Y", null);
            Graph graph = b.build();
            assertInstanceOf(FallbackProcessor.class, registry.find(graph.getNode("X1")));
            assertInstanceOf(FallbackProcessor.class, registry.find(graph.getNode("X2")));
        }

        @Test
        @DisplayName("空注册表对任何节点都返回处理器")
        void testEmptyRegistryNeverReturnsNull() {
            ProcessorRegistry empty = new ProcessorRegistry();
            GraphBuilder b = new GraphBuilder("G");
            event(b, "E1", "BeginPlay");
            assertNotNull(empty.find(single(b, "E1")));
        }
    }

    @Nested
    @DisplayName("处理器细节")
    class ProcessorDetailTests {

        @Test
        @DisplayName("回调载荷按名称词干分配，其余归未被认领的回调")
        void testCallbackPayloadHeuristic() {
            GraphBuilder b = new GraphBuilder("G");
            b.node("A1", "Async", "/Script/BlueprintGraph.K2Node_AsyncAction")
                    .inputExec("execute", "execute")
                    .outputExec("ok", "OnSuccess")
                    .outputExec("fail", "OnFailure")
                    .outputData("data", "SuccessData", "string")
                    .outputData("code", "ErrorCode", "int");
            GraphNode node = single(b, "A1");

            List<GraphPin> callbacks = node.getExecOutputs();
            List<GraphPin> payloads = node.getDataOutputs();
            assertEquals("SuccessData",
                    LatentActionProcessor.payloadFor(callbacks.get(0), callbacks, payloads).get(0).getName());
            assertEquals("ErrorCode",
                    LatentActionProcessor.payloadFor(callbacks.get(1), callbacks, payloads).get(0).getName());
        }

        @Test
        @DisplayName("事件名解析")
        void testEventNames() {
            GraphBuilder b = new GraphBuilder("G");
            event(b, "E1", "BeginPlay");
            b.node("E2", "Custom", CUSTOM_EVENT).property("CustomFunctionName", "\"OnHit\"");
            b.node("E3", "Bound", "/Script/BlueprintGraph.K2Node_ComponentBoundEvent")
                    .property("ComponentPropertyName", "\"Button_0\"")
                    .property("DelegatePropertyName", "\"OnClicked\"");
            b.node("E4", "Bare", EVENT);
            Graph graph = b.build();

            assertEquals("BeginPlay", EventProcessor.eventName(graph.getNode("E1")));
            assertEquals("OnHit", EventProcessor.eventName(graph.getNode("E2")));
            assertEquals("Button_0.OnClicked", EventProcessor.eventName(graph.getNode("E3")));
            assertEquals("UnknownEvent", EventProcessor.eventName(graph.getNode("E4")));
        }

        @Test
        @DisplayName("类型转换目标类型去掉 _C 后缀")
        void testCastTargetType() {
            GraphBuilder b = new GraphBuilder("G");
            b.node("K1", "Cast", CAST)
                    .property("TargetType", "/Script/Engine.BlueprintGeneratedClass'/Game/BP/BP_Enemy.BP_Enemy_C'");
            b.node("K2", "Cast2", CAST);
            Graph graph = b.build();

            assertEquals("BP_Enemy", CastProcessor.targetType(graph.getNode("K1")));
            assertEquals("UnknownType", CastProcessor.targetType(graph.getNode("K2")));
        }

        @Test
        @DisplayName("序列引脚序号")
        void testSequenceOrder() {
            assertEquals(0, SequenceProcessor.order("then_0"));
            assertEquals(12, SequenceProcessor.order("then_12"));
            assertEquals(Integer.MAX_VALUE, SequenceProcessor.order("then"));
            assertEquals(Integer.MAX_VALUE, SequenceProcessor.order("then_x"));
        }

        @Test
        @DisplayName("纯函数节点在执行流之外处理时产生表达式")
        void testPureCallProducesExpression() {
            GraphBuilder b = new GraphBuilder("G");
            pureCall(b, "C1", "GetHealth");
            Graph graph = b.build();
            AnalysisContext context = new AnalysisContext(graph, registry,
                    AnalyzerConfig.defaultConfig());

            NodeProcessingResult result = new FunctionCallProcessor().process(graph.getNode("C1"), context);
            assertTrue(result.hasNode());
            assertInstanceOf(FunctionCallExpr.class, result.getNode());
            assertEquals(NodeProcessingResult.Continuation.DEFAULT, result.getContinuation());
        }
    }
}
