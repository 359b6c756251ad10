package com.bplens.analyzer.graph.io;

import com.bplens.analyzer.analysis.GraphAnalyzer;
import com.bplens.analyzer.formatter.PseudocodeFormatter;
import com.bplens.analyzer.graph.Graph;
import com.bplens.analyzer.graph.GraphNode;
import com.bplens.analyzer.graph.GraphPin;
import com.bplens.analyzer.graph.NodeKind;
import com.bplens.analyzer.graph.PinDirection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * BlueprintTextReader 单元测试
 */
class BlueprintTextReaderTest {

    static final String CLIPBOARD = String.join("\n",
            "Begin Object Class=/Script/BlueprintGraph.K2Node_Event Name=\"K2Node_Event_0\"",
            "   EventReference=(MemberParent=\"/Script/CoreUObject.Class'/Script/Engine.Actor'\",MemberName=\"ReceiveBeginPlay\")",
            "   bOverrideFunction=True",
            "   NodePosX=-128",
            "   NodeGuid=A1B2C3D4000000000000000000000001",
            "   CustomProperties Pin (PinId=00000000000000000000000000000011,PinName=\"OutputDelegate\",Direction=\"EGPD_Output\",PinType.PinCategory=\"delegate\",PinType.PinSubCategory=\"\",LinkedTo=(),)",
            "   CustomProperties Pin (PinId=00000000000000000000000000000012,PinName=\"then\",Direction=\"EGPD_Output\",PinType.PinCategory=\"exec\",LinkedTo=(K2Node_VariableSet_0 00000000000000000000000000000021,),)",
            "End Object",
            "Begin Object Class=/Script/BlueprintGraph.K2Node_VariableSet Name=\"K2Node_VariableSet_0\"",
            "   VariableReference=(MemberName=\"Health\",bSelfContext=True)",
            "   NodeGuid=A1B2C3D4000000000000000000000002",
            "   CustomProperties Pin (PinId=00000000000000000000000000000021,PinName=\"execute\",PinType.PinCategory=\"exec\",LinkedTo=(K2Node_Event_0 00000000000000000000000000000012,),)",
            "   CustomProperties Pin (PinId=00000000000000000000000000000022,PinName=\"then\",Direction=\"EGPD_Output\",PinType.PinCategory=\"exec\",)",
            "   CustomProperties Pin (PinId=00000000000000000000000000000023,PinName=\"Health\",PinType.PinCategory=\"real\",DefaultValue=\"0.0\",LinkedTo=(K2Node_CallFunction_0 00000000000000000000000000000031,),)",
            "End Object",
            "Begin Object Class=/Script/BlueprintGraph.K2Node_CallFunction Name=\"K2Node_CallFunction_0\"",
            "   bIsPureFunc=True",
            "   FunctionReference=(MemberName=\"GetHealth\",bSelfContext=True)",
            "   NodeGuid=A1B2C3D4000000000000000000000003",
            "   CustomProperties Pin (PinId=00000000000000000000000000000031,PinName=\"ReturnValue\",Direction=\"EGPD_Output\",PinType.PinCategory=\"real\",LinkedTo=(K2Node_VariableSet_0 00000000000000000000000000000023,),)",
            "End Object");

    private final BlueprintTextReader reader = new BlueprintTextReader();

    @Nested
    @DisplayName("内联引脚格式")
    class InlinePinTests {

        @Test
        @DisplayName("节点、属性与 GUID")
        void testNodes() {
            Graph graph = reader.read(CLIPBOARD);
            assertEquals(3, graph.size());

            GraphNode event = graph.getNode("A1B2C3D4000000000000000000000001");
            assertNotNull(event);
            assertEquals(NodeKind.EVENT, event.getKind());
            assertEquals("K2Node_Event_0", event.getName());
            assertEquals("True", event.getProperty("bOverrideFunction"));
            assertThat(graph.getEntryNodes()).containsExactly(event);
        }

        @Test
        @DisplayName("引脚方向、类别、默认值与按名称连接")
        void testPins() {
            Graph graph = reader.read(CLIPBOARD);
            GraphNode set = graph.getNode("A1B2C3D4000000000000000000000002");

            GraphPin health = set.findInput("Health");
            assertEquals("real", health.getCategory());
            assertEquals("0.0", health.getDefaultValue());
            assertEquals("A1B2C3D4000000000000000000000003", health.getLinks().get(0).getNodeGuid());
            assertEquals(PinDirection.OUTPUT, set.findPinById("00000000000000000000000000000022").getDirection());
            assertTrue(set.hasLinkedExecInput());
        }

        @Test
        @DisplayName("分析得到 Health = GetHealth()")
        void testAnalyze() {
            Graph graph = reader.read(CLIPBOARD);
            String text = new PseudocodeFormatter().format(new GraphAnalyzer().analyze(graph));
            assertEquals("Event BeginPlay:\n    Health = GetHealth()\n", text);
        }

        @Test
        @DisplayName("旧格式：LinkedTo 只有引脚 ID")
        void testBarePinIdLinks() {
            String text = String.join("\n",
                    "Begin Object Class=/Script/BlueprintGraph.K2Node_CallFunction Name=\"Call_0\"",
                    "   NodeGuid=0000000000000000000000000000000A",
                    "   CustomProperties Pin (PinId=000000000000000000000000000000A1,PinName=\"ReturnValue\",Direction=\"EGPD_Output\",PinType.PinCategory=\"int\",)",
                    "End Object",
                    "Begin Object Class=/Script/BlueprintGraph.K2Node_VariableSet Name=\"Set_0\"",
                    "   NodeGuid=0000000000000000000000000000000B",
                    "   CustomProperties Pin (PinId=000000000000000000000000000000B1,PinName=\"Count\",PinType.PinCategory=\"int\",LinkedTo=(000000000000000000000000000000A1,),)",
                    "End Object");
            Graph graph = reader.read(text);
            GraphPin count = graph.getNode("0000000000000000000000000000000B").findInput("Count");
            assertEquals("0000000000000000000000000000000A", count.getLinks().get(0).getNodeGuid());
        }

        @Test
        @DisplayName("DefaultObject 优先于 DefaultValue")
        void testDefaultObject() {
            String text = String.join("\n",
                    "Begin Object Class=/Script/BlueprintGraph.K2Node_CallFunction Name=\"Call_0\"",
                    "   NodeGuid=0000000000000000000000000000000A",
                    "   CustomProperties Pin (PinId=000000000000000000000000000000A1,PinName=\"Class\",PinType.PinCategory=\"class\",DefaultValue=\"\",DefaultObject=\"/Game/BP/BP_Enemy.BP_Enemy_C\",)",
                    "End Object");
            GraphPin pin = reader.read(text).getNode("0000000000000000000000000000000A").findInput("Class");
            assertEquals("/Game/BP/BP_Enemy.BP_Enemy_C", pin.getDefaultValue());
        }
    }

    @Nested
    @DisplayName("嵌套引脚块格式")
    class NestedPinTests {

        private static final String NESTED = "Begin Object Class=/Script/BlueprintGraph.K2Node_Event Name=\"K2Node_Event_0\"\n"
                + "   EventReference=(MemberName=\"ReceiveBeginPlay\")\n"
                + "   NodeGuid=AAAA0001\n"
                + "   Begin Object Class=/Script/Engine.EdGraphPin Name=\"EdGraphPin_0\"\n"
                + "      PinId=BBBB0001\n"
                + "      PinName=\"then\"\n"
                + "      Direction=\"EGPD_Output\"\n"
                + "      PinType.PinCategory=\"exec\"\n"
                + "      LinkedTo=(NodeGuid=AAAA0002,\n"
                + "         PinId=BBBB0002)\n"
                + "   End Object\n"
                + "End Object\n"
                + "Begin Object Class=/Script/BlueprintGraph.K2Node_CallFunction Name=\"K2Node_CallFunction_0\"\n"
                + "   FunctionReference=(MemberName=\"PrintString\")\n"
                + "   NodeGuid=AAAA0002\n"
                + "   Begin Object Class=/Script/Engine.EdGraphPin Name=\"EdGraphPin_1\"\n"
                + "      PinId=BBBB0002\n"
                + "      PinName=\"execute\"\n"
                + "      PinType.PinCategory=\"exec\"\n"
                + "   End Object\n"
                + "   Begin Object Class=/Script/Engine.Actor Name=\"Unrelated\"\n"
                + "      Foo=Bar\n"
                + "   End Object\n"
                + "End Object\n";

        @Test
        @DisplayName("跨行 LinkedTo 与无关嵌套对象")
        void testNestedBlocks() {
            Graph graph = reader.read(NESTED, "Nested");
            assertEquals("Nested", graph.getName());
            assertEquals(2, graph.size());

            GraphNode call = graph.getNode("AAAA0002");
            assertThat(call.getPins()).hasSize(1);
            assertNull(call.getProperty("Foo"));
            assertEquals("AAAA0001", call.findInput("execute").getLinks().get(0).getNodeGuid());

            String text = new PseudocodeFormatter().format(new GraphAnalyzer().analyze(graph));
            assertEquals("Event BeginPlay:\n    PrintString()\n", text);
        }
    }

    @Nested
    @DisplayName("异常输入")
    class ErrorTests {

        @Test
        @DisplayName("空文本返回 null")
        void testEmpty() {
            assertNull(reader.read(""));
            assertNull(reader.read("   \n  "));
            assertNull(reader.read(null));
        }

        @Test
        @DisplayName("没有节点时报错")
        void testNoNodes() {
            assertThrows(GraphReadException.class, () -> reader.read("hello world"));
        }

        @Test
        @DisplayName("缺少 End Object 时报告行号")
        void testMissingEndObject() {
            GraphReadException e = assertThrows(GraphReadException.class, () -> reader.read(
                    "Begin Object Class=/Script/BlueprintGraph.K2Node_Event Name=\"E\"\n   NodeGuid=AAAA\n"));
            assertEquals(1, e.getLine());
        }
    }
}
