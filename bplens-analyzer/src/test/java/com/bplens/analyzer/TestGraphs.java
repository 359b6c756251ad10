package com.bplens.analyzer;

import com.bplens.analyzer.ast.stmt.BranchStmt;
import com.bplens.analyzer.ast.stmt.EventStmt;
import com.bplens.analyzer.ast.stmt.ExecutionBlock;
import com.bplens.analyzer.ast.stmt.LatentActionStmt;
import com.bplens.analyzer.ast.stmt.LoopStmt;
import com.bplens.analyzer.ast.stmt.Statement;
import com.bplens.analyzer.graph.GraphBuilder;

import java.util.ArrayList;
import java.util.List;

/**
 * 测试用的节点构造与 AST 查找工具
 */
public final class TestGraphs {

    public static final String EVENT = "/Script/BlueprintGraph.K2Node_Event";
    public static final String CUSTOM_EVENT = "/Script/BlueprintGraph.K2Node_CustomEvent";
    public static final String VARIABLE_GET = "/Script/BlueprintGraph.K2Node_VariableGet";
    public static final String VARIABLE_SET = "/Script/BlueprintGraph.K2Node_VariableSet";
    public static final String CALL_FUNCTION = "/Script/BlueprintGraph.K2Node_CallFunction";
    public static final String IF_THEN_ELSE = "/Script/BlueprintGraph.K2Node_IfThenElse";
    public static final String SEQUENCE = "/Script/BlueprintGraph.K2Node_ExecutionSequence";
    public static final String MACRO = "/Script/BlueprintGraph.K2Node_MacroInstance";
    public static final String CAST = "/Script/BlueprintGraph.K2Node_DynamicCast";
    public static final String KNOT = "/Script/BlueprintGraph.K2Node_Knot";
    public static final String LATENT = "/Script/GameplayAbilitiesEditor.K2Node_LatentAbilityCall";
    public static final String ADD_DELEGATE = "/Script/BlueprintGraph.K2Node_AddDelegate";
    public static final String REMOVE_DELEGATE = "/Script/BlueprintGraph.K2Node_RemoveDelegate";

    private TestGraphs() {}

    public static String member(String name) {
        return "(MemberName=\"" + name + "\",bSelfContext=True)";
    }

    public static String macroRef(String macro) {
        return "(MacroGraph=\"/Engine/EditorBlueprintResources/StandardMacros.StandardMacros:" + macro
                + "\",GraphBlueprint=\"/Engine/EditorBlueprintResources/StandardMacros.StandardMacros\")";
    }

    // ============ 节点 ============

    public static GraphBuilder.NodeSpec event(GraphBuilder b, String guid, String eventName) {
        return b.node(guid, "K2Node_Event_" + guid, EVENT)
                .property("EventReference", member("Receive" + eventName))
                .outputExec("then", "then");
    }

    public static GraphBuilder.NodeSpec variableGet(GraphBuilder b, String guid, String variable) {
        return b.node(guid, "K2Node_VariableGet_" + guid, VARIABLE_GET)
                .property("VariableReference", member(variable))
                .outputData("value", variable, "float");
    }

    /** 值引脚 ID 为 "value"，名称与变量同名 */
    public static GraphBuilder.NodeSpec variableSet(GraphBuilder b, String guid, String variable) {
        return b.node(guid, "K2Node_VariableSet_" + guid, VARIABLE_SET)
                .property("VariableReference", member(variable))
                .inputExec("execute", "execute")
                .outputExec("then", "then")
                .inputData("value", variable, "float", "0.0");
    }

    public static GraphBuilder.NodeSpec pureCall(GraphBuilder b, String guid, String function) {
        return b.node(guid, "K2Node_CallFunction_" + guid, CALL_FUNCTION)
                .property("FunctionReference", member(function))
                .outputData("ReturnValue", "ReturnValue", "float");
    }

    public static GraphBuilder.NodeSpec impureCall(GraphBuilder b, String guid, String function) {
        return b.node(guid, "K2Node_CallFunction_" + guid, CALL_FUNCTION)
                .property("FunctionReference", member(function))
                .inputExec("execute", "execute")
                .outputExec("then", "then");
    }

    /** 条件引脚 ID 为 "cond"，分支输出 ID 为 "then" / "else" */
    public static GraphBuilder.NodeSpec branch(GraphBuilder b, String guid, String thenName, String elseName) {
        return b.node(guid, "K2Node_IfThenElse_" + guid, IF_THEN_ELSE)
                .inputExec("execute", "execute")
                .inputData("cond", "Condition", "bool", null)
                .outputExec("then", thenName)
                .outputExec("else", elseName);
    }

    public static GraphBuilder.NodeSpec forEach(GraphBuilder b, String guid) {
        return b.node(guid, "K2Node_MacroInstance_" + guid, MACRO)
                .property("MacroGraphReference", macroRef("ForEachLoop"))
                .inputExec("execute", "Exec")
                .inputData("array", "Array", "wildcard", null)
                .outputExec("body", "LoopBody")
                .outputData("element", "Array Element", "wildcard")
                .outputData("index", "Array Index", "int")
                .outputExec("completed", "Completed");
    }

    public static GraphBuilder.NodeSpec whileLoop(GraphBuilder b, String guid) {
        return b.node(guid, "K2Node_MacroInstance_" + guid, MACRO)
                .property("MacroGraphReference", macroRef("WhileLoop"))
                .inputExec("execute", "Exec")
                .inputData("cond", "Condition", "bool", null)
                .outputExec("body", "LoopBody")
                .outputExec("completed", "Completed");
    }

    // ============ 连接 ============

    /** from.then -> to.execute */
    public static void flow(GraphBuilder b, String fromGuid, String toGuid) {
        b.link(fromGuid, "then", toGuid, "execute");
    }

    /** producer.producerPin -> consumer.consumerPin */
    public static void data(GraphBuilder b, String producerGuid, String producerPin,
                            String consumerGuid, String consumerPin) {
        b.link(consumerGuid, consumerPin, producerGuid, producerPin);
    }

    // ============ AST 查找 ============

    /** 递归收集指定类型的语句（含嵌套块） */
    public static <T extends Statement> List<T> collect(List<? extends Statement> statements, Class<T> type) {
        List<T> result = new ArrayList<T>();
        for (Statement statement : statements) {
            collectInto(statement, type, result);
        }
        return result;
    }

    private static <T extends Statement> void collectInto(Statement statement, Class<T> type, List<T> out) {
        if (statement == null) return;
        if (type.isInstance(statement)) out.add(type.cast(statement));
        if (statement instanceof ExecutionBlock) {
            for (Statement child : ((ExecutionBlock) statement).getStatements()) collectInto(child, type, out);
        } else if (statement instanceof EventStmt) {
            collectInto(((EventStmt) statement).getBody(), type, out);
        } else if (statement instanceof BranchStmt) {
            collectInto(((BranchStmt) statement).getThenBlock(), type, out);
            collectInto(((BranchStmt) statement).getElseBlock(), type, out);
        } else if (statement instanceof LoopStmt) {
            collectInto(((LoopStmt) statement).getBody(), type, out);
        } else if (statement instanceof LatentActionStmt) {
            for (LatentActionStmt.CallbackBlock callback : ((LatentActionStmt) statement).getCallbacks()) {
                collectInto(callback.getBody(), type, out);
            }
        }
    }
}
