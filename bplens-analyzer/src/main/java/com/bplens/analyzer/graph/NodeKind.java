package com.bplens.analyzer.graph;

import java.util.HashMap;
import java.util.Map;

/**
 * 已知节点种类（闭集）。
 *
 * <p>原始类型标签（如 {@code /Script/BlueprintGraph.K2Node_Event}）在构建图时统一翻译为此枚举，
 * 无法识别的标签归为 {@link #UNKNOWN}，交由注册表的开放分派处理。</p>
 */
public enum NodeKind {
    EVENT("K2Node_Event"),
    CUSTOM_EVENT("K2Node_CustomEvent"),
    COMPONENT_BOUND_EVENT("K2Node_ComponentBoundEvent"),
    FUNCTION_ENTRY("K2Node_FunctionEntry"),
    VARIABLE_GET("K2Node_VariableGet"),
    VARIABLE_SET("K2Node_VariableSet"),
    CALL_FUNCTION("K2Node_CallFunction"),
    CALL_ARRAY_FUNCTION("K2Node_CallArrayFunction"),
    CALL_PARENT_FUNCTION("K2Node_CallParentFunction"),
    BINARY_OPERATOR("K2Node_CommutativeAssociativeBinaryOperator"),
    IF_THEN_ELSE("K2Node_IfThenElse"),
    EXECUTION_SEQUENCE("K2Node_ExecutionSequence"),
    MACRO_INSTANCE("K2Node_MacroInstance"),
    DYNAMIC_CAST("K2Node_DynamicCast"),
    KNOT("K2Node_Knot"),
    SELF("K2Node_Self"),
    LITERAL("K2Node_Literal"),
    MATH_EXPRESSION("K2Node_MathExpression"),
    GET_ARRAY_ITEM("K2Node_GetArrayItem"),
    LATENT_ABILITY_CALL("K2Node_LatentAbilityCall"),
    ASYNC_ACTION("K2Node_AsyncAction"),
    BASE_ASYNC_TASK("K2Node_BaseAsyncTask"),
    ADD_DELEGATE("K2Node_AddDelegate"),
    ASSIGN_DELEGATE("K2Node_AssignDelegate"),
    REMOVE_DELEGATE("K2Node_RemoveDelegate"),
    CREATE_DELEGATE("K2Node_CreateDelegate"),
    UNKNOWN(null);

    private static final Map<String, NodeKind> BY_SHORT_NAME = new HashMap<String, NodeKind>();

    static {
        for (NodeKind kind : values()) {
            if (kind.shortName != null) {
                BY_SHORT_NAME.put(kind.shortName, kind);
            }
        }
        // 旧版导出中的别名
        BY_SHORT_NAME.put("K2Node_ArrayGet", GET_ARRAY_ITEM);
    }

    private final String shortName;

    NodeKind(String shortName) {
        this.shortName = shortName;
    }

    /** 短类型名，如 K2Node_Event；UNKNOWN 返回 null */
    public String getShortName() {
        return shortName;
    }

    public boolean isEvent() {
        return this == EVENT || this == CUSTOM_EVENT || this == COMPONENT_BOUND_EVENT
                || this == FUNCTION_ENTRY;
    }

    public boolean isFunctionCall() {
        return this == CALL_FUNCTION || this == CALL_ARRAY_FUNCTION
                || this == CALL_PARENT_FUNCTION || this == BINARY_OPERATOR;
    }

    public boolean isLatent() {
        return this == LATENT_ABILITY_CALL || this == ASYNC_ACTION || this == BASE_ASYNC_TASK;
    }

    /** 翻译原始类型标签 */
    public static NodeKind fromTag(String tag) {
        NodeKind kind = BY_SHORT_NAME.get(shortTag(tag));
        return kind != null ? kind : UNKNOWN;
    }

    /**
     * 去掉 /Script/模块名. 前缀
     * <pre>"/Script/BlueprintGraph.K2Node_Event" -> "K2Node_Event"</pre>
     */
    public static String shortTag(String tag) {
        if (tag == null) return "";
        int dot = tag.lastIndexOf('.');
        return dot >= 0 ? tag.substring(dot + 1) : tag;
    }
}
