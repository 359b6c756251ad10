package com.bplens.analyzer.processor;

import com.bplens.analyzer.graph.GraphNode;
import com.bplens.analyzer.graph.NodeKind;
import com.bplens.analyzer.graph.NodeProperties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 处理器注册表：节点类型键 -> 处理器。
 *
 * <p>查找顺序：宏实例的复合键 "K2Node_MacroInstance:宏名" -> 类型键 -> 通用可调用节点 -> 回退。
 * 对任何节点都返回非 null 的处理器。</p>
 */
public final class ProcessorRegistry {
    private static final Logger LOG = Logger.getLogger(ProcessorRegistry.class.getName());

    static final String SCRIPT_PREFIX = "/Script/BlueprintGraph.";

    private final Map<String, NodeProcessor> processors = new LinkedHashMap<String, NodeProcessor>();
    private final NodeProcessor genericCallable;
    private final NodeProcessor fallback;

    public ProcessorRegistry() {
        this.genericCallable = new GenericCallableProcessor();
        this.fallback = new FallbackProcessor();
    }

    /**
     * 注册处理器。K2Node_ 开头的键同时注册 /Script/BlueprintGraph. 长名。
     */
    public ProcessorRegistry register(String kindKey, NodeProcessor processor) {
        processors.put(kindKey, processor);
        if (kindKey.startsWith("K2Node_")) {
            processors.put(SCRIPT_PREFIX + kindKey, processor);
        }
        return this;
    }

    public ProcessorRegistry register(NodeKind kind, NodeProcessor processor) {
        return register(kind.getShortName(), processor);
    }

    public NodeProcessor get(String kindKey) {
        return kindKey != null ? processors.get(kindKey) : null;
    }

    public boolean contains(String kindKey) {
        return processors.containsKey(kindKey);
    }

    public Map<String, NodeProcessor> getProcessors() {
        return Collections.unmodifiableMap(processors);
    }

    /** 为节点选择处理器 */
    public NodeProcessor find(GraphNode node) {
        if (node.getKind() == NodeKind.MACRO_INSTANCE) {
            String macro = NodeProperties.macroName(node);
            if (macro != null) {
                NodeProcessor specific = get(node.getShortKind() + ":" + macro);
                if (specific == null) specific = get(node.getKindTag() + ":" + macro);
                if (specific != null) return specific;
            }
        }

        NodeProcessor processor = get(node.getKindTag());
        if (processor == null) processor = get(node.getShortKind());
        if (processor != null) return processor;

        if (node.hasExecPins() && node.hasDataPins()) {
            LOG.fine("按通用调用处理: " + node);
            return genericCallable;
        }
        LOG.fine("未知节点类型，回退: " + node);
        return fallback;
    }

    /**
     * 默认注册表：所有内置处理器
     */
    public static ProcessorRegistry createDefault() {
        ProcessorRegistry registry = new ProcessorRegistry();

        EventProcessor event = new EventProcessor();
        registry.register(NodeKind.EVENT, event);
        registry.register(NodeKind.CUSTOM_EVENT, event);
        registry.register(NodeKind.COMPONENT_BOUND_EVENT, event);
        registry.register(NodeKind.FUNCTION_ENTRY, event);

        registry.register(NodeKind.VARIABLE_GET, new VariableGetProcessor());
        registry.register(NodeKind.VARIABLE_SET, new VariableSetProcessor());

        FunctionCallProcessor call = new FunctionCallProcessor();
        registry.register(NodeKind.CALL_FUNCTION, call);
        registry.register(NodeKind.CALL_ARRAY_FUNCTION, call);
        registry.register(NodeKind.CALL_PARENT_FUNCTION, call);
        registry.register(NodeKind.BINARY_OPERATOR, call);

        registry.register(NodeKind.IF_THEN_ELSE, new BranchProcessor());
        registry.register(NodeKind.EXECUTION_SEQUENCE, new SequenceProcessor());
        registry.register(NodeKind.DYNAMIC_CAST, new CastProcessor());
        registry.register(NodeKind.KNOT, new KnotProcessor());
        registry.register(NodeKind.SELF, new SelfProcessor());
        registry.register(NodeKind.LITERAL, new LiteralProcessor());
        registry.register(NodeKind.MATH_EXPRESSION, new MathExpressionProcessor());
        GetArrayItemProcessor arrayGet = new GetArrayItemProcessor();
        registry.register(NodeKind.GET_ARRAY_ITEM, arrayGet);
        registry.register("K2Node_ArrayGet", arrayGet);

        String macro = NodeKind.MACRO_INSTANCE.getShortName();
        ForEachProcessor forEach = new ForEachProcessor();
        registry.register(macro + ":ForEachLoop", forEach);
        registry.register(macro + ":ForEachLoopWithBreak", forEach);
        registry.register(macro + ":ReverseForEachLoop", forEach);
        registry.register(macro + ":WhileLoop", new WhileProcessor());
        registry.register(macro, new GenericMacroProcessor());

        LatentActionProcessor latent = new LatentActionProcessor();
        registry.register(NodeKind.LATENT_ABILITY_CALL, latent);
        registry.register(NodeKind.ASYNC_ACTION, latent);
        registry.register(NodeKind.BASE_ASYNC_TASK, latent);

        EventSubscriptionProcessor subscription = new EventSubscriptionProcessor();
        registry.register(NodeKind.ADD_DELEGATE, subscription);
        registry.register(NodeKind.ASSIGN_DELEGATE, subscription);
        registry.register(NodeKind.REMOVE_DELEGATE, subscription);
        registry.register(NodeKind.CREATE_DELEGATE, new CreateDelegateProcessor());

        return registry;
    }
}
