package com.bplens.analyzer.processor;

import com.bplens.analyzer.analysis.AnalysisContext;
import com.bplens.analyzer.ast.SourceLocation;
import com.bplens.analyzer.ast.expr.Expression;
import com.bplens.analyzer.ast.expr.FunctionCallExpr;
import com.bplens.analyzer.ast.expr.Literal;
import com.bplens.analyzer.graph.GraphNode;
import com.bplens.analyzer.graph.GraphPin;
import com.bplens.analyzer.graph.NodeProperties;
import com.bplens.analyzer.graph.PinDirection;

import java.util.ArrayList;
import java.util.List;

/**
 * 处理器共用的引脚查找与参数解析
 */
public final class ProcessorSupport {

    public static final String SELF_PIN = "self";
    public static final String THEN_PIN = "then";

    private ProcessorSupport() {}

    /** 函数名：FunctionReference 的 MemberName */
    public static String functionName(GraphNode node, String fallback) {
        return NodeProperties.memberName(node, "FunctionReference", fallback);
    }

    /** self 输入已连接时解析为调用目标，否则为 null */
    public static Expression selfTarget(GraphNode node, AnalysisContext context) {
        GraphPin self = node.findInput(SELF_PIN);
        return self != null && self.isLinked() ? context.resolve(self) : null;
    }

    /**
     * 调用参数：数据输入中排除 self、委托引脚与指定名称
     */
    public static List<FunctionCallExpr.Argument> arguments(GraphNode node, AnalysisContext context,
                                                            String... excluded) {
        List<FunctionCallExpr.Argument> args = new ArrayList<FunctionCallExpr.Argument>();
        for (GraphPin pin : node.getDataInputs()) {
            if (pin.isDelegate() || SELF_PIN.equals(pin.getName()) || isExcluded(pin.getName(), excluded)) {
                continue;
            }
            args.add(new FunctionCallExpr.Argument(pin.getName(), context.resolve(pin)));
        }
        return args;
    }

    /** 无专用处理器的节点按普通函数调用表达 */
    public static FunctionCallExpr genericCall(GraphNode node, AnalysisContext context) {
        return new FunctionCallExpr(SourceLocation.of(node), selfTarget(node, context),
                functionName(node, node.getShortKind()), arguments(node, context));
    }

    /** 解析指定名称的输入引脚；引脚不存在时返回 fallback */
    public static Expression resolveInput(GraphNode node, String pinName, AnalysisContext context,
                                          Expression fallback) {
        GraphPin pin = node.findInput(pinName);
        return pin != null ? context.resolve(pin) : fallback;
    }

    public static Expression resolveInputOrNull(GraphNode node, String pinName, AnalysisContext context) {
        return resolveInput(node, pinName, context, Literal.nullLiteral());
    }

    /** then 执行输出，没有时取第一个执行输出 */
    public static GraphPin thenPin(GraphNode node) {
        GraphPin then = findExecOutput(node, THEN_PIN);
        if (then != null) return then;
        List<GraphPin> outputs = node.getExecOutputs();
        return outputs.isEmpty() ? null : outputs.get(0);
    }

    /** 按别名查找执行输出（忽略大小写） */
    public static GraphPin findExecOutput(GraphNode node, String... aliases) {
        GraphPin pin = node.findPinByAliases(PinDirection.OUTPUT, aliases);
        return pin != null && pin.isExec() ? pin : null;
    }

    private static boolean isExcluded(String name, String[] excluded) {
        for (String e : excluded) {
            if (e.equalsIgnoreCase(name)) return true;
        }
        return false;
    }
}
