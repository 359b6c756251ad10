package com.bplens.analyzer.processor;

import com.bplens.analyzer.analysis.AnalysisContext;
import com.bplens.analyzer.ast.SourceLocation;
import com.bplens.analyzer.ast.expr.Expression;
import com.bplens.analyzer.ast.expr.FunctionCallExpr;
import com.bplens.analyzer.ast.expr.PropertyAccessExpr;
import com.bplens.analyzer.ast.stmt.FunctionCallStmt;
import com.bplens.analyzer.graph.GraphNode;
import com.bplens.analyzer.graph.GraphPin;
import com.bplens.analyzer.graph.NodeKind;
import com.bplens.analyzer.graph.PinDirection;

/**
 * 函数调用：CallFunction / CallArrayFunction / CallParentFunction / 交换结合二元运算
 *
 * <p>有执行引脚时为语句，否则为表达式。数组函数的目标数组引脚作为调用目标。</p>
 */
public class FunctionCallProcessor implements NodeProcessor {

    static final String RETURN_VALUE = "ReturnValue";

    @Override
    public NodeProcessingResult process(GraphNode node, AnalysisContext context) {
        FunctionCallExpr call = buildCall(node, context);
        if (node.hasExecPins()) {
            return NodeProcessingResult.of(new FunctionCallStmt(SourceLocation.of(node), call));
        }
        return NodeProcessingResult.of(call);
    }

    @Override
    public Expression produceExpression(GraphNode node, GraphPin outputPin, AnalysisContext context) {
        FunctionCallExpr call = buildCall(node, context);
        if (outputPin != null && node.getDataOutputs().size() > 1
                && !RETURN_VALUE.equals(outputPin.getName())) {
            return new PropertyAccessExpr(SourceLocation.of(node), call, outputPin.getName());
        }
        return call;
    }

    FunctionCallExpr buildCall(GraphNode node, AnalysisContext context) {
        String name = ProcessorSupport.functionName(node, "UnknownFunction");
        if (node.getKind() == NodeKind.CALL_ARRAY_FUNCTION) {
            GraphPin array = node.findPinByAliases(PinDirection.INPUT, "TargetArray", "Array");
            if (array != null) {
                return new FunctionCallExpr(SourceLocation.of(node), context.resolve(array), name,
                        ProcessorSupport.arguments(node, context, array.getName()));
            }
        }
        return new FunctionCallExpr(SourceLocation.of(node), ProcessorSupport.selfTarget(node, context),
                name, ProcessorSupport.arguments(node, context));
    }
}
