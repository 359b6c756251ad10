package com.bplens.analyzer.processor;

import com.bplens.analyzer.analysis.AnalysisContext;
import com.bplens.analyzer.ast.SourceLocation;
import com.bplens.analyzer.ast.expr.Expression;
import com.bplens.analyzer.ast.expr.FunctionCallExpr;
import com.bplens.analyzer.graph.GraphNode;
import com.bplens.analyzer.graph.GraphPin;
import com.bplens.analyzer.graph.NodeProperties;

/**
 * 数学表达式节点：MathExpression(表达式文本)(参数...)
 */
public class MathExpressionProcessor implements NodeProcessor {

    @Override
    public NodeProcessingResult process(GraphNode node, AnalysisContext context) {
        return NodeProcessingResult.of(produceExpression(node, null, context));
    }

    @Override
    public Expression produceExpression(GraphNode node, GraphPin outputPin, AnalysisContext context) {
        String expression = NodeProperties.string(node, "Expression", "");
        return new FunctionCallExpr(SourceLocation.of(node), null, "MathExpression(" + expression + ")",
                ProcessorSupport.arguments(node, context));
    }
}
