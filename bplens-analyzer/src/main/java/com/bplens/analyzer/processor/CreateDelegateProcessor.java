package com.bplens.analyzer.processor;

import com.bplens.analyzer.analysis.AnalysisContext;
import com.bplens.analyzer.ast.SourceLocation;
import com.bplens.analyzer.ast.expr.EventReferenceExpr;
import com.bplens.analyzer.ast.expr.Expression;
import com.bplens.analyzer.graph.GraphNode;
import com.bplens.analyzer.graph.GraphPin;
import com.bplens.analyzer.graph.NodeProperties;

/**
 * 创建委托：引用 SelectedFunctionName 指定的函数
 */
public class CreateDelegateProcessor implements NodeProcessor {

    @Override
    public NodeProcessingResult process(GraphNode node, AnalysisContext context) {
        return NodeProcessingResult.of(produceExpression(node, null, context));
    }

    @Override
    public Expression produceExpression(GraphNode node, GraphPin outputPin, AnalysisContext context) {
        return new EventReferenceExpr(SourceLocation.of(node),
                NodeProperties.string(node, "SelectedFunctionName", "UnknownEvent"));
    }
}
