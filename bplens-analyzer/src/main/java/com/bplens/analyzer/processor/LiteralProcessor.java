package com.bplens.analyzer.processor;

import com.bplens.analyzer.analysis.AnalysisContext;
import com.bplens.analyzer.ast.SourceLocation;
import com.bplens.analyzer.ast.expr.Expression;
import com.bplens.analyzer.ast.expr.Literal;
import com.bplens.analyzer.graph.GraphNode;
import com.bplens.analyzer.graph.GraphPin;
import com.bplens.analyzer.graph.NodeProperties;

/**
 * 对象字面量 K2Node_Literal（ObjectRef）
 */
public class LiteralProcessor implements NodeProcessor {

    @Override
    public NodeProcessingResult process(GraphNode node, AnalysisContext context) {
        return NodeProcessingResult.of(produceExpression(node, null, context));
    }

    @Override
    public Expression produceExpression(GraphNode node, GraphPin outputPin, AnalysisContext context) {
        String ref = NodeProperties.string(node, "ObjectRef", null);
        if (ref == null) return Literal.nullLiteral();
        return new Literal(SourceLocation.of(node), ref, Literal.LiteralKind.OBJECT);
    }
}
