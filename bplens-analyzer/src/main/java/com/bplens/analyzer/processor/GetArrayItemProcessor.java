package com.bplens.analyzer.processor;

import com.bplens.analyzer.analysis.AnalysisContext;
import com.bplens.analyzer.ast.SourceLocation;
import com.bplens.analyzer.ast.expr.Expression;
import com.bplens.analyzer.ast.expr.FunctionCallExpr;
import com.bplens.analyzer.ast.expr.Literal;
import com.bplens.analyzer.graph.GraphNode;
import com.bplens.analyzer.graph.GraphPin;
import com.bplens.analyzer.graph.PinDirection;

import java.util.Collections;

/**
 * 数组取元素：array.Get(Index)
 */
public class GetArrayItemProcessor implements NodeProcessor {

    @Override
    public NodeProcessingResult process(GraphNode node, AnalysisContext context) {
        return NodeProcessingResult.of(produceExpression(node, null, context));
    }

    @Override
    public Expression produceExpression(GraphNode node, GraphPin outputPin, AnalysisContext context) {
        SourceLocation location = SourceLocation.of(node);
        GraphPin arrayPin = node.findPinByAliases(PinDirection.INPUT, "TargetArray", "Array");
        Expression array = arrayPin != null ? context.resolve(arrayPin) : Literal.nullLiteral();
        GraphPin indexPin = node.findInput("Index");
        Expression index = indexPin != null
                ? context.resolve(indexPin)
                : new Literal(location, "0", Literal.LiteralKind.INT);
        return new FunctionCallExpr(location, array, "Get",
                Collections.singletonList(new FunctionCallExpr.Argument("Index", index)));
    }
}
