package com.bplens.analyzer.processor;

import com.bplens.analyzer.analysis.AnalysisContext;
import com.bplens.analyzer.ast.SourceLocation;
import com.bplens.analyzer.ast.expr.Expression;
import com.bplens.analyzer.ast.expr.Literal;
import com.bplens.analyzer.ast.expr.VariableGetExpr;
import com.bplens.analyzer.ast.stmt.EventSubscriptionStmt;
import com.bplens.analyzer.graph.GraphNode;
import com.bplens.analyzer.graph.GraphPin;
import com.bplens.analyzer.graph.NodeKind;
import com.bplens.analyzer.graph.NodeProperties;

/**
 * 事件订阅：AddDelegate / AssignDelegate 为 +=，RemoveDelegate 为 -=
 */
public class EventSubscriptionProcessor implements NodeProcessor {

    @Override
    public NodeProcessingResult process(GraphNode node, AnalysisContext context) {
        SourceLocation location = SourceLocation.of(node);
        Expression source = ProcessorSupport.selfTarget(node, context);
        if (source == null) {
            source = new VariableGetExpr(location, ProcessorSupport.SELF_PIN, true);
        }
        String eventName = NodeProperties.memberName(node, "DelegateReference", "UnknownDelegate");
        GraphPin delegatePin = node.findInput("Delegate");
        Expression handler = delegatePin != null ? context.resolve(delegatePin) : Literal.nullLiteral();

        return NodeProcessingResult.of(new EventSubscriptionStmt(location, source, eventName, handler,
                node.getKind() == NodeKind.REMOVE_DELEGATE));
    }
}
