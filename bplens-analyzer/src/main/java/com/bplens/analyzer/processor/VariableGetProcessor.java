package com.bplens.analyzer.processor;

import com.bplens.analyzer.analysis.AnalysisContext;
import com.bplens.analyzer.ast.SourceLocation;
import com.bplens.analyzer.ast.expr.Expression;
import com.bplens.analyzer.ast.expr.PropertyAccessExpr;
import com.bplens.analyzer.ast.expr.VariableGetExpr;
import com.bplens.analyzer.graph.GraphNode;
import com.bplens.analyzer.graph.GraphPin;
import com.bplens.analyzer.graph.NodeProperties;

import java.util.List;

/**
 * 变量读取：self 引脚已连接时为属性访问
 */
public class VariableGetProcessor implements NodeProcessor {

    @Override
    public NodeProcessingResult process(GraphNode node, AnalysisContext context) {
        List<GraphPin> outputs = node.getDataOutputs();
        return NodeProcessingResult.of(produceExpression(node, outputs.isEmpty() ? null : outputs.get(0), context));
    }

    @Override
    public Expression produceExpression(GraphNode node, GraphPin outputPin, AnalysisContext context) {
        SourceLocation location = SourceLocation.of(node);
        String name = NodeProperties.memberName(node, "VariableReference", "UnknownVariable");
        Expression target = ProcessorSupport.selfTarget(node, context);
        if (target != null) {
            return new PropertyAccessExpr(location, target, name);
        }
        return new VariableGetExpr(location, name, NodeProperties.isSelfContext(node, "VariableReference"));
    }
}
