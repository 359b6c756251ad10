package com.bplens.analyzer.processor;

import com.bplens.analyzer.analysis.AnalysisContext;
import com.bplens.analyzer.ast.SourceLocation;
import com.bplens.analyzer.ast.expr.Expression;
import com.bplens.analyzer.ast.expr.FunctionCallExpr;
import com.bplens.analyzer.ast.stmt.FunctionCallStmt;
import com.bplens.analyzer.graph.GraphNode;
import com.bplens.analyzer.graph.GraphPin;
import com.bplens.analyzer.graph.NodeProperties;

/**
 * 没有专用处理器的宏，按函数调用 Macro_宏名(...) 表达
 */
public class GenericMacroProcessor implements NodeProcessor {

    @Override
    public NodeProcessingResult process(GraphNode node, AnalysisContext context) {
        return NodeProcessingResult.of(new FunctionCallStmt(SourceLocation.of(node), buildCall(node, context)));
    }

    @Override
    public Expression produceExpression(GraphNode node, GraphPin outputPin, AnalysisContext context) {
        return node.hasExecPins() ? null : buildCall(node, context);
    }

    private static FunctionCallExpr buildCall(GraphNode node, AnalysisContext context) {
        String macro = NodeProperties.macroName(node);
        return new FunctionCallExpr(SourceLocation.of(node), null,
                "Macro_" + (macro != null ? macro : "UnknownMacro"),
                ProcessorSupport.arguments(node, context));
    }
}
