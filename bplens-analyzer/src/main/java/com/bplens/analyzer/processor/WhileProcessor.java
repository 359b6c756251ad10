package com.bplens.analyzer.processor;

import com.bplens.analyzer.analysis.AnalysisContext;
import com.bplens.analyzer.ast.SourceLocation;
import com.bplens.analyzer.ast.expr.Expression;
import com.bplens.analyzer.ast.expr.Literal;
import com.bplens.analyzer.ast.stmt.ExecutionBlock;
import com.bplens.analyzer.ast.stmt.LoopStmt;
import com.bplens.analyzer.graph.GraphNode;

/**
 * WhileLoop 宏，后继为 Completed 引脚
 */
public class WhileProcessor implements NodeProcessor {

    @Override
    public NodeProcessingResult process(GraphNode node, AnalysisContext context) {
        Expression condition = ProcessorSupport.resolveInput(node, "Condition", context, Literal.bool(true));
        ExecutionBlock body = BranchProcessor.walkArm(ProcessorSupport.findExecOutput(node, "LoopBody"),
                "while:" + node.getName(), context);
        return NodeProcessingResult.withContinuation(
                LoopStmt.whileLoop(SourceLocation.of(node), condition, body),
                ProcessorSupport.findExecOutput(node, "Completed"));
    }
}
