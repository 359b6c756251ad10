package com.bplens.analyzer.processor;

import com.bplens.analyzer.analysis.AnalysisContext;
import com.bplens.analyzer.ast.SourceLocation;
import com.bplens.analyzer.ast.expr.Expression;
import com.bplens.analyzer.ast.expr.Literal;
import com.bplens.analyzer.ast.stmt.BranchStmt;
import com.bplens.analyzer.ast.stmt.ExecutionBlock;
import com.bplens.analyzer.graph.GraphNode;
import com.bplens.analyzer.graph.GraphPin;

/**
 * 条件分支 K2Node_IfThenElse。then/True 与 else/False 为等价别名。
 */
public class BranchProcessor implements NodeProcessor {

    @Override
    public NodeProcessingResult process(GraphNode node, AnalysisContext context) {
        GraphPin conditionPin = node.findInput("Condition");
        Expression condition = conditionPin == null
                || (!conditionPin.isLinked() && conditionPin.getDefaultValue() == null)
                ? Literal.bool(false)
                : context.resolve(conditionPin);

        ExecutionBlock thenBlock = walkArm(ProcessorSupport.findExecOutput(node, "then", "True"),
                "branch:then", context);
        ExecutionBlock elseBlock = walkArm(ProcessorSupport.findExecOutput(node, "else", "False"),
                "branch:else", context);
        return NodeProcessingResult.terminal(
                new BranchStmt(SourceLocation.of(node), condition, thenBlock, elseBlock));
    }

    static ExecutionBlock walkArm(GraphPin pin, String owner, AnalysisContext context) {
        return pin != null ? context.walkScoped(pin, owner) : ExecutionBlock.empty();
    }
}
