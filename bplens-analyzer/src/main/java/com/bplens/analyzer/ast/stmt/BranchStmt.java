package com.bplens.analyzer.ast.stmt;

import com.bplens.analyzer.ast.AstVisitor;
import com.bplens.analyzer.ast.SourceLocation;
import com.bplens.analyzer.ast.expr.Expression;

/**
 * 条件分支
 */
public class BranchStmt extends Statement {
    private final Expression condition;
    private final ExecutionBlock thenBlock;
    private final ExecutionBlock elseBlock;

    public BranchStmt(SourceLocation location, Expression condition, ExecutionBlock thenBlock,
                      ExecutionBlock elseBlock) {
        super(location);
        this.condition = condition;
        this.thenBlock = thenBlock;
        this.elseBlock = elseBlock;
    }

    public Expression getCondition() {
        return condition;
    }

    public ExecutionBlock getThenBlock() {
        return thenBlock;
    }

    public ExecutionBlock getElseBlock() {
        return elseBlock;
    }

    public boolean hasElse() {
        return elseBlock != null && !elseBlock.isEmpty();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitBranchStmt(this, context);
    }
}
