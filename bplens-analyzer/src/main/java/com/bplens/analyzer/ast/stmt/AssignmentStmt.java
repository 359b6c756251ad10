package com.bplens.analyzer.ast.stmt;

import com.bplens.analyzer.ast.AstVisitor;
import com.bplens.analyzer.ast.SourceLocation;
import com.bplens.analyzer.ast.expr.Expression;

/**
 * 赋值语句 target = value
 */
public class AssignmentStmt extends Statement {
    private final Expression target;
    private final Expression value;
    private final String operator;

    public AssignmentStmt(SourceLocation location, Expression target, Expression value) {
        this(location, target, value, "=");
    }

    public AssignmentStmt(SourceLocation location, Expression target, Expression value, String operator) {
        super(location);
        this.target = target;
        this.value = value;
        this.operator = operator;
    }

    public Expression getTarget() {
        return target;
    }

    public Expression getValue() {
        return value;
    }

    public String getOperator() {
        return operator;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitAssignmentStmt(this, context);
    }
}
