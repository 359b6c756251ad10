package com.bplens.analyzer.ast.stmt;

import com.bplens.analyzer.ast.AstVisitor;
import com.bplens.analyzer.ast.SourceLocation;
import com.bplens.analyzer.ast.expr.FunctionCallExpr;

/**
 * 带执行引脚的函数调用
 */
public class FunctionCallStmt extends Statement {
    private final FunctionCallExpr call;

    public FunctionCallStmt(SourceLocation location, FunctionCallExpr call) {
        super(location);
        this.call = call;
    }

    public FunctionCallExpr getCall() {
        return call;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionCallStmt(this, context);
    }
}
