package com.bplens.analyzer.ast.stmt;

import com.bplens.analyzer.ast.AstVisitor;
import com.bplens.analyzer.ast.SourceLocation;
import com.bplens.analyzer.ast.expr.Expression;

/**
 * 循环语句（ForEach / While）
 */
public class LoopStmt extends Statement {
    private final LoopKind loopKind;
    private final Expression collection;   // FOR_EACH
    private final Expression condition;    // WHILE
    private final VariableDecl itemDecl;
    private final VariableDecl indexDecl;
    private final ExecutionBlock body;

    public LoopStmt(SourceLocation location, LoopKind loopKind, Expression collection,
                    Expression condition, VariableDecl itemDecl, VariableDecl indexDecl,
                    ExecutionBlock body) {
        super(location);
        this.loopKind = loopKind;
        this.collection = collection;
        this.condition = condition;
        this.itemDecl = itemDecl;
        this.indexDecl = indexDecl;
        this.body = body;
    }

    public static LoopStmt forEach(SourceLocation location, Expression collection,
                                   VariableDecl itemDecl, VariableDecl indexDecl, ExecutionBlock body) {
        return new LoopStmt(location, LoopKind.FOR_EACH, collection, null, itemDecl, indexDecl, body);
    }

    public static LoopStmt whileLoop(SourceLocation location, Expression condition, ExecutionBlock body) {
        return new LoopStmt(location, LoopKind.WHILE, null, condition, null, null, body);
    }

    public LoopKind getLoopKind() {
        return loopKind;
    }

    public Expression getCollection() {
        return collection;
    }

    public Expression getCondition() {
        return condition;
    }

    public VariableDecl getItemDecl() {
        return itemDecl;
    }

    public VariableDecl getIndexDecl() {
        return indexDecl;
    }

    public ExecutionBlock getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLoopStmt(this, context);
    }

    public enum LoopKind {
        FOR_EACH,
        WHILE
    }
}
