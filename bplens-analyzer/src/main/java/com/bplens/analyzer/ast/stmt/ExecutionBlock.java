package com.bplens.analyzer.ast.stmt;

import com.bplens.analyzer.ast.AstVisitor;
import com.bplens.analyzer.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 顺序执行的语句块
 */
public class ExecutionBlock extends Statement {
    private final List<Statement> statements;

    public ExecutionBlock(SourceLocation location, List<Statement> statements) {
        super(location);
        this.statements = Collections.unmodifiableList(new ArrayList<Statement>(statements));
    }

    public static ExecutionBlock empty() {
        return new ExecutionBlock(SourceLocation.UNKNOWN, Collections.<Statement>emptyList());
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitExecutionBlock(this, context);
    }
}
