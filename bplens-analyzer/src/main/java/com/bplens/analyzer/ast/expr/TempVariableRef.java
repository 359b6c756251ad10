package com.bplens.analyzer.ast.expr;

import com.bplens.analyzer.ast.AstVisitor;
import com.bplens.analyzer.ast.SourceLocation;

/**
 * 临时变量引用（按名称查找，不持有声明节点）
 */
public class TempVariableRef extends Expression {
    private final String name;

    public TempVariableRef(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTempVariableRef(this, context);
    }
}
