package com.bplens.analyzer.ast.expr;

import com.bplens.analyzer.ast.AstVisitor;
import com.bplens.analyzer.ast.SourceLocation;

/**
 * 循环变量引用（元素或索引）
 */
public class LoopVariableExpr extends Expression {
    private final String name;
    private final boolean index;
    private final String loopId;  // 所属循环宏节点 GUID

    public LoopVariableExpr(SourceLocation location, String name, boolean index, String loopId) {
        super(location);
        this.name = name;
        this.index = index;
        this.loopId = loopId;
    }

    public String getName() {
        return name;
    }

    public boolean isIndex() {
        return index;
    }

    public String getLoopId() {
        return loopId;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLoopVariableExpr(this, context);
    }
}
