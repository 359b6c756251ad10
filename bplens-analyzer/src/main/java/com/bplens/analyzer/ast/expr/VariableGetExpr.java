package com.bplens.analyzer.ast.expr;

import com.bplens.analyzer.ast.AstVisitor;
import com.bplens.analyzer.ast.SourceLocation;

/**
 * 变量读取
 */
public class VariableGetExpr extends Expression {
    private final String name;
    private final boolean selfContext;
    private final String originNodeGuid;  // 由类型转换声明的变量：对应转换节点 GUID

    public VariableGetExpr(SourceLocation location, String name, boolean selfContext) {
        this(location, name, selfContext, null);
    }

    public VariableGetExpr(SourceLocation location, String name, boolean selfContext, String originNodeGuid) {
        super(location);
        this.name = name;
        this.selfContext = selfContext;
        this.originNodeGuid = originNodeGuid;
    }

    public String getName() {
        return name;
    }

    public boolean isSelfContext() {
        return selfContext;
    }

    public String getOriginNodeGuid() {
        return originNodeGuid;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitVariableGetExpr(this, context);
    }
}
