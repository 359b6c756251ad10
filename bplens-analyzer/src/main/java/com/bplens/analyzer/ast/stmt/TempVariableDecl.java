package com.bplens.analyzer.ast.stmt;

import com.bplens.analyzer.ast.AstVisitor;
import com.bplens.analyzer.ast.SourceLocation;
import com.bplens.analyzer.ast.expr.Expression;

/**
 * 临时变量声明（多次使用的数据输出被提取为临时变量）
 */
public class TempVariableDecl extends Statement {
    private final String name;
    private final String typeName;
    private final Expression value;

    public TempVariableDecl(SourceLocation location, String name, String typeName, Expression value) {
        super(location);
        this.name = name;
        this.typeName = typeName;
        this.value = value;
    }

    public String getName() {
        return name;
    }

    public String getTypeName() {
        return typeName;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitTempVariableDecl(this, context);
    }
}
