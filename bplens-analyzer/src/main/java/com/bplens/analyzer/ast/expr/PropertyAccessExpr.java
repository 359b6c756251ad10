package com.bplens.analyzer.ast.expr;

import com.bplens.analyzer.ast.AstVisitor;
import com.bplens.analyzer.ast.SourceLocation;

/**
 * 属性访问 target.property
 */
public class PropertyAccessExpr extends Expression {
    private final Expression target;
    private final String propertyName;

    public PropertyAccessExpr(SourceLocation location, Expression target, String propertyName) {
        super(location);
        this.target = target;
        this.propertyName = propertyName;
    }

    public Expression getTarget() {
        return target;
    }

    public String getPropertyName() {
        return propertyName;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitPropertyAccessExpr(this, context);
    }
}
