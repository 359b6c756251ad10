package com.bplens.analyzer.ast.expr;

import com.bplens.analyzer.ast.AstVisitor;
import com.bplens.analyzer.ast.SourceLocation;

/**
 * 事件 / 委托处理函数引用
 */
public class EventReferenceExpr extends Expression {
    private final String eventName;

    public EventReferenceExpr(SourceLocation location, String eventName) {
        super(location);
        this.eventName = eventName;
    }

    public String getEventName() {
        return eventName;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitEventReferenceExpr(this, context);
    }
}
