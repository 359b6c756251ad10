package com.bplens.analyzer.ast.stmt;

import com.bplens.analyzer.ast.AstVisitor;
import com.bplens.analyzer.ast.SourceLocation;
import com.bplens.analyzer.ast.expr.Expression;

/**
 * 事件订阅 source.Event += handler / 取消订阅 -=
 */
public class EventSubscriptionStmt extends Statement {
    private final Expression source;
    private final String eventName;
    private final Expression handler;
    private final boolean unsubscribe;

    public EventSubscriptionStmt(SourceLocation location, Expression source, String eventName,
                                 Expression handler, boolean unsubscribe) {
        super(location);
        this.source = source;
        this.eventName = eventName;
        this.handler = handler;
        this.unsubscribe = unsubscribe;
    }

    public Expression getSource() {
        return source;
    }

    public String getEventName() {
        return eventName;
    }

    public Expression getHandler() {
        return handler;
    }

    public boolean isUnsubscribe() {
        return unsubscribe;
    }

    public String getOperator() {
        return unsubscribe ? "-=" : "+=";
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitEventSubscriptionStmt(this, context);
    }
}
