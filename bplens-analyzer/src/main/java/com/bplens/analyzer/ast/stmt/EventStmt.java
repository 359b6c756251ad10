package com.bplens.analyzer.ast.stmt;

import com.bplens.analyzer.ast.AstVisitor;
import com.bplens.analyzer.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 事件 / 函数入口
 */
public class EventStmt extends Statement {
    private final String eventName;
    private final List<Parameter> parameters;
    private final ExecutionBlock body;

    public EventStmt(SourceLocation location, String eventName, List<Parameter> parameters,
                     ExecutionBlock body) {
        super(location);
        this.eventName = eventName;
        this.parameters = Collections.unmodifiableList(new ArrayList<Parameter>(parameters));
        this.body = body;
    }

    public String getEventName() {
        return eventName;
    }

    public List<Parameter> getParameters() {
        return parameters;
    }

    public ExecutionBlock getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitEventStmt(this, context);
    }

    /**
     * 事件参数
     */
    public static final class Parameter {
        private final String name;
        private final String type;

        public Parameter(String name, String type) {
            this.name = name;
            this.type = type;
        }

        public String getName() {
            return name;
        }

        public String getType() {
            return type;
        }
    }
}
