package com.bplens.analyzer.ast.stmt;

import com.bplens.analyzer.ast.AstVisitor;
import com.bplens.analyzer.ast.SourceLocation;
import com.bplens.analyzer.ast.expr.FunctionCallExpr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 异步 / 延迟动作：一次调用 + 若干命名回调
 */
public class LatentActionStmt extends Statement {
    private final FunctionCallExpr call;
    private final List<CallbackBlock> callbacks;

    public LatentActionStmt(SourceLocation location, FunctionCallExpr call, List<CallbackBlock> callbacks) {
        super(location);
        this.call = call;
        this.callbacks = Collections.unmodifiableList(new ArrayList<CallbackBlock>(callbacks));
    }

    public FunctionCallExpr getCall() {
        return call;
    }

    public List<CallbackBlock> getCallbacks() {
        return callbacks;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLatentActionStmt(this, context);
    }

    /**
     * 回调（如 OnSuccess），参数为回调负载
     */
    public static final class CallbackBlock {
        private final String name;
        private final List<VariableDecl> parameters;
        private final ExecutionBlock body;

        public CallbackBlock(String name, List<VariableDecl> parameters, ExecutionBlock body) {
            this.name = name;
            this.parameters = Collections.unmodifiableList(new ArrayList<VariableDecl>(parameters));
            this.body = body;
        }

        public String getName() {
            return name;
        }

        public List<VariableDecl> getParameters() {
            return parameters;
        }

        public ExecutionBlock getBody() {
            return body;
        }
    }
}
