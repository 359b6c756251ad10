package com.bplens.analyzer.ast.expr;

import com.bplens.analyzer.ast.AstVisitor;
import com.bplens.analyzer.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 函数调用表达式
 */
public class FunctionCallExpr extends Expression {
    private final Expression target;     // 可选：调用目标对象
    private final String functionName;
    private final List<Argument> args;

    public FunctionCallExpr(SourceLocation location, Expression target, String functionName,
                            List<Argument> args) {
        super(location);
        this.target = target;
        this.functionName = functionName;
        this.args = Collections.unmodifiableList(new ArrayList<Argument>(args));
    }

    public Expression getTarget() {
        return target;
    }

    public boolean hasTarget() {
        return target != null;
    }

    public String getFunctionName() {
        return functionName;
    }

    public List<Argument> getArgs() {
        return args;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFunctionCallExpr(this, context);
    }

    /**
     * 调用参数（引脚名 + 值）
     */
    public static final class Argument {
        private final String name;
        private final Expression value;

        public Argument(String name, Expression value) {
            this.name = name;
            this.value = value;
        }

        public String getName() {
            return name;
        }

        public Expression getValue() {
            return value;
        }
    }
}
