package com.bplens.analyzer.ast.stmt;

import com.bplens.analyzer.ast.AstVisitor;
import com.bplens.analyzer.ast.SourceLocation;
import com.bplens.analyzer.ast.expr.Expression;

/**
 * 局部变量声明：类型转换结果、循环变量或回调参数
 */
public class VariableDecl extends Statement {
    private final String name;
    private final String typeName;
    private final Expression initialValue;
    private final boolean loopVariable;
    private final boolean callbackParameter;

    public VariableDecl(SourceLocation location, String name, String typeName, Expression initialValue) {
        this(location, name, typeName, initialValue, false, false);
    }

    public VariableDecl(SourceLocation location, String name, String typeName, Expression initialValue,
                        boolean loopVariable, boolean callbackParameter) {
        super(location);
        this.name = name;
        this.typeName = typeName;
        this.initialValue = initialValue;
        this.loopVariable = loopVariable;
        this.callbackParameter = callbackParameter;
    }

    public static VariableDecl loopVariable(SourceLocation location, String name, String typeName) {
        return new VariableDecl(location, name, typeName, null, true, false);
    }

    public static VariableDecl callbackParameter(SourceLocation location, String name, String typeName) {
        return new VariableDecl(location, name, typeName, null, false, true);
    }

    public String getName() {
        return name;
    }

    public String getTypeName() {
        return typeName;
    }

    public Expression getInitialValue() {
        return initialValue;
    }

    public boolean isLoopVariable() {
        return loopVariable;
    }

    public boolean isCallbackParameter() {
        return callbackParameter;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitVariableDecl(this, context);
    }
}
