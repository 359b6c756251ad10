package com.bplens.analyzer.ast.expr;

import com.bplens.analyzer.ast.AstVisitor;
import com.bplens.analyzer.ast.SourceLocation;

/**
 * 类型转换表达式
 */
public class CastExpr extends Expression {
    private final Expression operand;
    private final String targetType;
    private final String castNodeGuid;

    public CastExpr(SourceLocation location, Expression operand, String targetType, String castNodeGuid) {
        super(location);
        this.operand = operand;
        this.targetType = targetType;
        this.castNodeGuid = castNodeGuid;
    }

    public Expression getOperand() {
        return operand;
    }

    public String getTargetType() {
        return targetType;
    }

    /** 产生此转换的图节点，用于识别重复的“转换后再赋值” */
    public String getCastNodeGuid() {
        return castNodeGuid;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitCastExpr(this, context);
    }
}
