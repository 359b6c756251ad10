package com.bplens.analyzer.ast.expr;

import com.bplens.analyzer.ast.AstVisitor;
import com.bplens.analyzer.ast.SourceLocation;
import com.bplens.analyzer.graph.GraphPin;

/**
 * 字面量表达式。诊断值（悬空引用、循环引用）也以 {@link LiteralKind#ERROR} 字面量表示。
 */
public class Literal extends Expression {
    public static final String NODE_NOT_FOUND = "<node_not_found>";
    public static final String PIN_NOT_FOUND = "<pin_not_found>";
    public static final String CIRCULAR_REFERENCE = "<circular_reference>";

    private final String value;   // null 表示空值
    private final LiteralKind kind;

    public Literal(SourceLocation location, String value, LiteralKind kind) {
        super(location);
        this.value = value;
        this.kind = kind;
    }

    public static Literal nullLiteral() {
        return new Literal(SourceLocation.UNKNOWN, null, LiteralKind.NULL);
    }

    public static Literal bool(boolean value) {
        return new Literal(SourceLocation.UNKNOWN, String.valueOf(value), LiteralKind.BOOLEAN);
    }

    public static Literal error(String message, SourceLocation location) {
        return new Literal(location, message, LiteralKind.ERROR);
    }

    /** 由未连接引脚的默认值构造 */
    public static Literal fromPin(GraphPin pin) {
        if (pin == null) return nullLiteral();
        String value = pin.getDefaultValue();
        LiteralKind kind = LiteralKind.fromCategory(pin.getCategory());
        if (value == null || (kind == LiteralKind.OBJECT && (value.isEmpty() || "None".equals(value)))) {
            return new Literal(SourceLocation.UNKNOWN, null, LiteralKind.NULL);
        }
        return new Literal(SourceLocation.UNKNOWN, value, kind);
    }

    public String getValue() {
        return value;
    }

    public LiteralKind getKind() {
        return kind;
    }

    public boolean isError() {
        return kind == LiteralKind.ERROR;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitLiteral(this, context);
    }

    /**
     * 字面量类型
     */
    public enum LiteralKind {
        BOOLEAN,
        INT,
        FLOAT,
        STRING,
        OBJECT,
        NULL,
        ERROR,
        UNKNOWN;

        /** 按引脚类别推断 */
        public static LiteralKind fromCategory(String category) {
            if (category == null) return UNKNOWN;
            switch (category.toLowerCase()) {
                case "bool":
                    return BOOLEAN;
                case "int":
                case "int64":
                case "byte":
                    return INT;
                case "float":
                case "double":
                case "real":
                    return FLOAT;
                case "string":
                case "name":
                case "text":
                    return STRING;
                case "object":
                case "class":
                case "softobject":
                case "softclass":
                case "interface":
                    return OBJECT;
                default:
                    return UNKNOWN;
            }
        }
    }
}
