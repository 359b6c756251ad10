package com.bplens.analyzer.formatter;

import com.bplens.analyzer.ast.AstVisitor;
import com.bplens.analyzer.ast.expr.*;
import com.bplens.analyzer.ast.stmt.*;

import java.util.List;
import java.util.Map;

/**
 * AST -> 伪代码
 *
 * <pre>
 * Event BeginPlay:
 *     Health = GetHealth()
 *     if (IsValid(Target)):
 *         Target.Destroy()
 * </pre>
 */
public class PseudocodeFormatter implements AstVisitor<Void, FormatterContext> {

    private static final String EMPTY_BLOCK = "// empty";

    public String format(List<Statement> statements, FormatConfig config) {
        FormatterContext ctx = new FormatterContext(config != null ? config : new FormatConfig());
        for (Statement statement : statements) {
            if (statement instanceof EventStmt) ctx.blankLine();
            statement.accept(this, ctx);
        }
        return ctx.getOutput();
    }

    public String format(List<Statement> statements) {
        return format(statements, new FormatConfig());
    }

    /** 单个表达式的文本形式 */
    public String formatExpression(Expression expression) {
        FormatterContext ctx = new FormatterContext(new FormatConfig());
        expression.accept(this, ctx);
        return ctx.getOutput();
    }

    // ============ 语句 ============

    @Override
    public Void visitExecutionBlock(ExecutionBlock node, FormatterContext ctx) {
        for (Statement statement : node.getStatements()) {
            statement.accept(this, ctx);
        }
        return null;
    }

    @Override
    public Void visitEventStmt(EventStmt node, FormatterContext ctx) {
        ctx.append("Event ");
        ctx.append(node.getEventName());
        if (!node.getParameters().isEmpty()) {
            ctx.append("(");
            List<EventStmt.Parameter> params = node.getParameters();
            for (int i = 0; i < params.size(); i++) {
                if (i > 0) ctx.append(", ");
                ctx.append(params.get(i).getName());
                appendType(params.get(i).getType(), ctx);
            }
            ctx.append(")");
        }
        ctx.append(":");
        ctx.newLine();
        formatBody(node.getBody(), false, ctx);
        return null;
    }

    @Override
    public Void visitAssignmentStmt(AssignmentStmt node, FormatterContext ctx) {
        node.getTarget().accept(this, ctx);
        ctx.append(" " + node.getOperator() + " ");
        node.getValue().accept(this, ctx);
        ctx.newLine();
        return null;
    }

    @Override
    public Void visitFunctionCallStmt(FunctionCallStmt node, FormatterContext ctx) {
        node.getCall().accept(this, ctx);
        ctx.newLine();
        return null;
    }

    @Override
    public Void visitBranchStmt(BranchStmt node, FormatterContext ctx) {
        ctx.append("if (");
        node.getCondition().accept(this, ctx);
        ctx.append("):");
        ctx.newLine();
        formatBody(node.getThenBlock(), true, ctx);
        if (node.hasElse()) {
            ctx.line("else:");
            formatBody(node.getElseBlock(), true, ctx);
        }
        return null;
    }

    @Override
    public Void visitLoopStmt(LoopStmt node, FormatterContext ctx) {
        if (node.getLoopKind() == LoopStmt.LoopKind.FOR_EACH) {
            ctx.append("for each (");
            ctx.append(node.getItemDecl() != null ? node.getItemDecl().getName() : "item");
            ctx.append(", ");
            ctx.append(node.getIndexDecl() != null ? node.getIndexDecl().getName() : "index");
            ctx.append(") in ");
            node.getCollection().accept(this, ctx);
        } else {
            ctx.append("while (");
            node.getCondition().accept(this, ctx);
            ctx.append(")");
        }
        ctx.append(":");
        ctx.newLine();
        formatBody(node.getBody(), true, ctx);
        return null;
    }

    @Override
    public Void visitLatentActionStmt(LatentActionStmt node, FormatterContext ctx) {
        ctx.append("await ");
        node.getCall().accept(this, ctx);
        ctx.newLine();
        for (LatentActionStmt.CallbackBlock callback : node.getCallbacks()) {
            if (callback.getBody().isEmpty()) continue;
            ctx.append("// " + callback.getName());
            if (!callback.getParameters().isEmpty()) {
                ctx.append("(");
                for (int i = 0; i < callback.getParameters().size(); i++) {
                    if (i > 0) ctx.append(", ");
                    ctx.append(callback.getParameters().get(i).getName());
                }
                ctx.append(")");
            }
            ctx.append(":");
            ctx.newLine();
            formatBody(callback.getBody(), false, ctx);
        }
        return null;
    }

    @Override
    public Void visitTempVariableDecl(TempVariableDecl node, FormatterContext ctx) {
        ctx.append("declare " + node.getName());
        appendType(node.getTypeName(), ctx);
        ctx.append(" = ");
        node.getValue().accept(this, ctx);
        ctx.newLine();
        return null;
    }

    @Override
    public Void visitVariableDecl(VariableDecl node, FormatterContext ctx) {
        if (node.getInitialValue() == null) {
            ctx.append("declare " + node.getName());
            appendType(node.getTypeName(), ctx);
            ctx.newLine();
            return null;
        }
        ctx.append(node.getName());
        appendType(node.getTypeName(), ctx);
        ctx.append(" = ");
        node.getInitialValue().accept(this, ctx);
        ctx.newLine();
        return null;
    }

    @Override
    public Void visitEventSubscriptionStmt(EventSubscriptionStmt node, FormatterContext ctx) {
        node.getSource().accept(this, ctx);
        ctx.append("." + node.getEventName() + " " + node.getOperator() + " ");
        node.getHandler().accept(this, ctx);
        ctx.newLine();
        return null;
    }

    @Override
    public Void visitFallbackStmt(FallbackStmt node, FormatterContext ctx) {
        String kind = shortKind(node.getKindName());
        StringBuilder sb = new StringBuilder("// Fallback: ").append(kind);
        if (node.getNodeName() != null && !node.getNodeName().equals(kind)) {
            sb.append(" (").append(node.getNodeName()).append(")");
        }
        if (!node.getProperties().isEmpty()) {
            sb.append(" [");
            boolean first = true;
            for (Map.Entry<String, String> entry : node.getProperties().entrySet()) {
                if (!first) sb.append(", ");
                sb.append(entry.getKey()).append("=").append(entry.getValue());
                first = false;
            }
            sb.append("]");
        }
        ctx.line(sb.toString());
        return null;
    }

    // ============ 表达式 ============

    @Override
    public Void visitLiteral(Literal node, FormatterContext ctx) {
        ctx.append(formatValue(node));
        return null;
    }

    @Override
    public Void visitVariableGetExpr(VariableGetExpr node, FormatterContext ctx) {
        ctx.append(node.getName());
        return null;
    }

    @Override
    public Void visitFunctionCallExpr(FunctionCallExpr node, FormatterContext ctx) {
        if (node.hasTarget()) {
            node.getTarget().accept(this, ctx);
            ctx.append(".");
        }
        ctx.append(node.getFunctionName());
        ctx.append("(");
        List<FunctionCallExpr.Argument> args = node.getArgs();
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) ctx.append(", ");
            FunctionCallExpr.Argument arg = args.get(i);
            // 单一的 Value 参数省略名称
            if (arg.getName() != null && !arg.getName().isEmpty() && !"value".equalsIgnoreCase(arg.getName())) {
                ctx.append(arg.getName() + ": ");
            }
            arg.getValue().accept(this, ctx);
        }
        ctx.append(")");
        return null;
    }

    @Override
    public Void visitCastExpr(CastExpr node, FormatterContext ctx) {
        ctx.append("cast(");
        node.getOperand().accept(this, ctx);
        ctx.append(" as " + node.getTargetType() + ")");
        return null;
    }

    @Override
    public Void visitPropertyAccessExpr(PropertyAccessExpr node, FormatterContext ctx) {
        node.getTarget().accept(this, ctx);
        ctx.append("." + node.getPropertyName());
        return null;
    }

    @Override
    public Void visitTempVariableRef(TempVariableRef node, FormatterContext ctx) {
        ctx.append(node.getName());
        return null;
    }

    @Override
    public Void visitEventReferenceExpr(EventReferenceExpr node, FormatterContext ctx) {
        ctx.append(node.getEventName());
        return null;
    }

    @Override
    public Void visitLoopVariableExpr(LoopVariableExpr node, FormatterContext ctx) {
        ctx.append(node.getName());
        return null;
    }

    // ============ 辅助方法 ============

    private void formatBody(ExecutionBlock body, boolean markEmpty, FormatterContext ctx) {
        ctx.indent();
        if (body == null || body.isEmpty()) {
            if (markEmpty) ctx.line(EMPTY_BLOCK);
        } else {
            body.accept(this, ctx);
        }
        ctx.dedent();
    }

    private void appendType(String type, FormatterContext ctx) {
        if (ctx.getConfig().isShowTypes() && type != null && !type.isEmpty() && !"unknown".equals(type)) {
            ctx.append(": " + type);
        }
    }

    /**
     * 字面量文本
     * <pre>
     * null                                  -> None
     * "True" (bool)                         -> true
     * "/Game/UI/WBP_Menu.WBP_Menu_C"        -> WBP_Menu
     * "Hello" (string)                      -> "Hello"
     * </pre>
     */
    static String formatValue(Literal literal) {
        String value = literal.getValue();
        if (value == null || literal.getKind() == Literal.LiteralKind.NULL) return "None";
        switch (literal.getKind()) {
            case BOOLEAN:
                return value.toLowerCase();
            case INT:
            case FLOAT:
            case ERROR:
                return value;
            case STRING:
                return "\"" + value + "\"";
            default:
                String asset = assetName(value);
                if (asset != null) return asset;
                return literal.getKind() == Literal.LiteralKind.OBJECT ? "\"" + value + "\"" : value;
        }
    }

    /** /Game/.../X.X_C -> X，不是蓝图类路径时返回 null */
    private static String assetName(String value) {
        if (!value.startsWith("/Game/") || !value.endsWith("_C")) return null;
        int dot = value.lastIndexOf('.');
        if (dot < 0) return null;
        String name = value.substring(dot + 1);
        return name.substring(0, name.length() - 2);
    }

    private static String shortKind(String kindTag) {
        int dot = kindTag.lastIndexOf('.');
        return dot >= 0 ? kindTag.substring(dot + 1) : kindTag;
    }
}
