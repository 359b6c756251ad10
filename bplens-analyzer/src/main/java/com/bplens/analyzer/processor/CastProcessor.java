package com.bplens.analyzer.processor;

import com.bplens.analyzer.analysis.AnalysisContext;
import com.bplens.analyzer.analysis.ScopeManager;
import com.bplens.analyzer.analysis.Symbol;
import com.bplens.analyzer.analysis.SymbolKind;
import com.bplens.analyzer.ast.SourceLocation;
import com.bplens.analyzer.ast.expr.CastExpr;
import com.bplens.analyzer.ast.expr.Expression;
import com.bplens.analyzer.ast.expr.VariableGetExpr;
import com.bplens.analyzer.ast.stmt.BranchStmt;
import com.bplens.analyzer.ast.stmt.ExecutionBlock;
import com.bplens.analyzer.ast.stmt.Statement;
import com.bplens.analyzer.ast.stmt.VariableDecl;
import com.bplens.analyzer.graph.GraphNode;
import com.bplens.analyzer.graph.GraphPin;
import com.bplens.analyzer.graph.NodeProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 动态类型转换 K2Node_DynamicCast
 *
 * <p>生成 if (cast(obj as T)) { As T = cast(...); ...then } else { ...CastFailed }。
 * 转换结果只在成功分支的作用域中定义为符号，分支内对 "As T" 输出的引用解析为该变量；
 * 失败分支和分支之后得到转换表达式本身。</p>
 */
public class CastProcessor implements NodeProcessor {

    static final String UNKNOWN_TYPE = "UnknownType";

    @Override
    public NodeProcessingResult process(GraphNode node, AnalysisContext context) {
        SourceLocation location = SourceLocation.of(node);
        String targetType = targetType(node);
        CastExpr cast = new CastExpr(location, ProcessorSupport.resolveInputOrNull(node, "Object", context),
                targetType, node.getGuid());

        GraphPin asPin = findAsPin(node);
        String variableName = asPin != null ? asPin.getName() : "As " + targetType;
        VariableDecl declaration = new VariableDecl(location, variableName, targetType, cast);
        VariableGetExpr reference = new VariableGetExpr(location, variableName, false, node.getGuid());

        List<Statement> success = new ArrayList<Statement>();
        success.add(declaration);
        ScopeManager scopes = context.scopes();
        scopes.enterScope("cast:then");
        try {
            Symbol symbol = scopes.define(variableName, targetType, declaration,
                    SymbolKind.CAST_RESULT, reference, node.getGuid());
            context.declareCastSymbol(node.getGuid(), symbol);
            success.addAll(context.walk(ProcessorSupport.findExecOutput(node, "then")).getStatements());
        } finally {
            scopes.leaveScope();
        }
        ExecutionBlock failure = BranchProcessor.walkArm(ProcessorSupport.findExecOutput(node, "CastFailed"),
                "cast:failed", context);

        return NodeProcessingResult.terminal(
                new BranchStmt(location, cast, new ExecutionBlock(location, success), failure));
    }

    @Override
    public Expression produceExpression(GraphNode node, GraphPin outputPin, AnalysisContext context) {
        Symbol symbol = context.lookupCastSymbol(node.getGuid());
        if (symbol != null && outputPin != null && outputPin.getName().startsWith("As ")) {
            return symbol.getReference();
        }
        return new CastExpr(SourceLocation.of(node), ProcessorSupport.resolveInputOrNull(node, "Object", context),
                targetType(node), node.getGuid());
    }

    /**
     * 目标类型名
     * <pre>"/Script/CoreUObject.Class'/Game/BP/BP_Player.BP_Player_C'" -> "BP_Player"</pre>
     */
    static String targetType(GraphNode node) {
        String name = NodeProperties.parseObjectPath(node.getProperty("TargetType"));
        if (name == null) return UNKNOWN_TYPE;
        return name.endsWith("_C") ? name.substring(0, name.length() - 2) : name;
    }

    private static GraphPin findAsPin(GraphNode node) {
        for (GraphPin pin : node.getDataOutputs()) {
            if (pin.getName().startsWith("As ")) return pin;
        }
        return null;
    }
}
