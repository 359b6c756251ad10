package com.bplens.analyzer.processor;

import com.bplens.analyzer.analysis.AnalysisContext;
import com.bplens.analyzer.analysis.Symbol;
import com.bplens.analyzer.ast.SourceLocation;
import com.bplens.analyzer.ast.expr.CastExpr;
import com.bplens.analyzer.ast.expr.Expression;
import com.bplens.analyzer.ast.expr.Literal;
import com.bplens.analyzer.ast.expr.PropertyAccessExpr;
import com.bplens.analyzer.ast.expr.VariableGetExpr;
import com.bplens.analyzer.ast.stmt.AssignmentStmt;
import com.bplens.analyzer.graph.GraphNode;
import com.bplens.analyzer.graph.GraphPin;
import com.bplens.analyzer.graph.NodeProperties;

/**
 * 变量赋值
 *
 * <p>把已声明的类型转换结果赋给同名变量时不产生语句：转换分支中的变量声明已经表达了这次赋值。</p>
 */
public class VariableSetProcessor implements NodeProcessor {

    @Override
    public NodeProcessingResult process(GraphNode node, AnalysisContext context) {
        SourceLocation location = SourceLocation.of(node);
        String name = NodeProperties.memberName(node, "VariableReference", "UnknownVariable");
        boolean selfContext = NodeProperties.isSelfContext(node, "VariableReference");

        GraphPin valuePin = findValuePin(node, name);
        Expression value = valuePin != null ? context.resolve(valuePin) : Literal.nullLiteral();
        if (isRedundantCastAssignment(name, value, context)) {
            return NodeProcessingResult.empty();
        }

        Expression target;
        GraphPin self = node.findInput(ProcessorSupport.SELF_PIN);
        if (self != null && self.isLinked() && !selfContext) {
            target = new PropertyAccessExpr(location, context.resolve(self), name);
        } else {
            target = new VariableGetExpr(location, name, selfContext);
        }
        return NodeProcessingResult.of(new AssignmentStmt(location, target, value));
    }

    private static GraphPin findValuePin(GraphNode node, String name) {
        GraphPin pin = node.findInput(name);
        if (pin != null) return pin;
        for (GraphPin input : node.getDataInputs()) {
            if (!ProcessorSupport.SELF_PIN.equals(input.getName())) return input;
        }
        return null;
    }

    /**
     * 把已声明的转换结果再赋给同名变量是多余的：值为该转换本身，或为同名转换结果变量的读取。
     * 赋给其它变量的转换结果照常输出。
     */
    static boolean isRedundantCastAssignment(String target, Expression value, AnalysisContext context) {
        if (value instanceof CastExpr) {
            return context.lookupCastSymbol(((CastExpr) value).getCastNodeGuid()) != null;
        }
        if (value instanceof VariableGetExpr) {
            Symbol symbol = context.lookupCastSymbol(((VariableGetExpr) value).getOriginNodeGuid());
            return symbol != null && symbol.getName().equals(target);
        }
        return false;
    }
}
