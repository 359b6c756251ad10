package com.bplens.analyzer.processor;

import com.bplens.analyzer.analysis.AnalysisContext;
import com.bplens.analyzer.analysis.ScopeManager;
import com.bplens.analyzer.analysis.SymbolKind;
import com.bplens.analyzer.ast.SourceLocation;
import com.bplens.analyzer.ast.expr.Expression;
import com.bplens.analyzer.ast.expr.Literal;
import com.bplens.analyzer.ast.expr.LoopVariableExpr;
import com.bplens.analyzer.ast.stmt.ExecutionBlock;
import com.bplens.analyzer.ast.stmt.LoopStmt;
import com.bplens.analyzer.ast.stmt.VariableDecl;
import com.bplens.analyzer.graph.GraphNode;
import com.bplens.analyzer.graph.GraphPin;

/**
 * ForEach 宏（ForEachLoop / ForEachLoopWithBreak / ReverseForEachLoop）
 *
 * <p>循环体在独立作用域中遍历，宏的 Array Element / Array Index 输出绑定为循环变量；
 * 离开循环后这些绑定不可见。后继为 Completed 引脚。</p>
 */
public class ForEachProcessor implements NodeProcessor {

    static final String ELEMENT = "ArrayElement";
    static final String INDEX = "ArrayIndex";

    @Override
    public NodeProcessingResult process(GraphNode node, AnalysisContext context) {
        SourceLocation location = SourceLocation.of(node);
        Expression array = ProcessorSupport.resolveInput(node, "Array", context,
                new Literal(location, "[]", Literal.LiteralKind.UNKNOWN));

        GraphPin elementPin = node.findOutput("Array Element");
        GraphPin indexPin = node.findOutput("Array Index");
        String elementType = elementPin != null ? elementPin.getCategory() : "auto";
        VariableDecl item = VariableDecl.loopVariable(location, ELEMENT, elementType);
        VariableDecl index = VariableDecl.loopVariable(location, INDEX, "int");
        LoopVariableExpr elementRef = new LoopVariableExpr(location, ELEMENT, false, node.getGuid());
        LoopVariableExpr indexRef = new LoopVariableExpr(location, INDEX, true, node.getGuid());

        ScopeManager scopes = context.scopes();
        ExecutionBlock body;
        scopes.enterScope("foreach:" + node.getName());
        try {
            scopes.define(ELEMENT, elementType, item, SymbolKind.LOOP_VARIABLE, elementRef, node.getGuid());
            scopes.define(INDEX, "int", index, SymbolKind.LOOP_VARIABLE, indexRef, node.getGuid());
            if (elementPin != null) scopes.bindPin(elementPin.key(), elementRef);
            if (indexPin != null) scopes.bindPin(indexPin.key(), indexRef);

            GraphPin loopBody = ProcessorSupport.findExecOutput(node, "LoopBody");
            body = loopBody != null ? context.walk(loopBody) : ExecutionBlock.empty();
        } finally {
            scopes.leaveScope();
        }

        return NodeProcessingResult.withContinuation(LoopStmt.forEach(location, array, item, index, body),
                ProcessorSupport.findExecOutput(node, "Completed"));
    }
}
