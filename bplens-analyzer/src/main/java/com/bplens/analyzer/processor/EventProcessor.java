package com.bplens.analyzer.processor;

import com.bplens.analyzer.analysis.AnalysisContext;
import com.bplens.analyzer.analysis.ScopeManager;
import com.bplens.analyzer.analysis.SymbolKind;
import com.bplens.analyzer.ast.SourceLocation;
import com.bplens.analyzer.ast.expr.EventReferenceExpr;
import com.bplens.analyzer.ast.expr.Expression;
import com.bplens.analyzer.ast.expr.VariableGetExpr;
import com.bplens.analyzer.ast.stmt.EventStmt;
import com.bplens.analyzer.ast.stmt.ExecutionBlock;
import com.bplens.analyzer.graph.GraphNode;
import com.bplens.analyzer.graph.GraphPin;
import com.bplens.analyzer.graph.NodeProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 事件入口：K2Node_Event / CustomEvent / ComponentBoundEvent / FunctionEntry
 *
 * <p>事件的数据输出作为参数，在事件作用域中定义并绑定到对应引脚；事件体为第一个执行输出的后续流程。</p>
 */
public class EventProcessor implements NodeProcessor {

    static final String OUTPUT_DELEGATE = "OutputDelegate";
    private static final String RECEIVE_PREFIX = "Receive";

    @Override
    public NodeProcessingResult process(GraphNode node, AnalysisContext context) {
        String eventName = eventName(node);
        SourceLocation location = SourceLocation.of(node);
        ScopeManager scopes = context.scopes();

        List<EventStmt.Parameter> parameters = new ArrayList<EventStmt.Parameter>();
        ExecutionBlock body;
        scopes.enterScope("event:" + eventName);
        try {
            for (GraphPin pin : node.getDataOutputs()) {
                if (isDelegateOutput(pin)) continue;
                parameters.add(new EventStmt.Parameter(pin.getName(), pin.getCategory()));
                VariableGetExpr reference = new VariableGetExpr(location, pin.getName(), false);
                scopes.define(pin.getName(), pin.getCategory(), null, SymbolKind.EVENT_PARAMETER,
                        reference, node.getGuid());
                scopes.bindPin(pin.key(), reference);
            }
            body = context.walk(ProcessorSupport.thenPin(node));
        } finally {
            scopes.leaveScope();
        }
        return NodeProcessingResult.terminal(new EventStmt(location, eventName, parameters, body));
    }

    @Override
    public Expression produceExpression(GraphNode node, GraphPin outputPin, AnalysisContext context) {
        if (isDelegateOutput(outputPin)) {
            return new EventReferenceExpr(SourceLocation.of(node), eventName(node));
        }
        return new VariableGetExpr(SourceLocation.of(node), outputPin.getName(), false);
    }

    /**
     * 事件名，依次尝试：
     * EventReference（去掉 Receive 前缀）、CustomFunctionName、组件名.委托名、FunctionReference
     */
    static String eventName(GraphNode node) {
        String name = NodeProperties.memberName(node, "EventReference", null);
        if (name != null) {
            return name.startsWith(RECEIVE_PREFIX) && name.length() > RECEIVE_PREFIX.length()
                    ? name.substring(RECEIVE_PREFIX.length())
                    : name;
        }
        name = NodeProperties.string(node, "CustomFunctionName", null);
        if (name != null) return name;

        String component = NodeProperties.string(node, "ComponentPropertyName", null);
        String delegate = NodeProperties.string(node, "DelegatePropertyName", null);
        if (component != null && delegate != null) return component + "." + delegate;
        if (delegate != null) return delegate;

        return NodeProperties.memberName(node, "FunctionReference", "UnknownEvent");
    }

    private static boolean isDelegateOutput(GraphPin pin) {
        return pin.isDelegate() || OUTPUT_DELEGATE.equals(pin.getName());
    }
}
