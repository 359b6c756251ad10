package com.bplens.analyzer.processor;

import com.bplens.analyzer.analysis.AnalysisContext;
import com.bplens.analyzer.analysis.ScopeManager;
import com.bplens.analyzer.analysis.SymbolKind;
import com.bplens.analyzer.ast.SourceLocation;
import com.bplens.analyzer.ast.expr.FunctionCallExpr;
import com.bplens.analyzer.ast.expr.VariableGetExpr;
import com.bplens.analyzer.ast.stmt.ExecutionBlock;
import com.bplens.analyzer.ast.stmt.LatentActionStmt;
import com.bplens.analyzer.ast.stmt.VariableDecl;
import com.bplens.analyzer.graph.GraphNode;
import com.bplens.analyzer.graph.GraphPin;
import com.bplens.analyzer.graph.NodeProperties;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 异步 / 延迟动作：LatentAbilityCall / AsyncAction / BaseAsyncTask
 *
 * <p>除 then 外的每个执行输出是一个回调，各自在新作用域中声明负载参数并遍历后续流程。
 * 负载归属按名称推断：输出名包含回调名（去掉 On 前缀）的归该回调，
 * 都不匹配时取未被其它回调认领的全部输出。</p>
 */
public class LatentActionProcessor implements NodeProcessor {

    @Override
    public NodeProcessingResult process(GraphNode node, AnalysisContext context) {
        SourceLocation location = SourceLocation.of(node);
        FunctionCallExpr call = new FunctionCallExpr(location, null, actionName(node),
                ProcessorSupport.arguments(node, context, "OwningAbility"));

        List<GraphPin> callbackPins = new ArrayList<GraphPin>();
        for (GraphPin pin : node.getExecOutputs()) {
            if (!ProcessorSupport.THEN_PIN.equalsIgnoreCase(pin.getName())) callbackPins.add(pin);
        }
        List<GraphPin> payloads = new ArrayList<GraphPin>();
        for (GraphPin pin : node.getDataOutputs()) {
            if (!pin.isDelegate()) payloads.add(pin);
        }

        ScopeManager scopes = context.scopes();
        List<LatentActionStmt.CallbackBlock> callbacks = new ArrayList<LatentActionStmt.CallbackBlock>();
        for (GraphPin callbackPin : callbackPins) {
            List<VariableDecl> parameters = new ArrayList<VariableDecl>();
            ExecutionBlock body;
            scopes.enterScope("callback:" + callbackPin.getName());
            try {
                for (GraphPin payload : payloadFor(callbackPin, callbackPins, payloads)) {
                    parameters.add(VariableDecl.callbackParameter(location, payload.getName(), payload.getCategory()));
                    VariableGetExpr reference = new VariableGetExpr(location, payload.getName(), false);
                    scopes.define(payload.getName(), payload.getCategory(), null, SymbolKind.CALLBACK_PARAMETER,
                            reference, node.getGuid());
                    scopes.bindPin(payload.key(), reference);
                }
                body = context.walk(callbackPin);
            } finally {
                scopes.leaveScope();
            }
            callbacks.add(new LatentActionStmt.CallbackBlock(callbackPin.getName(), parameters, body));
        }

        LatentActionStmt statement = new LatentActionStmt(location, call, callbacks);
        GraphPin then = ProcessorSupport.findExecOutput(node, ProcessorSupport.THEN_PIN);
        return then != null
                ? NodeProcessingResult.withContinuation(statement, then)
                : NodeProcessingResult.terminal(statement);
    }

    static String actionName(GraphNode node) {
        String name = NodeProperties.string(node, "ProxyFactoryFunctionName", null);
        if (name != null) return name;
        return ProcessorSupport.functionName(node, "UnknownAction");
    }

    static List<GraphPin> payloadFor(GraphPin callback, List<GraphPin> callbacks, List<GraphPin> payloads) {
        List<GraphPin> matched = matching(callback, payloads);
        if (!matched.isEmpty()) return matched;

        Set<GraphPin> claimed = new HashSet<GraphPin>();
        for (GraphPin other : callbacks) {
            if (other != callback) claimed.addAll(matching(other, payloads));
        }
        List<GraphPin> rest = new ArrayList<GraphPin>();
        for (GraphPin payload : payloads) {
            if (!claimed.contains(payload)) rest.add(payload);
        }
        return rest;
    }

    private static List<GraphPin> matching(GraphPin callback, List<GraphPin> payloads) {
        String stem = stem(callback.getName()).toLowerCase();
        List<GraphPin> result = new ArrayList<GraphPin>();
        if (stem.isEmpty()) return result;
        for (GraphPin payload : payloads) {
            if (payload.getName().toLowerCase().contains(stem)) result.add(payload);
        }
        return result;
    }

    /** OnSuccess -> Success */
    static String stem(String callbackName) {
        return callbackName.startsWith("On") && callbackName.length() > 2
                ? callbackName.substring(2)
                : callbackName;
    }
}
