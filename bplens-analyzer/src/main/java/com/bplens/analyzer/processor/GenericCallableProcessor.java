package com.bplens.analyzer.processor;

import com.bplens.analyzer.analysis.AnalysisContext;
import com.bplens.analyzer.ast.SourceLocation;
import com.bplens.analyzer.ast.stmt.FunctionCallStmt;
import com.bplens.analyzer.graph.GraphNode;

/**
 * 未注册但同时带执行引脚与数据引脚的节点，按普通函数调用处理
 */
public class GenericCallableProcessor implements NodeProcessor {

    @Override
    public NodeProcessingResult process(GraphNode node, AnalysisContext context) {
        return NodeProcessingResult.of(
                new FunctionCallStmt(SourceLocation.of(node), ProcessorSupport.genericCall(node, context)));
    }
}
