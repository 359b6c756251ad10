package com.bplens.analyzer.processor;

import com.bplens.analyzer.analysis.AnalysisContext;
import com.bplens.analyzer.graph.GraphNode;

/**
 * 重路由节点：不产生语句，执行流直接穿过（数据穿透由解析器处理）
 */
public class KnotProcessor implements NodeProcessor {

    @Override
    public NodeProcessingResult process(GraphNode node, AnalysisContext context) {
        return NodeProcessingResult.empty();
    }
}
