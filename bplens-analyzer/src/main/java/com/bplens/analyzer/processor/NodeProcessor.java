package com.bplens.analyzer.processor;

import com.bplens.analyzer.analysis.AnalysisContext;
import com.bplens.analyzer.ast.expr.Expression;
import com.bplens.analyzer.graph.GraphNode;
import com.bplens.analyzer.graph.GraphPin;

/**
 * 节点处理器：把一个图节点翻译为 AST 节点
 */
public interface NodeProcessor {

    /**
     * 执行流到达节点时调用。返回的结果携带 AST 节点与后继执行引脚。
     */
    NodeProcessingResult process(GraphNode node, AnalysisContext context);

    /**
     * 节点作为数据来源时调用，返回指定输出引脚的表达式；返回 null 表示交由解析器的默认规则处理。
     */
    default Expression produceExpression(GraphNode node, GraphPin outputPin, AnalysisContext context) {
        return null;
    }
}
