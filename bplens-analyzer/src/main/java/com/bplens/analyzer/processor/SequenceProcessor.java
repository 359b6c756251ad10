package com.bplens.analyzer.processor;

import com.bplens.analyzer.analysis.AnalysisContext;
import com.bplens.analyzer.ast.SourceLocation;
import com.bplens.analyzer.ast.stmt.ExecutionBlock;
import com.bplens.analyzer.ast.stmt.Statement;
import com.bplens.analyzer.graph.GraphNode;
import com.bplens.analyzer.graph.GraphPin;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * 执行序列：依次展开 then_0, then_1, ... 的执行流
 */
public class SequenceProcessor implements NodeProcessor {

    @Override
    public NodeProcessingResult process(GraphNode node, AnalysisContext context) {
        List<GraphPin> outputs = new ArrayList<GraphPin>(node.getExecOutputs());
        Collections.sort(outputs, new Comparator<GraphPin>() {
            @Override
            public int compare(GraphPin a, GraphPin b) {
                return Integer.compare(order(a.getName()), order(b.getName()));
            }
        });

        List<Statement> statements = new ArrayList<Statement>();
        for (GraphPin pin : outputs) {
            statements.addAll(context.walk(pin).getStatements());
        }
        return NodeProcessingResult.terminal(new ExecutionBlock(SourceLocation.of(node), statements));
    }

    /** then_N 的序号，其它名称排在最后（稳定排序保留原顺序） */
    static int order(String pinName) {
        int underscore = pinName.lastIndexOf('_');
        if (underscore < 0) return Integer.MAX_VALUE;
        try {
            return Integer.parseInt(pinName.substring(underscore + 1));
        } catch (NumberFormatException e) {
            return Integer.MAX_VALUE;
        }
    }
}
