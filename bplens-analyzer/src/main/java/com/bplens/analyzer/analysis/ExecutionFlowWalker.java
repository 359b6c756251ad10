package com.bplens.analyzer.analysis;

import com.bplens.analyzer.ast.AstNode;
import com.bplens.analyzer.ast.stmt.Statement;
import com.bplens.analyzer.graph.GraphNode;
import com.bplens.analyzer.graph.GraphPin;
import com.bplens.analyzer.graph.PinLink;
import com.bplens.analyzer.processor.NodeProcessingResult;
import com.bplens.analyzer.processor.ProcessorSupport;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * 执行流遍历器：从执行输出引脚出发，沿第一条连接逐个处理节点。
 *
 * <p>每个节点在一次分析中最多处理一次；已访问的节点、缺失的节点或没有已连接的后继引脚时停止。</p>
 */
public final class ExecutionFlowWalker {
    private static final Logger LOG = Logger.getLogger(ExecutionFlowWalker.class.getName());

    private final AnalysisContext context;

    ExecutionFlowWalker(AnalysisContext context) {
        this.context = context;
    }

    /** 从执行输出引脚开始遍历，语句追加到 out */
    public void walk(GraphPin execOutput, List<Statement> out) {
        GraphPin current = execOutput;
        while (current != null && current.isLinked()) {
            PinLink link = current.getLinks().get(0);
            GraphNode node = context.getGraph().getNode(link.getNodeGuid());
            if (node == null) {
                LOG.warning("执行流指向不存在的节点: " + link);
                return;
            }
            if (!context.markVisited(node)) {
                return;
            }
            current = next(node, dispatch(node, out));
        }
    }

    /** 从节点本身开始（入口节点） */
    public void walkNode(GraphNode node, List<Statement> out) {
        if (!context.markVisited(node)) return;
        walk(next(node, dispatch(node, out)), out);
    }

    private NodeProcessingResult dispatch(GraphNode node, List<Statement> out) {
        List<Statement> prelude = new ArrayList<Statement>();
        NodeProcessingResult result;
        context.pushPrelude(prelude, out);
        try {
            result = context.getRegistry().find(node).process(node, context);
        } finally {
            context.popPrelude();
        }
        out.addAll(prelude);
        context.recordExecution(node, out);

        AstNode produced = result.getNode();
        if (produced instanceof Statement) {
            out.add((Statement) produced);
        } else if (produced != null) {
            LOG.fine("执行流上的节点只产生了表达式，忽略: " + node);
        }
        return result;
    }

    private static GraphPin next(GraphNode node, NodeProcessingResult result) {
        switch (result.getContinuation()) {
            case NONE:
                return null;
            case PIN:
                return result.getContinuationPin();
            default:
                return ProcessorSupport.thenPin(node);
        }
    }
}
