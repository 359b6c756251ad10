package com.bplens.analyzer.analysis;

import com.bplens.analyzer.ast.SourceLocation;
import com.bplens.analyzer.ast.stmt.ExecutionBlock;
import com.bplens.analyzer.ast.stmt.Statement;
import com.bplens.analyzer.graph.Graph;
import com.bplens.analyzer.graph.GraphNode;
import com.bplens.analyzer.processor.ProcessorRegistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * 图分析器：蓝图图 -> 语句列表
 *
 * <p>第一遍统计数据输出的消费次数，第二遍从每个入口节点沿执行流构建 AST。
 * 分析器本身无状态，可重复使用；每次分析使用独立的 {@link AnalysisContext}。</p>
 */
public final class GraphAnalyzer {
    private static final Logger LOG = Logger.getLogger(GraphAnalyzer.class.getName());

    private final ProcessorRegistry registry;
    private final AnalyzerConfig config;

    public GraphAnalyzer() {
        this(ProcessorRegistry.createDefault(), AnalyzerConfig.defaultConfig());
    }

    public GraphAnalyzer(ProcessorRegistry registry, AnalyzerConfig config) {
        this.registry = registry;
        this.config = config != null ? config : AnalyzerConfig.defaultConfig();
    }

    public ProcessorRegistry getRegistry() {
        return registry;
    }

    public AnalyzerConfig getConfig() {
        return config;
    }

    public List<Statement> analyze(Graph graph) {
        if (graph == null || graph.getEntryNodes().isEmpty()) {
            LOG.info("no input: 图为空或没有入口节点");
            return Collections.emptyList();
        }

        AnalysisContext context = new AnalysisContext(graph, registry, config);
        List<Statement> result = new ArrayList<Statement>();
        for (GraphNode entry : graph.getEntryNodes()) {
            if (context.isVisited(entry)) continue;

            List<Statement> statements = new ArrayList<Statement>();
            context.getWalker().walkNode(entry, statements);
            result.addAll(context.drainOrphanPreludes());
            if (statements.size() == 1) {
                result.add(statements.get(0));
            } else if (!statements.isEmpty()) {
                result.add(new ExecutionBlock(SourceLocation.of(entry), statements));
            }
        }

        LOG.fine(String.format("分析 %s: %d 个入口，访问 %d/%d 个节点，生成 %d 条语句",
                graph.getName(), graph.getEntryNodes().size(), context.visitedCount(),
                graph.size(), result.size()));
        return result;
    }
}
