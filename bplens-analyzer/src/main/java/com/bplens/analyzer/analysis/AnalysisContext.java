package com.bplens.analyzer.analysis;

import com.bplens.analyzer.ast.SourceLocation;
import com.bplens.analyzer.ast.expr.Expression;
import com.bplens.analyzer.ast.stmt.ExecutionBlock;
import com.bplens.analyzer.ast.stmt.Statement;
import com.bplens.analyzer.graph.Graph;
import com.bplens.analyzer.graph.GraphNode;
import com.bplens.analyzer.graph.GraphPin;
import com.bplens.analyzer.processor.ProcessorRegistry;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 单次分析的全部可变状态：作用域、已访问节点、临时变量前置声明、类型转换符号。
 *
 * <p>每次 {@link GraphAnalyzer#analyze} 创建一个新实例，分析结束即丢弃。</p>
 */
public final class AnalysisContext {
    private final Graph graph;
    private final ProcessorRegistry registry;
    private final AnalyzerConfig config;
    private final ScopeManager scopes = new ScopeManager();
    private final Map<String, Integer> pinUsage;
    private final Set<String> visitedNodes = new HashSet<String>();

    // 前置声明栈：栈顶为当前语句所在列表的前置区
    private final Deque<PreludeFrame> preludes = new ArrayDeque<PreludeFrame>();
    private final List<Statement> orphanPreludes = new ArrayList<Statement>();

    // 节点 GUID -> 其语句所在的列表
    private final Map<String, List<Statement>> executedIn = new HashMap<String, List<Statement>>();

    // 类型转换节点 GUID -> 转换结果符号
    private final Map<String, Symbol> castSymbols = new HashMap<String, Symbol>();

    private final ExpressionResolver resolver;
    private final ExecutionFlowWalker walker;

    public AnalysisContext(Graph graph, ProcessorRegistry registry, AnalyzerConfig config) {
        this.graph = graph;
        this.registry = registry;
        this.config = config;
        this.pinUsage = PinUsageCounter.count(graph);
        this.resolver = new ExpressionResolver(this);
        this.walker = new ExecutionFlowWalker(this);
    }

    public Graph getGraph() { return graph; }
    public ProcessorRegistry getRegistry() { return registry; }
    public AnalyzerConfig getConfig() { return config; }
    public ScopeManager scopes() { return scopes; }
    public ExpressionResolver getResolver() { return resolver; }
    public ExecutionFlowWalker getWalker() { return walker; }

    // ============ 已访问节点 ============

    /** 标记已访问；已访问过时返回 false */
    public boolean markVisited(GraphNode node) {
        return visitedNodes.add(node.getGuid());
    }

    public boolean isVisited(GraphNode node) {
        return visitedNodes.contains(node.getGuid());
    }

    public int visitedCount() {
        return visitedNodes.size();
    }

    public int getPinUsage(String pinKey) {
        Integer count = pinUsage.get(pinKey);
        return count != null ? count : 0;
    }

    // ============ 表达式与执行流 ============

    public Expression resolve(GraphPin pin) {
        return resolver.resolve(pin);
    }

    /** 沿执行输出引脚遍历，返回语句块 */
    public ExecutionBlock walk(GraphPin execOutput) {
        List<Statement> statements = new ArrayList<Statement>();
        walker.walk(execOutput, statements);
        SourceLocation location = execOutput != null
                ? SourceLocation.of(graph.getNode(execOutput.getOwnerGuid()))
                : SourceLocation.UNKNOWN;
        return new ExecutionBlock(location, statements);
    }

    /** 在新作用域中遍历，遍历结束后离开作用域 */
    public ExecutionBlock walkScoped(GraphPin execOutput, String owner) {
        scopes.enterScope(owner);
        try {
            return walk(execOutput);
        } finally {
            scopes.leaveScope();
        }
    }

    // ============ 前置声明 ============

    /**
     * 开始处理一条将追加到 target 的语句：压入它的前置区，记录 target 所在的作用域
     */
    public void pushPrelude(List<Statement> prelude, List<Statement> target) {
        preludes.push(new PreludeFrame(prelude, target, scopes.currentScopeId()));
    }

    public void popPrelude() {
        preludes.pop();
    }

    /**
     * 放入前置区：在层级不小于 minLevel 的前置区中，选仍能看到 dependencyScope 的最外层一个，但不越出事件体。
     * 没有语句列表时暂存，由分析器放到入口语句之前。
     *
     * @return 声明所在的前置区，暂存时为 null
     */
    public PreludeFrame emitPrelude(Statement statement, int dependencyScope, int minLevel) {
        PreludeFrame target = placementFrame(dependencyScope, minLevel);
        if (target == null) {
            orphanPreludes.add(statement);
            return null;
        }
        target.prelude.add(statement);
        return target;
    }

    private PreludeFrame placementFrame(int dependencyScope, int minLevel) {
        int minDepth = Math.max(scopes.depthOf(dependencyScope), 1);
        int level = 0;
        Iterator<PreludeFrame> frames = preludes.descendingIterator();
        while (frames.hasNext()) {
            PreludeFrame frame = frames.next();
            if (level >= minLevel && scopes.depthOf(frame.scopeId) >= minDepth) return frame;
            level++;
        }
        return preludes.peek();
    }

    /** 语句列表在前置栈中的层级（最外层为 0），不在当前遍历路径上时返回 -1 */
    public int frameLevel(List<Statement> statements) {
        if (statements == null) return -1;
        int level = 0;
        Iterator<PreludeFrame> frames = preludes.descendingIterator();
        while (frames.hasNext()) {
            if (frames.next().target == statements) return level;
            level++;
        }
        return -1;
    }

    /** 当前语句将追加到的列表 */
    public List<Statement> currentStatementList() {
        PreludeFrame frame = preludes.peek();
        return frame != null ? frame.target : null;
    }

    // ============ 非纯节点的执行位置 ============

    public void recordExecution(GraphNode node, List<Statement> statements) {
        executedIn.put(node.getGuid(), statements);
    }

    /** 节点语句所在的列表，尚未执行时返回 null */
    public List<Statement> executionList(GraphNode node) {
        return executedIn.get(node.getGuid());
    }

    /** 取出并清空暂存的前置声明 */
    public List<Statement> drainOrphanPreludes() {
        List<Statement> drained = new ArrayList<Statement>(orphanPreludes);
        orphanPreludes.clear();
        return drained;
    }

    // ============ 类型转换符号 ============

    public void declareCastSymbol(String castNodeGuid, Symbol symbol) {
        castSymbols.put(castNodeGuid, symbol);
    }

    /** 当前可见的转换结果符号，不可见时返回 null */
    public Symbol lookupCastSymbol(String castNodeGuid) {
        if (castNodeGuid == null) return null;
        Symbol symbol = castSymbols.get(castNodeGuid);
        if (symbol == null || !scopes.isActive(symbol.getScopeId())) return null;
        resolver.noteDependency(symbol.getScopeId());
        return symbol;
    }

    /** 一条语句的前置区及该语句所在的列表 */
    public static final class PreludeFrame {
        private final List<Statement> prelude;
        private final List<Statement> target;
        private final int scopeId;

        PreludeFrame(List<Statement> prelude, List<Statement> target, int scopeId) {
            this.prelude = prelude;
            this.target = target;
            this.scopeId = scopeId;
        }

        public List<Statement> getTarget() { return target; }
        public int getScopeId() { return scopeId; }
    }
}
