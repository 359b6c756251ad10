package com.bplens.analyzer.analysis;

import com.bplens.analyzer.ast.SourceLocation;
import com.bplens.analyzer.ast.expr.EventReferenceExpr;
import com.bplens.analyzer.ast.expr.Expression;
import com.bplens.analyzer.ast.expr.Literal;
import com.bplens.analyzer.ast.expr.LoopVariableExpr;
import com.bplens.analyzer.ast.expr.TempVariableRef;
import com.bplens.analyzer.ast.expr.VariableGetExpr;
import com.bplens.analyzer.ast.stmt.Statement;
import com.bplens.analyzer.ast.stmt.TempVariableDecl;
import com.bplens.analyzer.graph.GraphNode;
import com.bplens.analyzer.graph.GraphPin;
import com.bplens.analyzer.graph.NodeKind;
import com.bplens.analyzer.graph.NodeProperties;
import com.bplens.analyzer.graph.PinLink;
import com.bplens.analyzer.processor.NodeProcessor;
import com.bplens.analyzer.processor.ProcessorSupport;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 数据表达式解析器：把数据输入引脚沿连接上溯，构建表达式树。
 *
 * <p>解析顺序：</p>
 * <ol>
 *   <li>未连接：可见的循环变量 / 回调参数符号，否则为引脚默认值字面量</li>
 *   <li>上游节点或引脚不存在：错误字面量</li>
 *   <li>活动作用域中的引脚绑定</li>
 *   <li>缓存（仅当缓存依赖的作用域仍然活动）</li>
 *   <li>当前解析路径上再次出现：循环引用错误字面量</li>
 *   <li>按产生者节点类型构建；被多次消费的非平凡结果提取为临时变量</li>
 * </ol>
 *
 * <p>临时变量声明放在仍能看到其依赖的最外层语句列表中，因此分处不同分支的使用者共享同一声明。
 * 依赖非纯节点输出的值不早于该节点所在的语句；依赖循环变量等局部符号的值在离开该作用域后重新提取。</p>
 */
public final class ExpressionResolver {
    private static final Logger LOG = Logger.getLogger(ExpressionResolver.class.getName());

    private final AnalysisContext context;
    private final Map<String, MemoEntry> memo = new HashMap<String, MemoEntry>();
    private final Set<String> activePins = new HashSet<String>();
    private final Set<String> tempNames = new HashSet<String>();

    // 每层解析记录其依赖，结束时写入缓存并传给外层
    private final Deque<Dependency> dependencyFrames = new ArrayDeque<Dependency>();

    ExpressionResolver(AnalysisContext context) {
        this.context = context;
    }

    public Expression resolve(GraphPin pin) {
        if (pin == null) return Literal.nullLiteral();
        if (!pin.isLinked()) return resolveUnlinked(pin);
        return resolveLink(pin.getLinks().get(0));
    }

    private Expression resolveUnlinked(GraphPin pin) {
        Symbol symbol = context.scopes().lookup(pin.getName());
        if (symbol != null && symbol.getReference() != null
                && (symbol.isLoopVariable() || symbol.isCallbackParameter())) {
            noteDependency(symbol.getScopeId());
            return symbol.getReference();
        }
        return Literal.fromPin(pin);
    }

    private Expression resolveLink(PinLink link) {
        ScopeManager scopes = context.scopes();
        String key = link.key();

        GraphNode producer = context.getGraph().getNode(link.getNodeGuid());
        if (producer == null) {
            LOG.warning("悬空引用，节点不存在: " + key);
            return Literal.error(Literal.NODE_NOT_FOUND, SourceLocation.UNKNOWN);
        }
        GraphPin output = producer.findPinById(link.getPinId());
        if (output == null) {
            LOG.warning("悬空引用，引脚不存在: " + key);
            return Literal.error(Literal.PIN_NOT_FOUND, SourceLocation.of(producer));
        }

        ScopeManager.PinBinding binding = scopes.lookupPin(key);
        if (binding != null) {
            noteDependency(binding.getScopeId());
            return binding.getExpression();
        }

        MemoEntry cached = memo.get(key);
        if (cached != null && scopes.isActive(cached.scopeId)
                && (cached.anchor == null || context.frameLevel(cached.anchor) >= 0)) {
            noteDependency(cached.scopeId);
            noteAnchor(cached.anchor);
            return cached.expression;
        }

        if (!activePins.add(key)) {
            LOG.warning("循环引用: " + key);
            return Literal.error(Literal.CIRCULAR_REFERENCE, SourceLocation.of(producer));
        }

        dependencyFrames.push(new Dependency());
        Expression result;
        Dependency dependency;
        try {
            result = resolveOutput(producer, output);
            if (shouldExtract(key, result)) {
                result = extractTemp(producer, output, result);
            }
        } finally {
            activePins.remove(key);
            dependency = dependencyFrames.pop();
        }

        memo.put(key, new MemoEntry(result, dependency.scopeId, dependency.anchor));
        noteDependency(dependency.scopeId);
        noteAnchor(dependency.anchor);
        return result;
    }

    /**
     * 按产生者节点类型构建输出引脚的表达式
     */
    private Expression resolveOutput(GraphNode producer, GraphPin output) {
        SourceLocation location = SourceLocation.of(producer);
        if (producer.hasExecPins() && !producer.getKind().isEvent()) {
            // 非纯节点的输出在其执行之后才有值
            noteAnchor(context.executionList(producer));
        }
        switch (producer.getKind()) {
            case KNOT:
                for (GraphPin pin : producer.getPins()) {
                    if (pin.isInput()) return resolve(pin);
                }
                return Literal.nullLiteral();
            case VARIABLE_SET:
                return new VariableGetExpr(location,
                        NodeProperties.memberName(producer, "VariableReference", "UnknownVariable"),
                        NodeProperties.isSelfContext(producer, "VariableReference"));
            default:
                break;
        }

        NodeProcessor processor = context.getRegistry().find(producer);
        Expression expression = processor.produceExpression(producer, output, context);
        if (expression != null) return expression;

        if (producer.hasExecPins()) {
            // 非纯节点的输出只能按名称引用
            return new VariableGetExpr(location, output.getName(), false);
        }
        return ProcessorSupport.genericCall(producer, context);
    }

    private boolean shouldExtract(String key, Expression value) {
        return context.getConfig().isCseEnabled()
                && context.getPinUsage(key) > 1
                && !isTrivial(value);
    }

    /** 变量、字面量、事件引用、循环变量、临时变量引用无需提取 */
    static boolean isTrivial(Expression value) {
        return value instanceof VariableGetExpr
                || value instanceof Literal
                || value instanceof EventReferenceExpr
                || value instanceof LoopVariableExpr
                || value instanceof TempVariableRef;
    }

    private Expression extractTemp(GraphNode producer, GraphPin output, Expression value) {
        String name = allocateTempName(tempBaseName(producer));
        SourceLocation location = SourceLocation.of(producer);
        Dependency dependency = dependencyFrames.peek();
        AnalysisContext.PreludeFrame frame = context.emitPrelude(
                new TempVariableDecl(location, name, output.getCategory(), value),
                dependency.scopeId, context.frameLevel(dependency.anchor));
        if (frame != null) {
            noteDependency(frame.getScopeId());
            noteAnchor(frame.getTarget());
        } else {
            noteDependency(context.scopes().currentScopeId());
        }
        LOG.fine("提取临时变量 " + name + " <- " + producer);
        return new TempVariableRef(location, name);
    }

    /**
     * 临时变量基础名
     * <pre>
     * CallFunction(K2_GetActorLocation) -> temp_getactorlocation
     * K2Node_MathExpression            -> temp_mathexpression
     * </pre>
     */
    String tempBaseName(GraphNode producer) {
        String prefix = context.getConfig().getTempVariablePrefix();
        if (producer.getKind().isFunctionCall()) {
            String function = ProcessorSupport.functionName(producer, null);
            if (function != null) {
                return prefix + function.replace("BP_", "").replace("K2_", "").toLowerCase();
            }
        }
        return prefix + producer.getShortKind().toLowerCase().replace("k2node_", "");
    }

    private String allocateTempName(String base) {
        String name = base;
        int counter = 1;
        while (tempNames.contains(name)) {
            name = base + "_" + counter++;
        }
        tempNames.add(name);
        return name;
    }

    /** 记录当前解析依赖了某作用域中的绑定或符号 */
    void noteDependency(int scopeId) {
        Dependency frame = dependencyFrames.peek();
        if (frame == null) return;
        ScopeManager scopes = context.scopes();
        if (scopes.depthOf(scopeId) > scopes.depthOf(frame.scopeId)) {
            frame.scopeId = scopeId;
        }
    }

    /**
     * 记录当前解析只能出现在某语句列表之中（该列表中已有的语句之后）。
     * 列表已不在遍历路径上时退化为当前语句所在的列表。
     */
    private void noteAnchor(List<Statement> list) {
        Dependency frame = dependencyFrames.peek();
        if (frame == null) return;
        if (list == null || context.frameLevel(list) < 0) {
            list = context.currentStatementList();
            if (list == null) return;
        }
        if (context.frameLevel(list) > context.frameLevel(frame.anchor)) {
            frame.anchor = list;
        }
    }

    private static final class Dependency {
        int scopeId = ScopeManager.GLOBAL_SCOPE;
        List<Statement> anchor;
    }

    private static final class MemoEntry {
        final Expression expression;
        final int scopeId;
        final List<Statement> anchor;

        MemoEntry(Expression expression, int scopeId, List<Statement> anchor) {
            this.expression = expression;
            this.scopeId = scopeId;
            this.anchor = anchor;
        }
    }
}
