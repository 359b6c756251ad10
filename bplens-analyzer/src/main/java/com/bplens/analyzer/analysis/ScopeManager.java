package com.bplens.analyzer.analysis;

import com.bplens.analyzer.ast.AstNode;
import com.bplens.analyzer.ast.expr.Expression;

import java.util.ArrayList;
import java.util.List;

/**
 * 作用域管理器：作用域树 + 当前活动路径。
 *
 * <p>作用域按创建顺序存放在列表中，以下标作为 ID。全局作用域（ID 0）永不出栈，
 * 离开后的作用域保留在列表中但不再活动，其中的符号与引脚绑定随之不可见。</p>
 */
public final class ScopeManager {
    public static final int GLOBAL_SCOPE = 0;

    private final List<Scope> scopes = new ArrayList<Scope>();
    private final List<Integer> activePath = new ArrayList<Integer>();

    public ScopeManager() {
        scopes.add(new Scope(GLOBAL_SCOPE, Scope.NO_PARENT, "global"));
        activePath.add(GLOBAL_SCOPE);
    }

    public int enterScope(String owner) {
        int id = scopes.size();
        scopes.add(new Scope(id, currentScopeId(), owner));
        activePath.add(id);
        return id;
    }

    /** 离开当前作用域；已在全局作用域时不做任何事 */
    public void leaveScope() {
        if (activePath.size() > 1) {
            activePath.remove(activePath.size() - 1);
        }
    }

    public int currentScopeId() {
        return activePath.get(activePath.size() - 1);
    }

    public Scope currentScope() {
        return scopes.get(currentScopeId());
    }

    public Scope getScope(int scopeId) {
        return scopeId >= 0 && scopeId < scopes.size() ? scopes.get(scopeId) : null;
    }

    public Symbol define(String name, String typeName, AstNode declaration, SymbolKind kind) {
        return define(name, typeName, declaration, kind, null, null);
    }

    /** 在当前作用域定义符号，同名符号遮蔽外层 */
    public Symbol define(String name, String typeName, AstNode declaration, SymbolKind kind,
                         Expression reference, String originNodeGuid) {
        Symbol symbol = new Symbol(name, kind, typeName, declaration, reference, originNodeGuid,
                currentScopeId());
        currentScope().define(symbol);
        return symbol;
    }

    /** 由内向外查找，未定义返回 null */
    public Symbol lookup(String name) {
        if (name == null) return null;
        for (int i = activePath.size() - 1; i >= 0; i--) {
            Symbol symbol = scopes.get(activePath.get(i)).getSymbols().get(name);
            if (symbol != null) return symbol;
        }
        return null;
    }

    public void bindPin(String pinKey, Expression expression) {
        currentScope().bindPin(pinKey, expression);
    }

    public PinBinding lookupPin(String pinKey) {
        for (int i = activePath.size() - 1; i >= 0; i--) {
            Scope scope = scopes.get(activePath.get(i));
            Expression expression = scope.getPinBindings().get(pinKey);
            if (expression != null) return new PinBinding(expression, scope.getId());
        }
        return null;
    }

    public boolean isActive(int scopeId) {
        return activePath.contains(scopeId);
    }

    /** 作用域在活动路径上的深度，不活动时返回 -1 */
    public int depthOf(int scopeId) {
        return activePath.indexOf(scopeId);
    }

    public int depth() {
        return activePath.size() - 1;
    }

    /**
     * 引脚绑定查找结果
     */
    public static final class PinBinding {
        private final Expression expression;
        private final int scopeId;

        PinBinding(Expression expression, int scopeId) {
            this.expression = expression;
            this.scopeId = scopeId;
        }

        public Expression getExpression() {
            return expression;
        }

        public int getScopeId() {
            return scopeId;
        }
    }
}
