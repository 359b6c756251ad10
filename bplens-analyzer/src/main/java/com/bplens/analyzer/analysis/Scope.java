package com.bplens.analyzer.analysis;

import com.bplens.analyzer.ast.expr.Expression;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 作用域。由 {@link ScopeManager} 以整数 ID 统一管理，父作用域同样以 ID 引用。
 */
public final class Scope {
    public static final int NO_PARENT = -1;

    private final int id;
    private final int parentId;
    private final String owner;   // 调试用：创建者（循环、回调、事件）
    private final Map<String, Symbol> symbols = new LinkedHashMap<String, Symbol>();
    private final Map<String, Expression> pinBindings = new LinkedHashMap<String, Expression>();

    Scope(int id, int parentId, String owner) {
        this.id = id;
        this.parentId = parentId;
        this.owner = owner;
    }

    public int getId() { return id; }
    public int getParentId() { return parentId; }
    public String getOwner() { return owner; }
    public Map<String, Symbol> getSymbols() { return symbols; }
    public Map<String, Expression> getPinBindings() { return pinBindings; }

    public boolean isGlobal() {
        return parentId == NO_PARENT;
    }

    void define(Symbol symbol) {
        symbols.put(symbol.getName(), symbol);
    }

    void bindPin(String pinKey, Expression expression) {
        pinBindings.put(pinKey, expression);
    }

    @Override
    public String toString() {
        return "Scope#" + id + "(" + owner + ")";
    }
}
