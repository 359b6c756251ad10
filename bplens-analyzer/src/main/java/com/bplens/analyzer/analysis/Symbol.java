package com.bplens.analyzer.analysis;

import com.bplens.analyzer.ast.AstNode;
import com.bplens.analyzer.ast.expr.Expression;

/**
 * 作用域中的符号
 */
public final class Symbol {
    private final String name;
    private final SymbolKind kind;
    private final String typeName;
    private final AstNode declaration;    // 可选：声明的 AST 节点
    private final Expression reference;   // 引用此符号时使用的表达式
    private final String originNodeGuid;  // 产生此符号的图节点
    private final int scopeId;

    public Symbol(String name, SymbolKind kind, String typeName, AstNode declaration,
                  Expression reference, String originNodeGuid, int scopeId) {
        this.name = name;
        this.kind = kind;
        this.typeName = typeName;
        this.declaration = declaration;
        this.reference = reference;
        this.originNodeGuid = originNodeGuid;
        this.scopeId = scopeId;
    }

    public String getName() { return name; }
    public SymbolKind getKind() { return kind; }
    public String getTypeName() { return typeName; }
    public AstNode getDeclaration() { return declaration; }
    public Expression getReference() { return reference; }
    public String getOriginNodeGuid() { return originNodeGuid; }
    public int getScopeId() { return scopeId; }

    public boolean isLoopVariable() {
        return kind == SymbolKind.LOOP_VARIABLE;
    }

    public boolean isCallbackParameter() {
        return kind == SymbolKind.CALLBACK_PARAMETER;
    }

    @Override
    public String toString() {
        return name + ":" + kind + "@" + scopeId;
    }
}
