package com.bplens.analyzer.ast.expr;

import com.bplens.analyzer.ast.AstNode;
import com.bplens.analyzer.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }
}
