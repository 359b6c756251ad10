package com.bplens.analyzer.ast.stmt;

import com.bplens.analyzer.ast.AstNode;
import com.bplens.analyzer.ast.SourceLocation;

/**
 * 语句基类
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }
}
