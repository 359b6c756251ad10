package com.bplens.analyzer.ast.stmt;

import com.bplens.analyzer.ast.AstVisitor;
import com.bplens.analyzer.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 无法识别的节点：保留原始类型名、部分属性与引脚摘要
 */
public class FallbackStmt extends Statement {
    private final String kindName;
    private final String nodeName;
    private final Map<String, String> properties;
    private final List<String> pinSummary;

    public FallbackStmt(SourceLocation location, String kindName, String nodeName,
                        Map<String, String> properties, List<String> pinSummary) {
        super(location);
        this.kindName = kindName;
        this.nodeName = nodeName;
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<String, String>(properties));
        this.pinSummary = Collections.unmodifiableList(new ArrayList<String>(pinSummary));
    }

    public String getKindName() {
        return kindName;
    }

    public String getNodeName() {
        return nodeName;
    }

    public Map<String, String> getProperties() {
        return properties;
    }

    public List<String> getPinSummary() {
        return pinSummary;
    }

    @Override
    public <R, C> R accept(AstVisitor<R, C> visitor, C context) {
        return visitor.visitFallbackStmt(this, context);
    }
}
