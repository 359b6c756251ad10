package com.bplens.analyzer.ast;

import com.bplens.analyzer.graph.GraphNode;

/**
 * 源位置信息：AST 节点来自哪个图节点
 */
public final class SourceLocation {
    private final String nodeGuid;
    private final String nodeName;

    public static final SourceLocation UNKNOWN = new SourceLocation("<unknown>", "<unknown>");

    public SourceLocation(String nodeGuid, String nodeName) {
        this.nodeGuid = nodeGuid;
        this.nodeName = nodeName;
    }

    public static SourceLocation of(GraphNode node) {
        return node != null ? new SourceLocation(node.getGuid(), node.getName()) : UNKNOWN;
    }

    public String getNodeGuid() {
        return nodeGuid;
    }

    public String getNodeName() {
        return nodeName;
    }

    @Override
    public String toString() {
        return nodeName + "@" + nodeGuid;
    }
}
