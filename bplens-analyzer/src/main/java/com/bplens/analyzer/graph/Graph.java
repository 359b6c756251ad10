package com.bplens.analyzer.graph;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 蓝图图：以 GUID 为键的节点集合 + 入口节点列表。
 *
 * <p>节点之间的所有引用都是 GUID / 引脚 ID 查找，不持有对象指针。</p>
 */
public final class Graph {
    private final String name;
    private final Map<String, GraphNode> nodes;
    private final List<GraphNode> entryNodes;

    Graph(String name, Map<String, GraphNode> nodes, List<GraphNode> entryNodes) {
        this.name = name;
        this.nodes = Collections.unmodifiableMap(nodes);
        this.entryNodes = Collections.unmodifiableList(entryNodes);
    }

    public String getName() { return name; }
    public List<GraphNode> getEntryNodes() { return entryNodes; }

    public Collection<GraphNode> getNodes() {
        return nodes.values();
    }

    public GraphNode getNode(String guid) {
        return guid != null ? nodes.get(guid) : null;
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /** 解析连接目标引脚；节点或引脚不存在时返回 null */
    public GraphPin resolvePin(PinLink link) {
        GraphNode node = getNode(link.getNodeGuid());
        return node != null ? node.findPinById(link.getPinId()) : null;
    }
}
