package com.bplens.analyzer.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 图构建器：收集节点与引脚描述，解析连接引用，生成不可变的 {@link Graph}。
 *
 * <p>连接引用支持三种写法：节点 GUID + 引脚 ID、节点名 + 引脚 ID、仅引脚 ID。
 * 构建时连接会双向补全，指向不存在节点的连接保留原样（分析阶段报告为悬空引用）。</p>
 */
public final class GraphBuilder {
    private static final Logger LOG = Logger.getLogger(GraphBuilder.class.getName());

    private final String graphName;
    private final List<NodeSpec> nodeSpecs = new ArrayList<NodeSpec>();
    private int tempGuidCounter = 0;

    public GraphBuilder(String graphName) {
        this.graphName = graphName != null ? graphName : "EventGraph";
    }

    public NodeSpec node(String guid, String name, String kindTag) {
        NodeSpec spec = new NodeSpec(guid, name, kindTag);
        nodeSpecs.add(spec);
        return spec;
    }

    /** 按 GUID 连接两个引脚（方向任意，构建时双向补全） */
    public GraphBuilder link(String fromGuid, String fromPinId, String toGuid, String toPinId) {
        NodeSpec from = findSpec(fromGuid);
        if (from == null) {
            throw new IllegalArgumentException("未知节点: " + fromGuid);
        }
        PinSpec pin = from.findPinSpec(fromPinId);
        if (pin == null) {
            throw new IllegalArgumentException("未知引脚: " + fromGuid + ":" + fromPinId);
        }
        pin.linkTo(toGuid, toPinId);
        return this;
    }

    public int nodeCount() {
        return nodeSpecs.size();
    }

    public Graph build() {
        // 1. 补全缺失的 GUID，建立索引
        Map<String, NodeSpec> byGuid = new LinkedHashMap<String, NodeSpec>();
        Map<String, NodeSpec> byName = new LinkedHashMap<String, NodeSpec>();
        Map<String, NodeSpec> byPinId = new LinkedHashMap<String, NodeSpec>();
        for (NodeSpec spec : nodeSpecs) {
            if (spec.guid == null || spec.guid.isEmpty()) {
                spec.guid = String.format("TEMP-%08x", ++tempGuidCounter);
            }
            byGuid.put(spec.guid, spec);
            if (spec.name != null) byName.put(spec.name, spec);
            for (PinSpec pin : spec.pins) {
                byPinId.put(pin.id, spec);
            }
        }

        // 2. 解析连接引用
        Map<String, Set<PinLink>> linksByPin = new LinkedHashMap<String, Set<PinLink>>();
        for (NodeSpec spec : nodeSpecs) {
            for (PinSpec pin : spec.pins) {
                Set<PinLink> resolved = linkSet(linksByPin, GraphPin.key(spec.guid, pin.id));
                for (RawLink raw : pin.rawLinks) {
                    PinLink link = resolveLink(raw, byGuid, byName, byPinId);
                    if (link != null) resolved.add(link);
                }
            }
        }

        // 3. 双向补全
        for (NodeSpec spec : nodeSpecs) {
            for (PinSpec pin : spec.pins) {
                PinLink self = new PinLink(spec.guid, pin.id);
                for (PinLink target : new ArrayList<PinLink>(linksByPin.get(self.key()))) {
                    NodeSpec targetSpec = byGuid.get(target.getNodeGuid());
                    if (targetSpec != null && targetSpec.findPinSpec(target.getPinId()) != null) {
                        linkSet(linksByPin, target.key()).add(self);
                    }
                }
            }
        }

        // 4. 生成不可变节点
        Map<String, GraphNode> nodes = new LinkedHashMap<String, GraphNode>();
        for (NodeSpec spec : nodeSpecs) {
            List<GraphPin> pins = new ArrayList<GraphPin>();
            for (PinSpec pin : spec.pins) {
                List<PinLink> links = new ArrayList<PinLink>(linksByPin.get(GraphPin.key(spec.guid, pin.id)));
                pins.add(new GraphPin(spec.guid, pin.id, pin.name, pin.direction, pin.category,
                        pin.defaultValue, links));
            }
            nodes.put(spec.guid, new GraphNode(spec.guid, spec.name, spec.kindTag, spec.properties, pins));
        }

        return new Graph(graphName, nodes, findEntryNodes(nodes.values()));
    }

    private static Set<PinLink> linkSet(Map<String, Set<PinLink>> linksByPin, String key) {
        Set<PinLink> set = linksByPin.get(key);
        if (set == null) {
            set = new LinkedHashSet<PinLink>();
            linksByPin.put(key, set);
        }
        return set;
    }

    private PinLink resolveLink(RawLink raw, Map<String, NodeSpec> byGuid,
                                Map<String, NodeSpec> byName, Map<String, NodeSpec> byPinId) {
        if (raw.nodeGuid != null) {
            return new PinLink(raw.nodeGuid, raw.pinId);
        }
        if (raw.nodeName != null) {
            NodeSpec target = byName.get(raw.nodeName);
            if (target != null) return new PinLink(target.guid, raw.pinId);
            // 保留为悬空引用
            return new PinLink(raw.nodeName, raw.pinId);
        }
        NodeSpec owner = byPinId.get(raw.pinId);
        if (owner != null) return new PinLink(owner.guid, raw.pinId);
        LOG.fine("丢弃无法定位的连接: PinId=" + raw.pinId);
        return null;
    }

    /**
     * 入口节点：所有事件 / 函数入口；若没有，则取所有 exec 输出已连接且 exec 输入未连接的节点。
     */
    static List<GraphNode> findEntryNodes(Iterable<GraphNode> nodes) {
        List<GraphNode> entries = new ArrayList<GraphNode>();
        for (GraphNode node : nodes) {
            if (node.getKind().isEvent()) entries.add(node);
        }
        if (!entries.isEmpty()) return entries;

        for (GraphNode node : nodes) {
            if (node.hasLinkedExecInput()) continue;
            for (GraphPin pin : node.getExecOutputs()) {
                if (pin.isLinked()) {
                    entries.add(node);
                    break;
                }
            }
        }
        return entries;
    }

    private NodeSpec findSpec(String guid) {
        for (NodeSpec spec : nodeSpecs) {
            if (guid.equals(spec.guid)) return spec;
        }
        return null;
    }

    // ============ 描述对象 ============

    /**
     * 节点描述
     */
    public static final class NodeSpec {
        private String guid;
        private final String name;
        private final String kindTag;
        private final Map<String, String> properties = new LinkedHashMap<String, String>();
        private final List<PinSpec> pins = new ArrayList<PinSpec>();

        NodeSpec(String guid, String name, String kindTag) {
            this.guid = guid;
            this.name = name;
            this.kindTag = kindTag;
        }

        public String getGuid() { return guid; }
        public String getName() { return name; }

        public void setGuid(String guid) {
            this.guid = guid;
        }

        public NodeSpec property(String key, String value) {
            properties.put(key, value);
            return this;
        }

        public PinSpec pin(String id, String name, PinDirection direction, String category) {
            PinSpec pin = new PinSpec(id, name, direction, category);
            pins.add(pin);
            return pin;
        }

        public NodeSpec inputExec(String id, String name) {
            pin(id, name, PinDirection.INPUT, PinKind.EXEC_CATEGORY);
            return this;
        }

        public NodeSpec outputExec(String id, String name) {
            pin(id, name, PinDirection.OUTPUT, PinKind.EXEC_CATEGORY);
            return this;
        }

        public NodeSpec inputData(String id, String name, String category, String defaultValue) {
            pin(id, name, PinDirection.INPUT, category).defaultValue(defaultValue);
            return this;
        }

        public NodeSpec outputData(String id, String name, String category) {
            pin(id, name, PinDirection.OUTPUT, category);
            return this;
        }

        PinSpec findPinSpec(String pinId) {
            for (PinSpec pin : pins) {
                if (pin.id.equals(pinId)) return pin;
            }
            return null;
        }
    }

    /**
     * 引脚描述
     */
    public static final class PinSpec {
        private final String id;
        private String name;
        private PinDirection direction;
        private String category;
        private String defaultValue;
        private final List<RawLink> rawLinks = new ArrayList<RawLink>();

        PinSpec(String id, String name, PinDirection direction, String category) {
            this.id = id;
            this.name = name;
            this.direction = direction;
            this.category = category;
        }

        public PinSpec defaultValue(String value) {
            this.defaultValue = value;
            return this;
        }

        public PinSpec name(String name) {
            this.name = name;
            return this;
        }

        public PinSpec direction(PinDirection direction) {
            this.direction = direction;
            return this;
        }

        public PinSpec category(String category) {
            this.category = category;
            return this;
        }

        public PinSpec linkTo(String nodeGuid, String pinId) {
            rawLinks.add(new RawLink(nodeGuid, null, pinId));
            return this;
        }

        public PinSpec linkToNamed(String nodeName, String pinId) {
            rawLinks.add(new RawLink(null, nodeName, pinId));
            return this;
        }

        public PinSpec linkToPin(String pinId) {
            rawLinks.add(new RawLink(null, null, pinId));
            return this;
        }
    }

    private static final class RawLink {
        final String nodeGuid;
        final String nodeName;
        final String pinId;

        RawLink(String nodeGuid, String nodeName, String pinId) {
            this.nodeGuid = nodeGuid;
            this.nodeName = nodeName;
            this.pinId = pinId;
        }
    }
}
