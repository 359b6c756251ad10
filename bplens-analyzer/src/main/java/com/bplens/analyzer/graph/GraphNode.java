package com.bplens.analyzer.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 图节点。由 {@link GraphBuilder} 构建，分析期间只读。
 */
public final class GraphNode {
    private final String guid;
    private final String name;
    private final String kindTag;
    private final NodeKind kind;
    private final Map<String, String> properties;
    private final List<GraphPin> pins;

    // 预计算的连接表：输入引脚 ID -> 上游，输出引脚 ID -> 下游列表
    private final Map<String, PinLink> inputConnections;
    private final Map<String, List<PinLink>> outputConnections;

    GraphNode(String guid, String name, String kindTag, Map<String, String> properties,
              List<GraphPin> pins) {
        this.guid = guid;
        this.name = name != null ? name : guid;
        this.kindTag = kindTag != null ? kindTag : "";
        this.kind = NodeKind.fromTag(kindTag);
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<String, String>(properties));
        this.pins = Collections.unmodifiableList(new ArrayList<GraphPin>(pins));

        Map<String, PinLink> inputs = new LinkedHashMap<String, PinLink>();
        Map<String, List<PinLink>> outputs = new LinkedHashMap<String, List<PinLink>>();
        for (GraphPin pin : this.pins) {
            if (!pin.isLinked()) continue;
            if (pin.isInput()) {
                inputs.put(pin.getId(), pin.getLinks().get(0));
            } else {
                outputs.put(pin.getId(), pin.getLinks());
            }
        }
        this.inputConnections = Collections.unmodifiableMap(inputs);
        this.outputConnections = Collections.unmodifiableMap(outputs);
    }

    public String getGuid() { return guid; }
    public String getName() { return name; }
    public String getKindTag() { return kindTag; }
    public NodeKind getKind() { return kind; }
    public Map<String, String> getProperties() { return properties; }
    public List<GraphPin> getPins() { return pins; }
    public Map<String, PinLink> getInputConnections() { return inputConnections; }
    public Map<String, List<PinLink>> getOutputConnections() { return outputConnections; }

    /** 短类型名，未知种类时取原始标签的末段 */
    public String getShortKind() {
        return kind != NodeKind.UNKNOWN ? kind.getShortName() : NodeKind.shortTag(kindTag);
    }

    public String getProperty(String key) {
        return properties.get(key);
    }

    public GraphPin findPinById(String pinId) {
        for (GraphPin pin : pins) {
            if (pin.getId().equals(pinId)) return pin;
        }
        return null;
    }

    /** 按名称与方向查找引脚（区分大小写） */
    public GraphPin findPin(String pinName, PinDirection direction) {
        for (GraphPin pin : pins) {
            if (pin.getDirection() == direction && pin.getName().equals(pinName)) return pin;
        }
        return null;
    }

    /** 按别名依次查找，名称比较忽略大小写 */
    public GraphPin findPinByAliases(PinDirection direction, String... aliases) {
        for (String alias : aliases) {
            for (GraphPin pin : pins) {
                if (pin.getDirection() == direction && pin.getName().equalsIgnoreCase(alias)) {
                    return pin;
                }
            }
        }
        return null;
    }

    public GraphPin findInput(String pinName) {
        return findPin(pinName, PinDirection.INPUT);
    }

    public GraphPin findOutput(String pinName) {
        return findPin(pinName, PinDirection.OUTPUT);
    }

    public List<GraphPin> getExecOutputs() {
        List<GraphPin> result = new ArrayList<GraphPin>();
        for (GraphPin pin : pins) {
            if (pin.isOutput() && pin.isExec()) result.add(pin);
        }
        return result;
    }

    public List<GraphPin> getDataInputs() {
        List<GraphPin> result = new ArrayList<GraphPin>();
        for (GraphPin pin : pins) {
            if (pin.isInput() && !pin.isExec()) result.add(pin);
        }
        return result;
    }

    public List<GraphPin> getDataOutputs() {
        List<GraphPin> result = new ArrayList<GraphPin>();
        for (GraphPin pin : pins) {
            if (pin.isOutput() && !pin.isExec()) result.add(pin);
        }
        return result;
    }

    public boolean hasExecPins() {
        for (GraphPin pin : pins) {
            if (pin.isExec()) return true;
        }
        return false;
    }

    public boolean hasDataPins() {
        for (GraphPin pin : pins) {
            if (!pin.isExec()) return true;
        }
        return false;
    }

    /** 是否存在已连接的 exec 输入 */
    public boolean hasLinkedExecInput() {
        for (GraphPin pin : pins) {
            if (pin.isInput() && pin.isExec() && pin.isLinked()) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return getShortKind() + "[" + name + "]";
    }
}
