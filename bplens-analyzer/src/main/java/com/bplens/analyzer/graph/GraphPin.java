package com.bplens.analyzer.graph;

import java.util.Collections;
import java.util.List;

/**
 * 节点上的引脚。构建完成后不可变。
 */
public final class GraphPin {
    private final String ownerGuid;
    private final String id;
    private final String name;
    private final PinDirection direction;
    private final String category;      // exec / bool / int / real / string / object / delegate ...
    private final String defaultValue;  // 可选
    private final List<PinLink> links;

    public GraphPin(String ownerGuid, String id, String name, PinDirection direction,
                    String category, String defaultValue, List<PinLink> links) {
        this.ownerGuid = ownerGuid;
        this.id = id;
        this.name = name != null ? name : "";
        this.direction = direction;
        this.category = category != null ? category : "unknown";
        this.defaultValue = defaultValue;
        this.links = Collections.unmodifiableList(links);
    }

    public static String key(String nodeGuid, String pinId) {
        return nodeGuid + ":" + pinId;
    }

    public String getOwnerGuid() { return ownerGuid; }
    public String getId() { return id; }
    public String getName() { return name; }
    public PinDirection getDirection() { return direction; }
    public String getCategory() { return category; }
    public String getDefaultValue() { return defaultValue; }
    public List<PinLink> getLinks() { return links; }

    public PinKind getKind() {
        return PinKind.fromCategory(category);
    }

    public boolean isExec() {
        return getKind() == PinKind.EXEC;
    }

    public boolean isInput() {
        return direction == PinDirection.INPUT;
    }

    public boolean isOutput() {
        return direction == PinDirection.OUTPUT;
    }

    public boolean isLinked() {
        return !links.isEmpty();
    }

    public boolean isDelegate() {
        return "delegate".equalsIgnoreCase(category);
    }

    /** "节点GUID:引脚ID" */
    public String key() {
        return key(ownerGuid, id);
    }

    @Override
    public String toString() {
        return name + "(" + (isOutput() ? "out" : "in") + ", " + category + ")";
    }
}
