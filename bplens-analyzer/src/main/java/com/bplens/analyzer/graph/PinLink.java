package com.bplens.analyzer.graph;

/**
 * 引脚连接目标（节点 GUID + 引脚 ID）
 */
public final class PinLink {
    private final String nodeGuid;
    private final String pinId;

    public PinLink(String nodeGuid, String pinId) {
        this.nodeGuid = nodeGuid;
        this.pinId = pinId;
    }

    public String getNodeGuid() {
        return nodeGuid;
    }

    public String getPinId() {
        return pinId;
    }

    /** "节点GUID:引脚ID" 形式的全局唯一键 */
    public String key() {
        return GraphPin.key(nodeGuid, pinId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PinLink)) return false;
        PinLink other = (PinLink) o;
        return nodeGuid.equals(other.nodeGuid) && pinId.equals(other.pinId);
    }

    @Override
    public int hashCode() {
        return 31 * nodeGuid.hashCode() + pinId.hashCode();
    }

    @Override
    public String toString() {
        return key();
    }
}
