package com.bplens.analyzer.analysis;

import com.bplens.analyzer.graph.Graph;
import com.bplens.analyzer.graph.GraphNode;
import com.bplens.analyzer.graph.GraphPin;
import com.bplens.analyzer.graph.NodeKind;
import com.bplens.analyzer.graph.PinLink;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * 第一遍：统计每个数据输出引脚被多少个输入消费。
 *
 * <p>Knot（重路由）节点不算消费者，经过 Knot 链的消费计到真正的产生者头上。</p>
 */
public final class PinUsageCounter {

    private PinUsageCounter() {}

    /** @return 产生者引脚键 ("GUID:引脚ID") -> 消费次数 */
    public static Map<String, Integer> count(Graph graph) {
        Map<String, Integer> usage = new HashMap<String, Integer>();
        for (GraphNode node : graph.getNodes()) {
            if (node.getKind() == NodeKind.KNOT) continue;
            for (GraphPin pin : node.getDataInputs()) {
                if (!pin.isLinked()) continue;
                PinLink producer = followKnots(graph, pin.getLinks().get(0));
                if (producer == null) continue;
                Integer current = usage.get(producer.key());
                usage.put(producer.key(), current == null ? 1 : current + 1);
            }
        }
        return usage;
    }

    /** 沿 Knot 链上溯到真正的产生者；环或断链时返回最后到达的位置 */
    static PinLink followKnots(Graph graph, PinLink link) {
        PinLink current = link;
        Set<String> seen = new HashSet<String>();
        while (current != null && seen.add(current.getNodeGuid())) {
            GraphNode node = graph.getNode(current.getNodeGuid());
            if (node == null || node.getKind() != NodeKind.KNOT) return current;
            GraphPin input = firstLinkedInput(node);
            if (input == null) return current;
            current = input.getLinks().get(0);
        }
        return current;
    }

    private static GraphPin firstLinkedInput(GraphNode knot) {
        for (GraphPin pin : knot.getPins()) {
            if (pin.isInput() && pin.isLinked()) return pin;
        }
        return null;
    }
}
