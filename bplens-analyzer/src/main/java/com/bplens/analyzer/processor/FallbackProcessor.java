package com.bplens.analyzer.processor;

import com.bplens.analyzer.analysis.AnalysisContext;
import com.bplens.analyzer.ast.SourceLocation;
import com.bplens.analyzer.ast.stmt.FallbackStmt;
import com.bplens.analyzer.graph.GraphNode;
import com.bplens.analyzer.graph.GraphPin;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * 回退：无法识别的节点保留类型名、少量属性与引脚摘要
 */
public class FallbackProcessor implements NodeProcessor {
    private static final Logger LOG = Logger.getLogger(FallbackProcessor.class.getName());

    // 位置、GUID 等与逻辑无关的属性
    private static final Set<String> NOISE = new HashSet<String>(Arrays.asList(
            "NodePosX", "NodePosY", "NodeGuid", "NodeWidth", "NodeHeight",
            "bCommentBubbleVisible", "bCommentBubblePinned", "ErrorType", "ErrorMsg",
            "AdvancedPinDisplay", "EnabledState"));

    @Override
    public NodeProcessingResult process(GraphNode node, AnalysisContext context) {
        int max = context.getConfig().getMaxFallbackProperties();
        Map<String, String> properties = new LinkedHashMap<String, String>();
        for (Map.Entry<String, String> entry : node.getProperties().entrySet()) {
            if (properties.size() >= max) break;
            if (NOISE.contains(entry.getKey())) continue;
            properties.put(entry.getKey(), entry.getValue());
        }

        List<String> pinSummary = new ArrayList<String>();
        for (GraphPin pin : node.getPins()) {
            pinSummary.add((pin.isInput() ? "in " : "out ") + pin.getName() + ":" + pin.getCategory());
        }

        String kindName = node.getKindTag().isEmpty() ? "Unknown" : node.getKindTag();
        LOG.fine("回退处理节点 " + kindName + " (" + node.getName() + ")");
        return NodeProcessingResult.of(
                new FallbackStmt(SourceLocation.of(node), kindName, node.getName(), properties, pinSummary));
    }
}
