package com.bplens.analyzer.graph.io;

import com.bplens.analyzer.graph.Graph;
import com.bplens.analyzer.graph.GraphBuilder;
import com.bplens.analyzer.graph.PinDirection;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 读取蓝图编辑器复制出的文本（Begin Object ... End Object）。
 *
 * <p>支持两种引脚写法：</p>
 * <ul>
 *   <li>嵌套块：{@code Begin Object Class=/Script/Engine.EdGraphPin Name="..."}，连接为 NodeGuid + PinId</li>
 *   <li>内联行：{@code CustomProperties Pin (PinId=...,PinName="...",LinkedTo=(K2Node_X_0 PINID,),...)}，连接为节点名 + PinId</li>
 * </ul>
 */
public class BlueprintTextReader {
    private static final Logger LOG = Logger.getLogger(BlueprintTextReader.class.getName());

    private static final String BEGIN_OBJECT = "Begin Object";
    private static final String END_OBJECT = "End Object";
    private static final String INLINE_PIN = "CustomProperties Pin";

    private static final Pattern OBJECT_HEADER = Pattern.compile("Begin Object Class=(\\S+)(?:\\s+Name=\"([^\"]+)\")?");
    private static final Pattern NODE_GUID = Pattern.compile("^NodeGuid=([A-Fa-f0-9-]+)");
    private static final Pattern PIN_ID = Pattern.compile("PinId=([A-Fa-f0-9-]+)");
    private static final Pattern PIN_NAME = Pattern.compile("PinName=\"([^\"]+)\"");
    private static final Pattern PIN_CATEGORY = Pattern.compile("PinType\\.PinCategory=\"([^\"]*)\"");
    private static final Pattern DIRECTION = Pattern.compile("Direction=\"([^\"]+)\"");
    private static final Pattern DEFAULT_VALUE = Pattern.compile("DefaultValue=\"([^\"]*)\"");
    private static final Pattern DEFAULT_OBJECT = Pattern.compile("DefaultObject=\"([^\"]*)\"");
    private static final Pattern LINKED_TO = Pattern.compile("LinkedTo=\\(([^)]*)\\)");
    private static final Pattern GUID_LINK = Pattern.compile("NodeGuid=([A-Fa-f0-9-]+),\\s*PinId=([A-Fa-f0-9-]+)");
    private static final Pattern NAMED_LINK = Pattern.compile("(\\w+)\\s+([A-Fa-f0-9-]+)");
    private static final Pattern BARE_ID = Pattern.compile("[A-Fa-f0-9-]+");

    public Graph read(String text) {
        return read(text, "EventGraph");
    }

    /**
     * @return 解析得到的图；输入为空时返回 null
     */
    public Graph read(String text, String graphName) {
        if (text == null || text.trim().isEmpty()) {
            LOG.info("no input: 文本为空");
            return null;
        }
        String[] lines = text.trim().split("\\r?\\n");
        GraphBuilder builder = new GraphBuilder(graphName);
        int i = 0;
        while (i < lines.length) {
            String line = lines[i].trim();
            if (line.startsWith(BEGIN_OBJECT)) {
                Matcher header = OBJECT_HEADER.matcher(line);
                if (header.find() && !isPinClass(header.group(1))) {
                    i = readNode(lines, i, header, builder);
                    continue;
                }
            }
            i++;
        }
        if (builder.nodeCount() == 0) {
            throw new GraphReadException("文本中没有节点定义");
        }
        return builder.build();
    }

    private int readNode(String[] lines, int start, Matcher header, GraphBuilder builder) {
        String className = header.group(1);
        String name = header.group(2);
        GraphBuilder.NodeSpec node = builder.node(null, name, className);

        int i = start + 1;
        while (i < lines.length) {
            String line = lines[i].trim();
            if (line.equals(END_OBJECT)) {
                return i + 1;
            }
            if (line.startsWith(BEGIN_OBJECT)) {
                Matcher nested = OBJECT_HEADER.matcher(line);
                if (nested.find() && isPinClass(nested.group(1))) {
                    i = readPinBlock(lines, i, nested.group(2), node);
                } else {
                    i = skipObject(lines, i);
                }
                continue;
            }
            if (line.startsWith(INLINE_PIN)) {
                readInlinePin(line, node);
            } else {
                readNodeProperty(line, node);
            }
            i++;
        }
        throw new GraphReadException("节点 " + name + " 缺少 End Object", start + 1, null);
    }

    private static void readNodeProperty(String line, GraphBuilder.NodeSpec node) {
        Matcher guid = NODE_GUID.matcher(line);
        if (guid.find()) {
            node.setGuid(guid.group(1));
            return;
        }
        int eq = line.indexOf('=');
        if (eq <= 0 || line.startsWith("CustomProperties")) return;
        node.property(line.substring(0, eq).trim(), line.substring(eq + 1).trim());
    }

    /**
     * 嵌套引脚块，LinkedTo 可能跨多行
     */
    private static int readPinBlock(String[] lines, int start, String blockName, GraphBuilder.NodeSpec node) {
        String pinId = null;
        String pinName = blockName;
        String category = null;
        String defaultValue = null;
        PinDirection direction = PinDirection.INPUT;
        List<String[]> links = new ArrayList<String[]>();

        int i = start + 1;
        while (i < lines.length) {
            String line = lines[i].trim();
            if (line.equals(END_OBJECT)) break;

            if (line.contains("LinkedTo=(") && !line.contains(")")) {
                StringBuilder combined = new StringBuilder(line);
                while (i + 1 < lines.length) {
                    i++;
                    combined.append(' ').append(lines[i].trim());
                    if (lines[i].contains(")")) break;
                }
                line = combined.toString();
            }

            Matcher linked = LINKED_TO.matcher(line);
            if (linked.find()) {
                Matcher link = GUID_LINK.matcher(linked.group(1));
                while (link.find()) {
                    links.add(new String[]{link.group(1), link.group(2)});
                }
            } else if (line.startsWith("PinId=")) {
                pinId = group(PIN_ID, line, pinId);
            } else if (line.contains("PinType.bIsOutput=True")) {
                direction = PinDirection.OUTPUT;
            } else {
                pinName = group(PIN_NAME, line, pinName);
                category = group(PIN_CATEGORY, line, category);
                defaultValue = group(DEFAULT_VALUE, line, defaultValue);
                String dir = group(DIRECTION, line, null);
                if (dir != null) direction = PinDirection.parse(dir);
            }
            i++;
        }

        if (pinId == null) {
            LOG.fine("忽略缺少 PinId 的引脚块: " + pinName);
            return i + 1;
        }
        GraphBuilder.PinSpec pin = node.pin(pinId, pinName, direction, category).defaultValue(defaultValue);
        for (String[] link : links) {
            pin.linkTo(link[0], link[1]);
        }
        return i + 1;
    }

    /**
     * 内联引脚行
     * <pre>CustomProperties Pin (PinId=A1,PinName="then",Direction="EGPD_Output",PinType.PinCategory="exec",LinkedTo=(K2Node_CallFunction_0 B2,),)</pre>
     */
    static void readInlinePin(String line, GraphBuilder.NodeSpec node) {
        Matcher id = PIN_ID.matcher(line);
        if (!id.find()) return;

        Matcher name = PIN_NAME.matcher(line);
        Matcher direction = DIRECTION.matcher(line);
        Matcher category = PIN_CATEGORY.matcher(line);
        String defaultValue = null;
        Matcher value = DEFAULT_VALUE.matcher(line);
        if (value.find()) defaultValue = value.group(1);
        Matcher object = DEFAULT_OBJECT.matcher(line);
        if (object.find()) defaultValue = object.group(1);

        GraphBuilder.PinSpec pin = node.pin(id.group(1),
                name.find() ? name.group(1) : "unknown",
                direction.find() ? PinDirection.parse(direction.group(1)) : PinDirection.INPUT,
                category.find() ? category.group(1) : null);
        pin.defaultValue(defaultValue);

        Matcher linked = LINKED_TO.matcher(line);
        if (!linked.find()) return;
        String links = linked.group(1);
        Matcher named = NAMED_LINK.matcher(links);
        boolean any = false;
        while (named.find()) {
            pin.linkToNamed(named.group(1), named.group(2));
            any = true;
        }
        if (any) return;
        // 旧格式：只有引脚 ID
        Matcher bare = BARE_ID.matcher(links);
        while (bare.find()) {
            pin.linkToPin(bare.group());
        }
    }

    private static String group(Pattern pattern, String line, String fallback) {
        Matcher m = pattern.matcher(line);
        return m.find() ? m.group(1) : fallback;
    }

    private static int skipObject(String[] lines, int start) {
        int depth = 0;
        for (int i = start; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.startsWith(BEGIN_OBJECT)) depth++;
            else if (line.equals(END_OBJECT) && --depth == 0) return i + 1;
        }
        return lines.length;
    }

    /** EdGraphPin 及其变体 */
    private static boolean isPinClass(String className) {
        String simple = className.substring(className.lastIndexOf('.') + 1);
        return simple.startsWith("EdGraphPin") || simple.endsWith("Pin");
    }
}
