package com.bplens.analyzer.graph;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 节点属性包的读取工具（无状态）
 */
public final class NodeProperties {

    private static final Pattern MEMBER_NAME = Pattern.compile("MemberName=\"([^\"]+)\"");
    private static final Pattern MACRO_GRAPH = Pattern.compile("MacroGraph=([^,)]+)");
    private static final Pattern QUOTED_PATH = Pattern.compile("'([^']*)'");

    private NodeProperties() {}

    /**
     * 读取引用类属性中的 MemberName
     * <pre>(MemberParent=...,MemberName="Health",bSelfContext=True) -> Health</pre>
     * 属性本身不含 MemberName 时，退回读取 "key.MemberName" 展开写法。
     */
    public static String memberName(GraphNode node, String key, String fallback) {
        String raw = node.getProperty(key);
        if (raw != null) {
            Matcher m = MEMBER_NAME.matcher(raw);
            if (m.find()) return m.group(1);
        }
        String flattened = node.getProperty(key + ".MemberName");
        if (flattened != null && !flattened.isEmpty()) return unquote(flattened);
        return fallback;
    }

    /** 引用是否为 self 上下文（缺省视为 true） */
    public static boolean isSelfContext(GraphNode node, String key) {
        String raw = node.getProperty(key);
        if (raw == null) return true;
        return raw.contains("bSelfContext=True") || !raw.contains("bSelfContext=False");
    }

    /** 读取字符串属性并去掉引号 */
    public static String string(GraphNode node, String key, String fallback) {
        String raw = node.getProperty(key);
        if (raw == null || raw.isEmpty()) return fallback;
        String value = unquote(raw);
        return value.isEmpty() ? fallback : value;
    }

    public static boolean bool(GraphNode node, String key) {
        String raw = node.getProperty(key);
        return raw != null && raw.trim().equalsIgnoreCase("True");
    }

    /**
     * 宏名称
     * <pre>(MacroGraph="/Engine/.../StandardMacros.StandardMacros:ForEachLoop",...) -> ForEachLoop</pre>
     */
    public static String macroName(GraphNode node) {
        String raw = node.getProperty("MacroGraphReference");
        if (raw == null || raw.isEmpty()) return null;
        String path = raw;
        Matcher m = MACRO_GRAPH.matcher(raw);
        if (m.find()) path = m.group(1);
        path = unquote(path.trim());
        Matcher quoted = QUOTED_PATH.matcher(path);
        if (quoted.find()) path = unquote(quoted.group(1));
        return lastSegment(path);
    }

    /**
     * 从对象路径中解析对象名
     * <pre>
     * "/Script/UMG.Border'Border_0'"                             -> "Border_0"
     * "/Game/UI/WBP_Foo.WBP_Foo_C'WidgetTree.CanvasPanel_0'"      -> "CanvasPanel_0"
     * "/Script/CoreUObject.Class'/Game/BP/BP_Player.BP_Player_C'" -> "BP_Player_C"
     * </pre>
     * 不带引号的路径取最后一段。
     */
    public static String parseObjectPath(String path) {
        if (path == null || path.trim().isEmpty()) return null;
        String value = unquote(path.trim());
        Matcher m = QUOTED_PATH.matcher(value);
        if (m.find()) value = unquote(m.group(1));
        String name = lastSegment(value);
        return name.isEmpty() ? null : name;
    }

    public static String unquote(String value) {
        if (value == null) return null;
        String v = value.trim();
        if (v.length() >= 2 && v.startsWith("\"") && v.endsWith("\"")) {
            return v.substring(1, v.length() - 1);
        }
        return v;
    }

    private static String lastSegment(String path) {
        String name = path;
        int dot = name.lastIndexOf('.');
        if (dot >= 0) name = name.substring(dot + 1);
        int colon = name.lastIndexOf(':');
        if (colon >= 0) name = name.substring(colon + 1);
        int slash = name.lastIndexOf('/');
        if (slash >= 0) name = name.substring(slash + 1);
        return name;
    }
}
