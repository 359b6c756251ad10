package com.bplens.analyzer.graph.io;

import com.bplens.analyzer.graph.Graph;
import com.bplens.analyzer.graph.GraphBuilder;
import com.bplens.analyzer.graph.PinDirection;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

import java.io.Reader;
import java.io.StringReader;
import java.util.Map;

/**
 * 读取 JSON 形式的图
 *
 * <pre>
 * {
 *   "name": "EventGraph",
 *   "nodes": [{
 *     "guid": "N1", "name": "K2Node_Event_0", "kind": "K2Node_Event",
 *     "properties": { "EventReference": "(MemberName=\"ReceiveBeginPlay\")" },
 *     "pins": [{ "id": "P1", "name": "then", "direction": "output", "category": "exec",
 *                "default": null, "links": [{ "node": "N2", "pin": "P2" }] }]
 *   }]
 * }
 * </pre>
 * 连接中的 "node" 可以是节点 GUID；写 "nodeName" 时按节点名解析，两者都省略时按引脚 ID 全图查找。
 */
public class GraphJsonReader {

    private final Gson gson = new Gson();

    public Graph read(String json) {
        if (json == null || json.trim().isEmpty()) return null;
        return read(new StringReader(json));
    }

    public Graph read(Reader reader) {
        JsonObject root;
        try {
            root = gson.fromJson(reader, JsonObject.class);
        } catch (JsonParseException e) {
            throw new GraphReadException("JSON 解析失败: " + e.getMessage(), e);
        }
        if (root == null) return null;

        try {
            GraphBuilder builder = new GraphBuilder(string(root, "name", "EventGraph"));
            JsonArray nodes = root.has("nodes") ? root.getAsJsonArray("nodes") : new JsonArray();
            for (JsonElement element : nodes) {
                readNode(element.getAsJsonObject(), builder);
            }
            return builder.build();
        } catch (IllegalStateException | ClassCastException | UnsupportedOperationException e) {
            throw new GraphReadException("图结构不合法: " + e.getMessage(), e);
        }
    }

    private void readNode(JsonObject json, GraphBuilder builder) {
        GraphBuilder.NodeSpec node = builder.node(string(json, "guid", null), string(json, "name", null),
                string(json, "kind", ""));

        if (json.has("properties") && json.get("properties").isJsonObject()) {
            for (Map.Entry<String, JsonElement> entry : json.getAsJsonObject("properties").entrySet()) {
                JsonElement value = entry.getValue();
                if (value.isJsonNull()) continue;
                node.property(entry.getKey(), value.isJsonPrimitive() ? value.getAsString() : value.toString());
            }
        }

        if (!json.has("pins")) return;
        for (JsonElement element : json.getAsJsonArray("pins")) {
            JsonObject pinJson = element.getAsJsonObject();
            String id = string(pinJson, "id", null);
            if (id == null) {
                throw new GraphReadException("引脚缺少 id: " + pinJson);
            }
            GraphBuilder.PinSpec pin = node.pin(id, string(pinJson, "name", id),
                    PinDirection.parse(string(pinJson, "direction", "input")),
                    string(pinJson, "category", null));
            pin.defaultValue(string(pinJson, "default", null));

            if (!pinJson.has("links")) continue;
            for (JsonElement linkElement : pinJson.getAsJsonArray("links")) {
                JsonObject link = linkElement.getAsJsonObject();
                String pinId = string(link, "pin", null);
                if (pinId == null) continue;
                if (link.has("node")) {
                    pin.linkTo(string(link, "node", null), pinId);
                } else if (link.has("nodeName")) {
                    pin.linkToNamed(string(link, "nodeName", null), pinId);
                } else {
                    pin.linkToPin(pinId);
                }
            }
        }
    }

    private static String string(JsonObject json, String key, String fallback) {
        JsonElement value = json.get(key);
        if (value == null || value.isJsonNull()) return fallback;
        return value.getAsString();
    }
}
