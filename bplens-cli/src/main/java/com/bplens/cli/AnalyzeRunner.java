package com.bplens.cli;

import com.bplens.analyzer.analysis.GraphAnalyzer;
import com.bplens.analyzer.ast.stmt.Statement;
import com.bplens.analyzer.formatter.FormatConfig;
import com.bplens.analyzer.formatter.PseudocodeFormatter;
import com.bplens.analyzer.graph.Graph;
import com.bplens.analyzer.graph.io.BlueprintTextReader;
import com.bplens.analyzer.graph.io.GraphJsonReader;
import com.bplens.analyzer.graph.io.GraphReadException;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;

/**
 * 读取图文件、分析并打印伪代码
 */
public class AnalyzeRunner {

    public static final int EXIT_OK = 0;
    public static final int EXIT_ERROR = 1;

    private final PrintStream out;
    private final PrintStream err;
    private final GraphAnalyzer analyzer;

    public AnalyzeRunner(PrintStream out, PrintStream err) {
        this(out, err, new GraphAnalyzer());
    }

    public AnalyzeRunner(PrintStream out, PrintStream err, GraphAnalyzer analyzer) {
        this.out = out;
        this.err = err;
        this.analyzer = analyzer;
    }

    FormatConfig formatConfig(int indentSize, boolean useTabs, boolean showTypes) {
        FormatConfig config = new FormatConfig();
        config.setIndentSize(indentSize);
        config.setUseSpaces(!useTabs);
        config.setShowTypes(showTypes);
        return config;
    }

    /**
     * 分析文件并输出伪代码，返回进程退出码
     */
    public int analyzeFile(String filePath, String format, FormatConfig config) {
        Path path = Paths.get(filePath);
        if (!Files.exists(path)) {
            err.println("错误: 文件不存在 - " + filePath);
            return EXIT_ERROR;
        }

        String source;
        try {
            source = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("错误: 无法读取文件 - " + filePath + " (" + e.getMessage() + ")");
            return EXIT_ERROR;
        }

        String resolved = resolveFormat(format, path);
        if (resolved == null) {
            err.println("错误: 未知输入格式 '" + format + "'（可选: json, text）");
            return EXIT_ERROR;
        }

        Graph graph;
        try {
            graph = "json".equals(resolved)
                    ? new GraphJsonReader().read(source)
                    : new BlueprintTextReader().read(source, baseName(path));
        } catch (GraphReadException e) {
            err.println("解析错误: " + e.getMessage());
            return EXIT_ERROR;
        }

        List<Statement> statements = analyzer.analyze(graph);
        String text = new PseudocodeFormatter().format(statements, config);
        if (!text.isEmpty()) {
            out.print(text.endsWith("\n") ? text : text + "\n");
        }
        return EXIT_OK;
    }

    /**
     * 显式格式优先，否则按扩展名推断；.json 为 JSON，其余视为剪贴板文本
     */
    static String resolveFormat(String format, Path path) {
        if (format != null) {
            String lower = format.toLowerCase(Locale.ROOT);
            switch (lower) {
                case "json":
                case "text":
                    return lower;
                default:
                    return null;
            }
        }
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".json") ? "json" : "text";
    }

    private static String baseName(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
