package com.bplens.analyzer.formatter;

/**
 * 格式化上下文，跟踪输出缓冲区和缩进层级
 */
public class FormatterContext {
    private final StringBuilder output = new StringBuilder();
    private final FormatConfig config;
    private int indentLevel = 0;
    private boolean atLineStart = true;

    public FormatterContext(FormatConfig config) {
        this.config = config;
    }

    public FormatConfig getConfig() {
        return config;
    }

    public void indent() {
        indentLevel++;
    }

    public void dedent() {
        if (indentLevel > 0) {
            indentLevel--;
        }
    }

    /**
     * 追加文本（行首自动缩进）
     */
    public void append(String text) {
        if (text == null || text.isEmpty()) return;
        if (atLineStart) {
            for (int i = 0; i < indentLevel; i++) {
                output.append(config.getIndentString());
            }
            atLineStart = false;
        }
        output.append(text);
    }

    public void newLine() {
        output.append("\n");
        atLineStart = true;
    }

    /** 输出完整一行 */
    public void line(String text) {
        append(text);
        newLine();
    }

    /**
     * 追加空行，不产生连续空行，输出开头不加
     */
    public void blankLine() {
        if (output.length() == 0) return;
        int len = output.length();
        if (len >= 2 && output.charAt(len - 1) == '\n' && output.charAt(len - 2) == '\n') return;
        if (output.charAt(len - 1) != '\n') output.append("\n");
        output.append("\n");
        atLineStart = true;
    }

    public String getOutput() {
        return output.toString();
    }
}
