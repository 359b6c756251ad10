package com.bplens.analyzer.formatter;

/**
 * 伪代码输出配置
 */
public class FormatConfig {
    private int indentSize = 4;
    private boolean useSpaces = true;
    private boolean showTypes = false;

    public FormatConfig() {
    }

    public int getIndentSize() {
        return indentSize;
    }

    public void setIndentSize(int indentSize) {
        this.indentSize = indentSize;
    }

    public boolean isUseSpaces() {
        return useSpaces;
    }

    public void setUseSpaces(boolean useSpaces) {
        this.useSpaces = useSpaces;
    }

    /** 是否输出参数与声明的类型 */
    public boolean isShowTypes() {
        return showTypes;
    }

    public void setShowTypes(boolean showTypes) {
        this.showTypes = showTypes;
    }

    /**
     * 获取单层缩进字符串
     */
    public String getIndentString() {
        if (!useSpaces) return "\t";
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < indentSize; i++) {
            sb.append(' ');
        }
        return sb.toString();
    }
}
