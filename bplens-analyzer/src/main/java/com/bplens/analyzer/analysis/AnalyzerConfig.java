package com.bplens.analyzer.analysis;

/**
 * 分析器配置
 */
public class AnalyzerConfig {

    // 回退语句最多保留的属性数
    private int maxFallbackProperties = 5;

    // 临时变量名前缀
    private String tempVariablePrefix = "temp_";

    // 多次使用的数据输出是否提取为临时变量
    private boolean cseEnabled = true;

    public int getMaxFallbackProperties() {
        return maxFallbackProperties;
    }

    public void setMaxFallbackProperties(int maxFallbackProperties) {
        this.maxFallbackProperties = maxFallbackProperties;
    }

    public String getTempVariablePrefix() {
        return tempVariablePrefix;
    }

    public void setTempVariablePrefix(String tempVariablePrefix) {
        this.tempVariablePrefix = tempVariablePrefix;
    }

    public boolean isCseEnabled() {
        return cseEnabled;
    }

    public void setCseEnabled(boolean cseEnabled) {
        this.cseEnabled = cseEnabled;
    }

    /**
     * 默认配置
     */
    public static AnalyzerConfig defaultConfig() {
        return new AnalyzerConfig();
    }
}
