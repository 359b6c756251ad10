package com.bplens.analyzer.graph;

/**
 * 引脚方向
 */
public enum PinDirection {
    INPUT,
    OUTPUT;

    /** 解析 "input"/"output"/"EGPD_Output" 等写法，无法识别时视为输入 */
    public static PinDirection parse(String text) {
        if (text == null) return INPUT;
        String lower = text.trim().toLowerCase();
        if (lower.equals("output") || lower.equals("out") || lower.endsWith("_output")) {
            return OUTPUT;
        }
        return INPUT;
    }
}
