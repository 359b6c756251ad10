package com.bplens.analyzer.graph;

/**
 * 引脚种类：exec 引脚传递控制流，data 引脚传递值
 */
public enum PinKind {
    EXEC,
    DATA;

    public static final String EXEC_CATEGORY = "exec";

    public static PinKind fromCategory(String category) {
        return EXEC_CATEGORY.equalsIgnoreCase(category) ? EXEC : DATA;
    }
}
