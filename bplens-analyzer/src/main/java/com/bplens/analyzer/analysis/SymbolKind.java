package com.bplens.analyzer.analysis;

/**
 * 符号类型
 */
public enum SymbolKind {
    VARIABLE,             // 普通局部变量
    LOOP_VARIABLE,        // ForEach 元素 / 索引
    CALLBACK_PARAMETER,   // 异步回调负载
    EVENT_PARAMETER,      // 事件参数
    CAST_RESULT           // 类型转换成功后的变量
}
