package com.bplens.analyzer.graph.io;

/**
 * 图读取异常（输入无法解析）
 */
public class GraphReadException extends RuntimeException {
    private final int line;

    public GraphReadException(String message) {
        this(message, -1, null);
    }

    public GraphReadException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public GraphReadException(String message, int line, Throwable cause) {
        super(message, cause);
        this.line = line;
    }

    /** 出错行号（从 1 开始），未知时为 -1 */
    public int getLine() {
        return line;
    }

    @Override
    public String getMessage() {
        return line > 0 ? super.getMessage() + " at line " + line : super.getMessage();
    }
}
