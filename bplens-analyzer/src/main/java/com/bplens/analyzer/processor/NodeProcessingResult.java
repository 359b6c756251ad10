package com.bplens.analyzer.processor;

import com.bplens.analyzer.ast.AstNode;
import com.bplens.analyzer.graph.GraphPin;

/**
 * 处理结果：AST 节点 + 后继执行引脚。
 *
 * <p>后继有三种情况：默认（then 或第一个执行输出）、显式指定引脚、无后继。</p>
 */
public final class NodeProcessingResult {

    public enum Continuation {
        DEFAULT,
        PIN,
        NONE
    }

    private static final NodeProcessingResult EMPTY = new NodeProcessingResult(null, Continuation.DEFAULT, null);

    private final AstNode node;
    private final Continuation continuation;
    private final GraphPin continuationPin;

    private NodeProcessingResult(AstNode node, Continuation continuation, GraphPin continuationPin) {
        this.node = node;
        this.continuation = continuation;
        this.continuationPin = continuationPin;
    }

    public static NodeProcessingResult of(AstNode node) {
        return node != null ? new NodeProcessingResult(node, Continuation.DEFAULT, null) : EMPTY;
    }

    /** 不产生 AST 节点，沿默认引脚继续 */
    public static NodeProcessingResult empty() {
        return EMPTY;
    }

    /** 从指定引脚继续；引脚为 null 时视为无后继 */
    public static NodeProcessingResult withContinuation(AstNode node, GraphPin pin) {
        return pin != null
                ? new NodeProcessingResult(node, Continuation.PIN, pin)
                : new NodeProcessingResult(node, Continuation.NONE, null);
    }

    /** 节点自行处理了全部后继执行流 */
    public static NodeProcessingResult terminal(AstNode node) {
        return new NodeProcessingResult(node, Continuation.NONE, null);
    }

    public AstNode getNode() {
        return node;
    }

    public boolean hasNode() {
        return node != null;
    }

    public Continuation getContinuation() {
        return continuation;
    }

    public GraphPin getContinuationPin() {
        return continuationPin;
    }
}
