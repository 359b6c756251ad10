package com.bplens.analyzer.ast;

import com.bplens.analyzer.ast.expr.*;
import com.bplens.analyzer.ast.stmt.*;

/**
 * AST 访问者接口
 *
 * <p>每个 AST 变体对应一个方法，默认实现返回 null，实现类只需覆盖感兴趣的节点类型。</p>
 */
public interface AstVisitor<R, C> {

    // ============ 语句 ============

    default R visitExecutionBlock(ExecutionBlock node, C ctx) { return null; }

    default R visitEventStmt(EventStmt node, C ctx) { return null; }

    default R visitAssignmentStmt(AssignmentStmt node, C ctx) { return null; }

    default R visitFunctionCallStmt(FunctionCallStmt node, C ctx) { return null; }

    default R visitBranchStmt(BranchStmt node, C ctx) { return null; }

    default R visitLoopStmt(LoopStmt node, C ctx) { return null; }

    default R visitLatentActionStmt(LatentActionStmt node, C ctx) { return null; }

    default R visitTempVariableDecl(TempVariableDecl node, C ctx) { return null; }

    default R visitVariableDecl(VariableDecl node, C ctx) { return null; }

    default R visitEventSubscriptionStmt(EventSubscriptionStmt node, C ctx) { return null; }

    default R visitFallbackStmt(FallbackStmt node, C ctx) { return null; }

    // ============ 表达式 ============

    default R visitLiteral(Literal node, C ctx) { return null; }

    default R visitVariableGetExpr(VariableGetExpr node, C ctx) { return null; }

    default R visitFunctionCallExpr(FunctionCallExpr node, C ctx) { return null; }

    default R visitCastExpr(CastExpr node, C ctx) { return null; }

    default R visitPropertyAccessExpr(PropertyAccessExpr node, C ctx) { return null; }

    default R visitTempVariableRef(TempVariableRef node, C ctx) { return null; }

    default R visitEventReferenceExpr(EventReferenceExpr node, C ctx) { return null; }

    default R visitLoopVariableExpr(LoopVariableExpr node, C ctx) { return null; }
}
