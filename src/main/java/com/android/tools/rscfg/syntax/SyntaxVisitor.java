// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

/**
 * Visitor over the concrete syntax elements.
 *
 * <p>There are no default methods: adding a new kind of element forces every visitor, in
 * particular the control flow graph builder, to decide how to handle it.
 */
public interface SyntaxVisitor<R, P> {

  R visitBlock(Block block, P parameter);

  R visitMatchArmGuard(MatchArmGuard guard, P parameter);

  // Statements.

  R visitLetDecl(LetDecl letDecl, P parameter);

  R visitExprStmt(ExprStmt exprStmt, P parameter);

  // Expressions.

  R visitLitExpr(LitExpr litExpr, P parameter);

  R visitPathExpr(PathExpr pathExpr, P parameter);

  R visitParenExpr(ParenExpr parenExpr, P parameter);

  R visitTupleExpr(TupleExpr tupleExpr, P parameter);

  R visitArrayExpr(ArrayExpr arrayExpr, P parameter);

  R visitStructLiteralExpr(StructLiteralExpr structLiteralExpr, P parameter);

  R visitUnaryExpr(UnaryExpr unaryExpr, P parameter);

  R visitBinaryExpr(BinaryExpr binaryExpr, P parameter);

  R visitCastExpr(CastExpr castExpr, P parameter);

  R visitCallExpr(CallExpr callExpr, P parameter);

  R visitMethodCallExpr(MethodCallExpr methodCallExpr, P parameter);

  R visitFieldExpr(FieldExpr fieldExpr, P parameter);

  R visitIndexExpr(IndexExpr indexExpr, P parameter);

  R visitRangeExpr(RangeExpr rangeExpr, P parameter);

  R visitTryExpr(TryExpr tryExpr, P parameter);

  R visitBlockExpr(BlockExpr blockExpr, P parameter);

  R visitIfExpr(IfExpr ifExpr, P parameter);

  R visitWhileExpr(WhileExpr whileExpr, P parameter);

  R visitLoopExpr(LoopExpr loopExpr, P parameter);

  R visitForExpr(ForExpr forExpr, P parameter);

  R visitMatchExpr(MatchExpr matchExpr, P parameter);

  R visitReturnExpr(ReturnExpr returnExpr, P parameter);

  R visitBreakExpr(BreakExpr breakExpr, P parameter);

  R visitContinueExpr(ContinueExpr continueExpr, P parameter);

  R visitMacroExpr(MacroExpr macroExpr, P parameter);

  R visitLambdaExpr(LambdaExpr lambdaExpr, P parameter);

  // Patterns.

  R visitPatWild(PatWild patWild, P parameter);

  R visitPatIdent(PatIdent patIdent, P parameter);

  R visitPatBinding(PatBinding patBinding, P parameter);

  R visitPatConst(PatConst patConst, P parameter);

  R visitPatRange(PatRange patRange, P parameter);

  R visitPatRest(PatRest patRest, P parameter);

  R visitPatTup(PatTup patTup, P parameter);

  R visitPatTupleStruct(PatTupleStruct patTupleStruct, P parameter);

  R visitPatStruct(PatStruct patStruct, P parameter);

  R visitPatSlice(PatSlice patSlice, P parameter);

  R visitPatRef(PatRef patRef, P parameter);
}
