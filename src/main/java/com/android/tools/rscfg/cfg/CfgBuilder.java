// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.cfg;

import com.android.tools.rscfg.errors.Unreachable;
import com.android.tools.rscfg.graph.Graph;
import com.android.tools.rscfg.scope.Scope;
import com.android.tools.rscfg.scope.ScopeTree;
import com.android.tools.rscfg.syntax.ArrayExpr;
import com.android.tools.rscfg.syntax.BinaryExpr;
import com.android.tools.rscfg.syntax.Block;
import com.android.tools.rscfg.syntax.BlockExpr;
import com.android.tools.rscfg.syntax.BreakExpr;
import com.android.tools.rscfg.syntax.CallExpr;
import com.android.tools.rscfg.syntax.CastExpr;
import com.android.tools.rscfg.syntax.Condition;
import com.android.tools.rscfg.syntax.ContinueExpr;
import com.android.tools.rscfg.syntax.Expr;
import com.android.tools.rscfg.syntax.ExprStmt;
import com.android.tools.rscfg.syntax.FieldExpr;
import com.android.tools.rscfg.syntax.ForExpr;
import com.android.tools.rscfg.syntax.IfExpr;
import com.android.tools.rscfg.syntax.IndexExpr;
import com.android.tools.rscfg.syntax.LambdaExpr;
import com.android.tools.rscfg.syntax.LetDecl;
import com.android.tools.rscfg.syntax.LitExpr;
import com.android.tools.rscfg.syntax.LoopExpr;
import com.android.tools.rscfg.syntax.LooplikeExpr;
import com.android.tools.rscfg.syntax.MacroExpr;
import com.android.tools.rscfg.syntax.MatchArm;
import com.android.tools.rscfg.syntax.MatchArmGuard;
import com.android.tools.rscfg.syntax.MatchExpr;
import com.android.tools.rscfg.syntax.MethodCallExpr;
import com.android.tools.rscfg.syntax.ParenExpr;
import com.android.tools.rscfg.syntax.Pat;
import com.android.tools.rscfg.syntax.PatBinding;
import com.android.tools.rscfg.syntax.PatConst;
import com.android.tools.rscfg.syntax.PatIdent;
import com.android.tools.rscfg.syntax.PatRange;
import com.android.tools.rscfg.syntax.PatRef;
import com.android.tools.rscfg.syntax.PatRest;
import com.android.tools.rscfg.syntax.PatSlice;
import com.android.tools.rscfg.syntax.PatStruct;
import com.android.tools.rscfg.syntax.PatTup;
import com.android.tools.rscfg.syntax.PatTupleStruct;
import com.android.tools.rscfg.syntax.PatWild;
import com.android.tools.rscfg.syntax.PathExpr;
import com.android.tools.rscfg.syntax.RangeExpr;
import com.android.tools.rscfg.syntax.ReturnExpr;
import com.android.tools.rscfg.syntax.StructLiteralExpr;
import com.android.tools.rscfg.syntax.SyntaxElement;
import com.android.tools.rscfg.syntax.SyntaxVisitor;
import com.android.tools.rscfg.syntax.TryExpr;
import com.android.tools.rscfg.syntax.TupleExpr;
import com.android.tools.rscfg.syntax.UnaryExpr;
import com.android.tools.rscfg.syntax.WhileExpr;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Builds the control flow graph of a function body.
 *
 * <p>Each visit method takes the nodes that flow into the visited element and returns the nodes
 * that flow out of it. An empty list means that the element is unreachable: its nodes are still
 * added to the graph, but without incoming edges.
 */
class CfgBuilder implements SyntaxVisitor<IntList, IntList> {

  /** A loop, or a labelled block, that {@code break} and {@code continue} can jump to. */
  private static class JumpTarget {

    final SyntaxElement element;
    final String label;
    final int breakNode;
    final int continueNode;

    JumpTarget(SyntaxElement element, String label, int breakNode, int continueNode) {
      this.element = element;
      this.label = label;
      this.breakNode = breakNode;
      this.continueNode = continueNode;
    }

    boolean isLoop() {
      return continueNode != Graph.INVALID_INDEX;
    }
  }

  private final ScopeTree scopeTree;
  private final Graph.Builder<CfgNodeData, CfgEdgeData> graph = Graph.builder();
  private final Deque<JumpTarget> jumpTargets = new ArrayDeque<>();
  private int exit = Graph.INVALID_INDEX;

  CfgBuilder(ScopeTree scopeTree) {
    this.scopeTree = scopeTree;
  }

  ControlFlowGraph build(Block body) {
    int entry = graph.addNode(CfgNodeData.entry());
    exit = graph.addNode(CfgNodeData.exit());
    IntList bodyExit = process(body, IntLists.singleton(entry));
    addContainedEdges(bodyExit, exit);
    assert jumpTargets.isEmpty();
    return new ControlFlowGraph(body, graph.build(), entry, exit);
  }

  private IntList process(SyntaxElement element, IntList preds) {
    return element.accept(this, preds);
  }

  private IntList processAll(List<? extends SyntaxElement> elements, IntList preds) {
    IntList current = preds;
    for (SyntaxElement element : elements) {
      current = process(element, current);
    }
    return current;
  }

  /** Processes the children in source order, followed by a node for the element itself. */
  private IntList processStraightLine(SyntaxElement element, IntList preds) {
    List<SyntaxElement> children = new ArrayList<>();
    element.forEachChild(children::add);
    return addAstNode(element, processAll(children, preds));
  }

  /** Processes each alternative from {@code preds}; all alternatives join a single dummy. */
  private IntList processPatterns(List<Pat> pats, IntList preds) {
    int join = graph.addNode(CfgNodeData.dummy());
    for (Pat pat : pats) {
      addContainedEdges(process(pat, preds), join);
    }
    return IntLists.singleton(join);
  }

  private int addNode(CfgNodeData data, IntList preds) {
    int node = graph.addNode(data);
    addContainedEdges(preds, node);
    return node;
  }

  private IntList addAstNode(SyntaxElement element, IntList preds) {
    return IntLists.singleton(addNode(CfgNodeData.ast(element), preds));
  }

  private IntList addDummyNode(IntList preds) {
    return IntLists.singleton(addNode(CfgNodeData.dummy(), preds));
  }

  private void addContainedEdges(IntList sources, int target) {
    for (int i = 0; i < sources.size(); i++) {
      graph.addEdge(sources.getInt(i), target, CfgEdgeData.fallThrough());
    }
  }

  private void addExitingEdge(SyntaxElement from, int source, Scope targetScope, int target) {
    List<Scope> exitingScopes = scopeTree.getExitingScopes(Scope.node(from), targetScope);
    graph.addEdge(source, target, CfgEdgeData.exiting(exitingScopes));
  }

  private void addReturningEdge(SyntaxElement from, int source) {
    addExitingEdge(from, source, null, exit);
  }

  private static IntList union(IntList first, IntList second) {
    if (first.isEmpty()) {
      return second;
    }
    if (second.isEmpty()) {
      return first;
    }
    IntArrayList result = new IntArrayList(first);
    for (int i = 0; i < second.size(); i++) {
      int node = second.getInt(i);
      if (!result.contains(node)) {
        result.add(node);
      }
    }
    return result;
  }

  private JumpTarget findJumpTarget(String label, boolean isContinue) {
    for (JumpTarget target : jumpTargets) {
      if (label == null ? target.isLoop() : label.equals(target.label)) {
        if (isContinue && !target.isLoop()) {
          throw new Unreachable("Cannot continue to the labelled block " + label);
        }
        return target;
      }
    }
    throw new Unreachable(
        label == null ? "Jump outside of a loop" : "Jump to the unknown label " + label);
  }

  private IntList processJumpValue(Expr value, IntList preds) {
    return value == null ? preds : process(value, preds);
  }

  // Blocks and statements.

  @Override
  public IntList visitBlock(Block block, IntList preds) {
    IntList stmtsExit = processAll(block.getStmts(), preds);
    IntList exit = block.hasTailExpr() ? process(block.getTailExpr(), stmtsExit) : stmtsExit;
    return addAstNode(block, exit);
  }

  @Override
  public IntList visitLetDecl(LetDecl letDecl, IntList preds) {
    IntList initExit =
        letDecl.getInitializer() == null ? preds : process(letDecl.getInitializer(), preds);
    if (letDecl.getElseBlock() != null) {
      // The else block diverges, so nothing flows out of it.
      process(letDecl.getElseBlock(), initExit);
    }
    IntList patExit = process(letDecl.getPat(), initExit);
    return addAstNode(letDecl, patExit);
  }

  @Override
  public IntList visitExprStmt(ExprStmt exprStmt, IntList preds) {
    return addAstNode(exprStmt, process(exprStmt.getExpr(), preds));
  }

  // Straight line expressions.

  @Override
  public IntList visitLitExpr(LitExpr litExpr, IntList preds) {
    return addAstNode(litExpr, preds);
  }

  @Override
  public IntList visitPathExpr(PathExpr pathExpr, IntList preds) {
    return addAstNode(pathExpr, preds);
  }

  @Override
  public IntList visitParenExpr(ParenExpr parenExpr, IntList preds) {
    return process(parenExpr.getExpr(), preds);
  }

  @Override
  public IntList visitTupleExpr(TupleExpr tupleExpr, IntList preds) {
    return processStraightLine(tupleExpr, preds);
  }

  @Override
  public IntList visitArrayExpr(ArrayExpr arrayExpr, IntList preds) {
    return processStraightLine(arrayExpr, preds);
  }

  @Override
  public IntList visitStructLiteralExpr(StructLiteralExpr structLiteralExpr, IntList preds) {
    return processStraightLine(structLiteralExpr, preds);
  }

  @Override
  public IntList visitUnaryExpr(UnaryExpr unaryExpr, IntList preds) {
    return processStraightLine(unaryExpr, preds);
  }

  @Override
  public IntList visitBinaryExpr(BinaryExpr binaryExpr, IntList preds) {
    if (!binaryExpr.isLazy()) {
      return processStraightLine(binaryExpr, preds);
    }
    IntList leftExit = process(binaryExpr.getLeft(), preds);
    IntList rightExit = process(binaryExpr.getRight(), leftExit);
    return addAstNode(binaryExpr, union(leftExit, rightExit));
  }

  @Override
  public IntList visitCastExpr(CastExpr castExpr, IntList preds) {
    return processStraightLine(castExpr, preds);
  }

  @Override
  public IntList visitCallExpr(CallExpr callExpr, IntList preds) {
    IntList callExit = processStraightLine(callExpr, preds);
    return callExpr.isNeverTyped() ? IntLists.EMPTY_LIST : callExit;
  }

  @Override
  public IntList visitMethodCallExpr(MethodCallExpr methodCallExpr, IntList preds) {
    return processStraightLine(methodCallExpr, preds);
  }

  @Override
  public IntList visitFieldExpr(FieldExpr fieldExpr, IntList preds) {
    return processStraightLine(fieldExpr, preds);
  }

  @Override
  public IntList visitIndexExpr(IndexExpr indexExpr, IntList preds) {
    return processStraightLine(indexExpr, preds);
  }

  @Override
  public IntList visitRangeExpr(RangeExpr rangeExpr, IntList preds) {
    return processStraightLine(rangeExpr, preds);
  }

  @Override
  public IntList visitMacroExpr(MacroExpr macroExpr, IntList preds) {
    if (macroExpr.isNeverTyped()) {
      return IntLists.EMPTY_LIST;
    }
    return addAstNode(macroExpr, preds);
  }

  @Override
  public IntList visitLambdaExpr(LambdaExpr lambdaExpr, IntList preds) {
    // The body runs when the closure is called, not where it is defined.
    return addAstNode(lambdaExpr, preds);
  }

  // Control flow.

  @Override
  public IntList visitTryExpr(TryExpr tryExpr, IntList preds) {
    IntList exprExit = process(tryExpr.getExpr(), preds);
    int check = addNode(CfgNodeData.dummy(), exprExit);
    addReturningEdge(tryExpr, check);
    return addAstNode(tryExpr, IntLists.singleton(check));
  }

  @Override
  public IntList visitBlockExpr(BlockExpr blockExpr, IntList preds) {
    if (!blockExpr.hasLabel()) {
      return addAstNode(blockExpr, process(blockExpr.getBlock(), preds));
    }
    int blockExprNode = graph.addNode(CfgNodeData.ast(blockExpr));
    jumpTargets.push(
        new JumpTarget(blockExpr, blockExpr.getLabel(), blockExprNode, Graph.INVALID_INDEX));
    IntList blockExit = process(blockExpr.getBlock(), preds);
    jumpTargets.pop();
    addContainedEdges(blockExit, blockExprNode);
    return IntLists.singleton(blockExprNode);
  }

  @Override
  public IntList visitIfExpr(IfExpr ifExpr, IntList preds) {
    Condition condition = ifExpr.getCondition();
    IntList exprExit = process(condition.getExpr(), preds);
    if (condition.isLet()) {
      IntList patternsExit = processPatterns(condition.getPats(), exprExit);
      IntList thenExit = process(ifExpr.getThenBranch(), patternsExit);
      IntList elseExit =
          ifExpr.hasElseBranch() ? process(ifExpr.getElseBranch(), exprExit) : exprExit;
      return addAstNode(ifExpr, union(thenExit, elseExit));
    }
    IntList thenExit = process(ifExpr.getThenBranch(), exprExit);
    if (ifExpr.hasElseBranch()) {
      IntList elseExit = process(ifExpr.getElseBranch(), exprExit);
      return addAstNode(ifExpr, union(thenExit, elseExit));
    }
    return addAstNode(ifExpr, union(exprExit, thenExit));
  }

  @Override
  public IntList visitWhileExpr(WhileExpr whileExpr, IntList preds) {
    int loopHead = addNode(CfgNodeData.dummy(), preds);
    int whileNode = graph.addNode(CfgNodeData.ast(whileExpr));
    jumpTargets.push(new JumpTarget(whileExpr, whileExpr.getLabel(), whileNode, loopHead));
    Condition condition = whileExpr.getCondition();
    IntList conditionExit = process(condition.getExpr(), IntLists.singleton(loopHead));
    addContainedEdges(conditionExit, whileNode);
    IntList bodyEntry =
        condition.isLet() ? processPatterns(condition.getPats(), conditionExit) : conditionExit;
    IntList bodyExit = process(whileExpr.getBody(), bodyEntry);
    addContainedEdges(bodyExit, loopHead);
    jumpTargets.pop();
    return IntLists.singleton(whileNode);
  }

  @Override
  public IntList visitLoopExpr(LoopExpr loopExpr, IntList preds) {
    int loopHead = addNode(CfgNodeData.dummy(), preds);
    // Only reachable through a break.
    int loopNode = graph.addNode(CfgNodeData.ast(loopExpr));
    return processLoopBody(loopExpr, loopHead, loopNode, IntLists.singleton(loopHead));
  }

  @Override
  public IntList visitForExpr(ForExpr forExpr, IntList preds) {
    int loopHead = addNode(CfgNodeData.dummy(), preds);
    int forNode = graph.addNode(CfgNodeData.ast(forExpr));
    IntList iterableExit = process(forExpr.getIterable(), IntLists.singleton(loopHead));
    addContainedEdges(iterableExit, forNode);
    return processLoopBody(forExpr, loopHead, forNode, iterableExit);
  }

  private IntList processLoopBody(
      LooplikeExpr loop, int loopHead, int loopNode, IntList bodyEntry) {
    jumpTargets.push(new JumpTarget(loop, loop.getLabel(), loopNode, loopHead));
    IntList bodyExit = process(loop.getBody(), bodyEntry);
    addContainedEdges(bodyExit, loopHead);
    jumpTargets.pop();
    return IntLists.singleton(loopNode);
  }

  @Override
  public IntList visitMatchExpr(MatchExpr matchExpr, IntList preds) {
    IntList discriminantExit = process(matchExpr.getDiscriminant(), preds);
    int matchNode = graph.addNode(CfgNodeData.ast(matchExpr));
    // A failing guard falls through to the guard of a later arm.
    IntList previousGuardExits = IntLists.EMPTY_LIST;
    for (MatchArm arm : matchExpr.getArms()) {
      int armExit = graph.addNode(CfgNodeData.dummy());
      for (Pat pat : arm.getPats()) {
        IntList patExit = process(pat, discriminantExit);
        if (arm.hasGuard()) {
          int guardStart = addNode(CfgNodeData.dummy(), patExit);
          IntList guardExit = process(arm.getGuard(), IntLists.singleton(guardStart));
          addContainedEdges(previousGuardExits, guardStart);
          previousGuardExits = guardExit;
          addContainedEdges(guardExit, armExit);
        } else {
          addContainedEdges(patExit, armExit);
        }
      }
      IntList bodyExit = process(arm.getBody(), IntLists.singleton(armExit));
      addContainedEdges(bodyExit, matchNode);
    }
    return IntLists.singleton(matchNode);
  }

  @Override
  public IntList visitMatchArmGuard(MatchArmGuard guard, IntList preds) {
    return addAstNode(guard, process(guard.getCondition(), preds));
  }

  @Override
  public IntList visitReturnExpr(ReturnExpr returnExpr, IntList preds) {
    IntList valueExit = processJumpValue(returnExpr.getValue(), preds);
    int returnNode = addNode(CfgNodeData.ast(returnExpr), valueExit);
    addReturningEdge(returnExpr, returnNode);
    return IntLists.EMPTY_LIST;
  }

  @Override
  public IntList visitBreakExpr(BreakExpr breakExpr, IntList preds) {
    IntList valueExit = processJumpValue(breakExpr.getValue(), preds);
    int breakNode = addNode(CfgNodeData.ast(breakExpr), valueExit);
    JumpTarget target = findJumpTarget(breakExpr.getLabel(), false);
    addExitingEdge(breakExpr, breakNode, Scope.node(target.element), target.breakNode);
    return IntLists.EMPTY_LIST;
  }

  @Override
  public IntList visitContinueExpr(ContinueExpr continueExpr, IntList preds) {
    int continueNode = addNode(CfgNodeData.ast(continueExpr), preds);
    JumpTarget target = findJumpTarget(continueExpr.getLabel(), true);
    addExitingEdge(continueExpr, continueNode, Scope.node(target.element), target.continueNode);
    return IntLists.EMPTY_LIST;
  }

  // Patterns.

  @Override
  public IntList visitPatWild(PatWild patWild, IntList preds) {
    return addAstNode(patWild, preds);
  }

  @Override
  public IntList visitPatIdent(PatIdent patIdent, IntList preds) {
    return processStraightLine(patIdent, preds);
  }

  @Override
  public IntList visitPatBinding(PatBinding patBinding, IntList preds) {
    return addAstNode(patBinding, preds);
  }

  @Override
  public IntList visitPatConst(PatConst patConst, IntList preds) {
    return addAstNode(patConst, preds);
  }

  @Override
  public IntList visitPatRange(PatRange patRange, IntList preds) {
    return addAstNode(patRange, preds);
  }

  @Override
  public IntList visitPatRest(PatRest patRest, IntList preds) {
    return addAstNode(patRest, preds);
  }

  @Override
  public IntList visitPatTup(PatTup patTup, IntList preds) {
    return processStraightLine(patTup, preds);
  }

  @Override
  public IntList visitPatTupleStruct(PatTupleStruct patTupleStruct, IntList preds) {
    return processStraightLine(patTupleStruct, preds);
  }

  @Override
  public IntList visitPatStruct(PatStruct patStruct, IntList preds) {
    return processStraightLine(patStruct, preds);
  }

  @Override
  public IntList visitPatSlice(PatSlice patSlice, IntList preds) {
    return processStraightLine(patSlice, preds);
  }

  @Override
  public IntList visitPatRef(PatRef patRef, IntList preds) {
    return processStraightLine(patRef, preds);
  }
}
