// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.

package com.android.tools.rscfg.scope;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import com.android.tools.rscfg.TestBase;
import com.android.tools.rscfg.syntax.Block;
import com.android.tools.rscfg.syntax.IfExpr;
import com.android.tools.rscfg.syntax.LitExpr;
import com.android.tools.rscfg.syntax.LoopExpr;
import com.android.tools.rscfg.syntax.PathExpr;
import com.android.tools.rscfg.syntax.Stmt;
import com.android.tools.rscfg.syntax.WhileExpr;
import com.google.common.collect.ImmutableList;
import java.util.List;
import org.junit.Test;

public class RegionScopeTreeTest extends TestBase {

  @Test
  public void testRoot() {
    Block body = parseFirstFunction("fn main() {}").getBody();
    RegionScopeTree tree = RegionScopeTree.build(body);
    assertEquals(Scope.destruction(body), tree.getRootScope());
    assertNull(tree.getEnclosingScope(tree.getRootScope()));
    assertEquals(tree.getRootScope(), tree.getEnclosingScope(Scope.node(body)));
    assertEquals(2, tree.size());
  }

  @Test
  public void testStatementsAreTerminating() {
    Block body = parseFirstFunction("fn main() {", "    a;", "}").getBody();
    RegionScopeTree tree = RegionScopeTree.build(body);
    Stmt stmt = body.getStmts().get(0);
    PathExpr a = findElement(body, PathExpr.class, "a");
    assertEquals(
        ImmutableList.of(
            Scope.node(a),
            Scope.node(stmt),
            Scope.destruction(stmt),
            Scope.node(body),
            Scope.destruction(body)),
        tree.getScopeChain(Scope.node(a)));
  }

  @Test
  public void testLetOpensRemainderScope() {
    Block body =
        parseFirstFunction("fn main() {", "    let x = 1;", "    x;", "    x", "}").getBody();
    RegionScopeTree tree = RegionScopeTree.build(body);
    Scope remainder = Scope.remainder(body, 0);
    assertTrue(tree.contains(remainder));
    assertEquals(0, remainder.getFirstStatementIndex());
    assertEquals(Scope.node(body), tree.getEnclosingScope(remainder));
    assertEquals(remainder, tree.getEnclosingScope(Scope.destruction(body.getStmts().get(0))));
    assertEquals(remainder, tree.getEnclosingScope(Scope.destruction(body.getStmts().get(1))));
    // The trailing expression is not terminating.
    assertEquals(remainder, tree.getEnclosingScope(Scope.node(body.getTailExpr())));
  }

  @Test
  public void testBranchesAndLoopBodiesAreTerminating() {
    Block body =
        parseFirstFunction(
                "fn main() {",
                "    while c {",
                "        if d { 1 } else { 2 }",
                "    }",
                "}")
            .getBody();
    RegionScopeTree tree = RegionScopeTree.build(body);
    WhileExpr whileExpr = findElement(body, WhileExpr.class, e -> true);
    IfExpr ifExpr = findElement(body, IfExpr.class, e -> true);
    assertEquals(
        Scope.destruction(whileExpr.getBody()),
        tree.getEnclosingScope(Scope.node(whileExpr.getBody())));
    assertEquals(
        Scope.destruction(whileExpr.getCondition().getExpr()),
        tree.getEnclosingScope(Scope.node(whileExpr.getCondition().getExpr())));
    assertEquals(
        Scope.destruction(ifExpr.getThenBranch()),
        tree.getEnclosingScope(Scope.node(ifExpr.getThenBranch())));
    // The condition of an if is not terminating.
    assertEquals(
        Scope.node(ifExpr), tree.getEnclosingScope(Scope.node(ifExpr.getCondition().getExpr())));
    LitExpr one = findElement(body, LitExpr.class, "1");
    assertTrue(tree.isSubscopeOf(Scope.node(one), Scope.node(whileExpr)));
    assertFalse(tree.isSubscopeOf(Scope.node(whileExpr), Scope.node(one)));
  }

  @Test
  public void testExitingScopes() {
    Block body =
        parseFirstFunction("fn main() {", "    loop {", "        x;", "    }", "}").getBody();
    RegionScopeTree tree = RegionScopeTree.build(body);
    PathExpr x = findElement(body, PathExpr.class, "x");
    LoopExpr loop = findElement(body, LoopExpr.class, e -> true);
    List<Scope> chain = tree.getScopeChain(Scope.node(x));
    assertEquals(chain, tree.getExitingScopes(Scope.node(x), null));
    List<Scope> exiting = tree.getExitingScopes(Scope.node(x), Scope.node(loop));
    assertEquals(chain.subList(0, chain.indexOf(Scope.node(loop))), exiting);
    assertEquals(Scope.destruction(loop.getBody()), exiting.get(exiting.size() - 1));
  }

  @Test
  public void testUnknownScope() {
    Block body = parseFirstFunction("fn main() {", "    x;", "}").getBody();
    Block other = parseFirstFunction("fn other() {}").getBody();
    RegionScopeTree tree = RegionScopeTree.build(body);
    assertFalse(tree.contains(Scope.node(other)));
    assertNull(tree.getEnclosingScope(Scope.node(other)));
  }
}
