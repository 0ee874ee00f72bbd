// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.scope;

import com.android.tools.rscfg.syntax.BinaryExpr;
import com.android.tools.rscfg.syntax.Block;
import com.android.tools.rscfg.syntax.Expr;
import com.android.tools.rscfg.syntax.IfExpr;
import com.android.tools.rscfg.syntax.LambdaExpr;
import com.android.tools.rscfg.syntax.LetDecl;
import com.android.tools.rscfg.syntax.LooplikeExpr;
import com.android.tools.rscfg.syntax.MatchArmGuard;
import com.android.tools.rscfg.syntax.MatchExpr;
import com.android.tools.rscfg.syntax.Pat;
import com.android.tools.rscfg.syntax.Stmt;
import com.android.tools.rscfg.syntax.SyntaxElement;
import com.android.tools.rscfg.syntax.WhileExpr;
import com.android.tools.rscfg.utils.Timing;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Scope tree computed from the syntax of a function body.
 *
 * <p>The root is the destruction scope of the body block. Statements, loop bodies, branches of
 * {@code if}, match arm bodies and guards, {@code while} conditions, the right operand of a lazy
 * boolean operator and closure bodies are terminating.
 */
public class RegionScopeTree implements ScopeTree {

  private final Scope rootScope;
  private final Map<Scope, Scope> parentMap;

  private RegionScopeTree(Scope rootScope, Map<Scope, Scope> parentMap) {
    this.rootScope = rootScope;
    this.parentMap = parentMap;
  }

  public static RegionScopeTree build(Block body) {
    return build(body, Timing.empty());
  }

  public static RegionScopeTree build(Block body, Timing timing) {
    return timing.time("Build region scope tree", () -> new Builder().build(body));
  }

  public Scope getRootScope() {
    return rootScope;
  }

  public boolean contains(Scope scope) {
    return scope.equals(rootScope) || parentMap.containsKey(scope);
  }

  public int size() {
    return parentMap.size() + 1;
  }

  @Override
  public Scope getEnclosingScope(Scope scope) {
    return parentMap.get(scope);
  }

  /** Returns {@code scope} followed by all of its enclosing scopes, ending with the root. */
  public List<Scope> getScopeChain(Scope scope) {
    List<Scope> chain = new ArrayList<>();
    for (Scope current = scope; current != null; current = getEnclosingScope(current)) {
      chain.add(current);
    }
    return chain;
  }

  public boolean isSubscopeOf(Scope scope, Scope ancestor) {
    for (Scope current = scope; current != null; current = getEnclosingScope(current)) {
      if (current.equals(ancestor)) {
        return true;
      }
    }
    return false;
  }

  private static class Builder {

    private final Map<Scope, Scope> parentMap = new HashMap<>();
    private Scope current = null;

    RegionScopeTree build(Block body) {
      Scope root = Scope.destruction(body);
      current = root;
      visit(body, false);
      return new RegionScopeTree(root, ImmutableMap.copyOf(parentMap));
    }

    private void enter(Scope scope) {
      assert current != null;
      Scope previous = parentMap.put(scope, current);
      assert previous == null : "Duplicate scope " + scope;
      current = scope;
    }

    private void visit(SyntaxElement element, boolean terminating) {
      Scope saved = current;
      if (terminating) {
        enter(Scope.destruction(element));
      }
      enter(Scope.node(element));
      if (element instanceof Block) {
        visitBlockChildren((Block) element);
      } else {
        element.forEachChild(child -> visit(child, isTerminating(element, child)));
      }
      current = saved;
    }

    private void visitBlockChildren(Block block) {
      List<Stmt> stmts = block.getStmts();
      for (int i = 0; i < stmts.size(); i++) {
        Stmt stmt = stmts.get(i);
        if (stmt instanceof LetDecl) {
          // Bindings introduced by the let are live until the end of the block.
          enter(Scope.remainder(block, i));
        }
        visit(stmt, true);
      }
      if (block.hasTailExpr()) {
        visit(block.getTailExpr(), false);
      }
    }

    private static boolean isTerminating(SyntaxElement parent, SyntaxElement child) {
      if (parent instanceof Stmt || child instanceof Pat) {
        return false;
      }
      if (parent instanceof IfExpr) {
        return child != ((IfExpr) parent).getCondition().getExpr();
      }
      if (parent instanceof WhileExpr) {
        return true;
      }
      if (parent instanceof LooplikeExpr) {
        return child == ((LooplikeExpr) parent).getBody();
      }
      if (parent instanceof MatchExpr) {
        return child instanceof MatchArmGuard
            || (child instanceof Expr && child != ((MatchExpr) parent).getDiscriminant());
      }
      if (parent instanceof BinaryExpr) {
        BinaryExpr binary = (BinaryExpr) parent;
        return binary.isLazy() && child == binary.getRight();
      }
      return parent instanceof LambdaExpr;
    }
  }
}
