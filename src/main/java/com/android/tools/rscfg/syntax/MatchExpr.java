// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.syntax;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Consumer;

public class MatchExpr extends Expr {

  private final Expr discriminant;
  private final List<MatchArm> arms;

  public MatchExpr(SourceRange range, Expr discriminant, List<MatchArm> arms) {
    super(range);
    this.discriminant = discriminant;
    this.arms = ImmutableList.copyOf(arms);
  }

  public Expr getDiscriminant() {
    return discriminant;
  }

  public List<MatchArm> getArms() {
    return arms;
  }

  @Override
  public boolean isBlockLike() {
    return true;
  }

  @Override
  public String getPresentableText() {
    return "MATCH";
  }

  @Override
  public <R, P> R accept(SyntaxVisitor<R, P> visitor, P parameter) {
    return visitor.visitMatchExpr(this, parameter);
  }

  @Override
  public void forEachChild(Consumer<? super SyntaxElement> consumer) {
    consumer.accept(discriminant);
    for (MatchArm arm : arms) {
      arm.getPats().forEach(consumer);
      acceptIfNotNull(arm.getGuard(), consumer);
      consumer.accept(arm.getBody());
    }
  }
}
