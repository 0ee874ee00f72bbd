// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.evaluation;

import com.android.tools.rscfg.errors.Unreachable;
import com.android.tools.rscfg.utils.AnalysisOptions;
import com.android.tools.rscfg.utils.AnalysisOptions.TestingOptions;
import com.android.tools.rscfg.utils.Timing;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Set;

/**
 * Evaluates {@code cfg} attributes against a set of {@link CfgOptions}.
 *
 * <p>The result is {@link ThreeValuedLogic#UNKNOWN} whenever the options do not decide the
 * predicate, for instance for options this evaluator does not model or for malformed predicates.
 * A definite answer is therefore always correct.
 *
 * <p>See https://doc.rust-lang.org/reference/conditional-compilation.html.
 */
public class CfgEvaluator {

  private static final Set<String> SUPPORTED_NAME_OPTIONS =
      ImmutableSet.of("debug_assertions", "unix", "windows");

  private static final Set<String> SUPPORTED_NAME_VALUE_OPTIONS =
      ImmutableSet.of(
          "target_arch",
          "target_endian",
          "target_env",
          "target_family",
          "target_feature",
          "target_os",
          "target_pointer_width",
          "target_vendor");

  private final CfgOptions cfgOptions;
  private final AnalysisOptions options;

  public CfgEvaluator(CfgOptions cfgOptions) {
    this(cfgOptions, new AnalysisOptions());
  }

  public CfgEvaluator(CfgOptions cfgOptions, AnalysisOptions options) {
    this.cfgOptions = cfgOptions;
    this.options = options;
  }

  public ThreeValuedLogic evaluate(List<MetaItem> cfgAttributes) {
    return evaluate(cfgAttributes, Timing.empty());
  }

  public ThreeValuedLogic evaluate(List<MetaItem> cfgAttributes, Timing timing) {
    timing.begin("Evaluate cfg attributes");
    CfgPredicate predicate = CfgPredicate.fromCfgAttributes(cfgAttributes);
    ThreeValuedLogic result = evaluatePredicate(predicate);
    TestingOptions testing = options.testing();
    switch (result) {
      case TRUE:
        testing.cfgEvaluatesTrue.hit();
        break;
      case FALSE:
        testing.cfgEvaluatesFalse.hit();
        break;
      case UNKNOWN:
        testing.cfgEvaluatesUnknown.hit();
        break;
      default:
        throw new Unreachable("Unexpected value " + result);
    }
    timing.end();
    return result;
  }

  public ThreeValuedLogic evaluatePredicate(CfgPredicate predicate) {
    if (predicate.isAll()) {
      ThreeValuedLogic result = ThreeValuedLogic.TRUE;
      for (CfgPredicate child : predicate.asAll().getPredicates()) {
        result = result.and(evaluatePredicate(child));
      }
      return result;
    }
    if (predicate.isAny()) {
      ThreeValuedLogic result = ThreeValuedLogic.FALSE;
      for (CfgPredicate child : predicate.asAny().getPredicates()) {
        result = result.or(evaluatePredicate(child));
      }
      return result;
    }
    if (predicate.isNot()) {
      return evaluatePredicate(predicate.asNot().getSingle()).not();
    }
    if (predicate.isNameOption()) {
      return evaluateName(predicate.asNameOption().getName());
    }
    if (predicate.isNameValueOption()) {
      CfgPredicate.NameValueOption option = predicate.asNameValueOption();
      return evaluateNameValue(option.getName(), option.getValue());
    }
    assert predicate.isError();
    return ThreeValuedLogic.UNKNOWN;
  }

  private ThreeValuedLogic evaluateName(String name) {
    boolean isSupported =
        SUPPORTED_NAME_OPTIONS.contains(name)
            || (name.equals(CfgOptions.TEST) && options.testing().evaluateTestCfgLiterally);
    if (!isSupported || !cfgOptions.isNameDefined(name)) {
      return ThreeValuedLogic.UNKNOWN;
    }
    return ThreeValuedLogic.fromBoolean(cfgOptions.isNameEnabled(name));
  }

  private ThreeValuedLogic evaluateNameValue(String name, String value) {
    if (!SUPPORTED_NAME_VALUE_OPTIONS.contains(name) || !cfgOptions.isNameValueDefined(name)) {
      return ThreeValuedLogic.UNKNOWN;
    }
    return ThreeValuedLogic.fromBoolean(cfgOptions.isNameValueEnabled(name, value));
  }
}
