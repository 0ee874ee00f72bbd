// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.evaluation;

import com.android.tools.rscfg.errors.SyntaxError;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import java.util.List;

/**
 * The configuration options of a target, e.g. {@code unix} and {@code target_os = "linux"}.
 *
 * <p>Options built by hand only define the names and keys they mention, so the evaluator treats
 * everything else as unknown. Options parsed from the output of {@code rustc --print cfg} are
 * complete: an option that is not listed is disabled.
 */
public class CfgOptions {

  public static final String TEST = "test";

  private static final CfgOptions EMPTY = builder().build();

  private final ImmutableSet<String> enabledNames;
  private final ImmutableSet<String> disabledNames;
  private final ImmutableSetMultimap<String, String> nameValues;
  private final ImmutableSet<String> definedKeys;
  private final boolean complete;

  private CfgOptions(Builder builder) {
    this.enabledNames = builder.enabledNames.build();
    this.disabledNames = builder.disabledNames.build();
    this.nameValues = builder.nameValues.build();
    this.definedKeys =
        ImmutableSet.<String>builder()
            .addAll(builder.definedKeys.build())
            .addAll(nameValues.keySet())
            .build();
    this.complete = builder.complete;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static CfgOptions empty() {
    return EMPTY;
  }

  /** Parses the output of {@code rustc --print cfg}, one option per line. */
  public static CfgOptions parse(String output) {
    return parse(Splitter.on('\n').trimResults().omitEmptyStrings().splitToList(output));
  }

  public static CfgOptions parse(List<String> lines) {
    Builder builder = builder().setComplete(true);
    for (String line : lines) {
      MetaItem item = MetaItemParser.parse(line);
      if (item.getName() == null || item.hasArgs()) {
        throw new SyntaxError("Unexpected cfg option " + line, 0);
      }
      if (item.getValue() != null) {
        builder.addNameValue(item.getName(), item.getValue());
      } else {
        builder.enable(item.getName());
      }
    }
    return builder.build();
  }

  public boolean isNameEnabled(String name) {
    return enabledNames.contains(name);
  }

  public boolean isNameValueEnabled(String name, String value) {
    return nameValues.containsEntry(name, value);
  }

  /** Returns true if it is known whether {@code name} is enabled. */
  public boolean isNameDefined(String name) {
    return complete || enabledNames.contains(name) || disabledNames.contains(name);
  }

  /** Returns true if it is known which values {@code name} has. */
  public boolean isNameValueDefined(String name) {
    return complete || definedKeys.contains(name);
  }

  public boolean isComplete() {
    return complete;
  }

  public ImmutableSetMultimap<String, String> getNameValues() {
    return nameValues;
  }

  public ImmutableSet<String> getEnabledNames() {
    return enabledNames;
  }

  public static class Builder {

    private final ImmutableSet.Builder<String> enabledNames = ImmutableSet.builder();
    private final ImmutableSet.Builder<String> disabledNames = ImmutableSet.builder();
    private final ImmutableSetMultimap.Builder<String, String> nameValues =
        ImmutableSetMultimap.builder();
    private final ImmutableSet.Builder<String> definedKeys = ImmutableSet.builder();
    private boolean complete = false;

    private Builder() {}

    public Builder enable(String name) {
      enabledNames.add(name);
      return this;
    }

    public Builder disable(String name) {
      disabledNames.add(name);
      return this;
    }

    public Builder setEnabled(String name, boolean enabled) {
      return enabled ? enable(name) : disable(name);
    }

    public Builder addNameValue(String name, String value) {
      nameValues.put(name, value);
      return this;
    }

    /** Defines {@code name} without giving it a value, so that every value is disabled. */
    public Builder defineKey(String name) {
      definedKeys.add(name);
      return this;
    }

    public Builder setComplete(boolean complete) {
      this.complete = complete;
      return this;
    }

    public CfgOptions build() {
      return new CfgOptions(this);
    }
  }
}
