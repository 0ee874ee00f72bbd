// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.evaluation;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * An attribute meta item: {@code name}, {@code name = "value"} or {@code name(item, ...)}.
 *
 * <p>Literal items such as the {@code "a"} in {@code foo("a")} have neither a name nor arguments.
 */
public final class MetaItem {

  private final String name;
  private final String value;
  private final List<MetaItem> args;

  private MetaItem(String name, String value, List<MetaItem> args) {
    this.name = name;
    this.value = value;
    this.args = args;
  }

  public static MetaItem word(String name) {
    return new MetaItem(name, null, null);
  }

  public static MetaItem nameValue(String name, String value) {
    return new MetaItem(name, value, null);
  }

  public static MetaItem list(String name, List<MetaItem> args) {
    return new MetaItem(name, null, ImmutableList.copyOf(args));
  }

  public static MetaItem list(String name, MetaItem... args) {
    return list(name, ImmutableList.copyOf(args));
  }

  public static MetaItem literal(String value) {
    return new MetaItem(null, value, null);
  }

  /** The path of the item, or {@code null} for a literal. */
  public String getName() {
    return name;
  }

  /** The value of a string literal, or {@code null} if there is none. */
  public String getValue() {
    return value;
  }

  /** The parenthesized arguments, or {@code null} if the item has no argument list. */
  public List<MetaItem> getArgs() {
    return args;
  }

  public boolean hasArgs() {
    return args != null;
  }

  @Override
  public String toString() {
    if (name == null) {
      return value == null ? "<literal>" : "\"" + value + "\"";
    }
    if (args != null) {
      return name + "(" + Joiner.on(", ").join(args) + ")";
    }
    return value != null ? name + " = \"" + value + "\"" : name;
  }
}
