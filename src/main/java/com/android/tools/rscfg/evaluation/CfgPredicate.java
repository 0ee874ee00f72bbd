// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.evaluation;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** A conditional compilation predicate, e.g. {@code all(unix, not(target_os = "macos"))}. */
public abstract class CfgPredicate {

  CfgPredicate() {}

  /**
   * Combines the predicates of a sequence of {@code cfg} attributes.
   *
   * <p>The predicate of an attribute is the first item of its argument list ({@code unix} in
   * {@code #[cfg(unix)]}); attributes without arguments are ignored. A single predicate is
   * returned as is, any other number of predicates is combined with {@code all}.
   */
  public static CfgPredicate fromCfgAttributes(List<MetaItem> cfgAttributes) {
    List<CfgPredicate> predicates = new ArrayList<>();
    for (MetaItem attribute : cfgAttributes) {
      if (attribute.hasArgs() && !attribute.getArgs().isEmpty()) {
        predicates.add(fromMetaItem(attribute.getArgs().get(0)));
      }
    }
    return predicates.size() == 1 ? predicates.get(0) : new All(predicates);
  }

  public static CfgPredicate fromMetaItem(MetaItem metaItem) {
    String name = metaItem.getName();
    if (metaItem.hasArgs()) {
      List<CfgPredicate> predicates = new ArrayList<>();
      for (MetaItem arg : metaItem.getArgs()) {
        predicates.add(fromMetaItem(arg));
      }
      if (name == null) {
        return Error.INSTANCE;
      }
      switch (name) {
        case "all":
          return new All(predicates);
        case "any":
          return new Any(predicates);
        case "not":
          return predicates.size() == 1 ? new Not(predicates.get(0)) : Error.INSTANCE;
        default:
          return Error.INSTANCE;
      }
    }
    if (name != null && metaItem.getValue() != null) {
      return new NameValueOption(name, metaItem.getValue());
    }
    if (name != null) {
      return new NameOption(name);
    }
    return Error.INSTANCE;
  }

  public boolean isAll() {
    return false;
  }

  public All asAll() {
    return null;
  }

  public boolean isAny() {
    return false;
  }

  public Any asAny() {
    return null;
  }

  public boolean isNot() {
    return false;
  }

  public Not asNot() {
    return null;
  }

  public boolean isNameOption() {
    return false;
  }

  public NameOption asNameOption() {
    return null;
  }

  public boolean isNameValueOption() {
    return false;
  }

  public NameValueOption asNameValueOption() {
    return null;
  }

  public boolean isError() {
    return false;
  }

  public static final class All extends CfgPredicate {

    private final List<CfgPredicate> predicates;

    public All(List<CfgPredicate> predicates) {
      this.predicates = ImmutableList.copyOf(predicates);
    }

    public List<CfgPredicate> getPredicates() {
      return predicates;
    }

    @Override
    public boolean isAll() {
      return true;
    }

    @Override
    public All asAll() {
      return this;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof All && predicates.equals(((All) other).predicates);
    }

    @Override
    public int hashCode() {
      return Objects.hash("all", predicates);
    }

    @Override
    public String toString() {
      return "all(" + Joiner.on(", ").join(predicates) + ")";
    }
  }

  public static final class Any extends CfgPredicate {

    private final List<CfgPredicate> predicates;

    public Any(List<CfgPredicate> predicates) {
      this.predicates = ImmutableList.copyOf(predicates);
    }

    public List<CfgPredicate> getPredicates() {
      return predicates;
    }

    @Override
    public boolean isAny() {
      return true;
    }

    @Override
    public Any asAny() {
      return this;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Any && predicates.equals(((Any) other).predicates);
    }

    @Override
    public int hashCode() {
      return Objects.hash("any", predicates);
    }

    @Override
    public String toString() {
      return "any(" + Joiner.on(", ").join(predicates) + ")";
    }
  }

  public static final class Not extends CfgPredicate {

    private final CfgPredicate single;

    public Not(CfgPredicate single) {
      this.single = single;
    }

    public CfgPredicate getSingle() {
      return single;
    }

    @Override
    public boolean isNot() {
      return true;
    }

    @Override
    public Not asNot() {
      return this;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Not && single.equals(((Not) other).single);
    }

    @Override
    public int hashCode() {
      return Objects.hash("not", single);
    }

    @Override
    public String toString() {
      return "not(" + single + ")";
    }
  }

  public static final class NameOption extends CfgPredicate {

    private final String name;

    public NameOption(String name) {
      this.name = name;
    }

    public String getName() {
      return name;
    }

    @Override
    public boolean isNameOption() {
      return true;
    }

    @Override
    public NameOption asNameOption() {
      return this;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof NameOption && name.equals(((NameOption) other).name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public String toString() {
      return name;
    }
  }

  public static final class NameValueOption extends CfgPredicate {

    private final String name;
    private final String value;

    public NameValueOption(String name, String value) {
      this.name = name;
      this.value = value;
    }

    public String getName() {
      return name;
    }

    public String getValue() {
      return value;
    }

    @Override
    public boolean isNameValueOption() {
      return true;
    }

    @Override
    public NameValueOption asNameValueOption() {
      return this;
    }

    @Override
    public boolean equals(Object other) {
      if (!(other instanceof NameValueOption)) {
        return false;
      }
      NameValueOption option = (NameValueOption) other;
      return name.equals(option.name) && value.equals(option.value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, value);
    }

    @Override
    public String toString() {
      return name + " = \"" + value + "\"";
    }
  }

  /** A malformed predicate. It evaluates to unknown. */
  public static final class Error extends CfgPredicate {

    static final Error INSTANCE = new Error();

    private Error() {}

    public static Error getInstance() {
      return INSTANCE;
    }

    @Override
    public boolean isError() {
      return true;
    }

    @Override
    public String toString() {
      return "<error>";
    }
  }
}
