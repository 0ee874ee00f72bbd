// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.android.tools.rscfg.utils;

import java.io.PrintStream;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

public class TimingImpl extends Timing {

  private final Node top;
  private final Deque<Node> stack;
  private final PrintStream out;
  private final long minimumReportNanos;

  TimingImpl(String title, AnalysisOptions options) {
    this.out = options.timingOutput;
    this.minimumReportNanos = options.printTimesMinimumMicros * 1_000L;
    stack = new ArrayDeque<>();
    top = new Node(title);
    stack.push(top);
  }

  class Node {
    final String title;

    final Map<String, Node> children = new LinkedHashMap<>();
    long duration = 0;
    long startTime;
    int count = 1;

    Node(String title) {
      this.title = title;
      this.startTime = System.nanoTime();
    }

    void restart() {
      assert startTime == -1;
      startTime = System.nanoTime();
      count++;
    }

    void end() {
      duration += System.nanoTime() - startTime;
      startTime = -1;
      assert duration >= 0;
    }

    @Override
    public String toString() {
      String result = title + ": " + prettyTime(duration);
      return count > 1 ? result + " (" + count + " times)" : result;
    }

    String toString(Node top) {
      if (this == top) {
        return toString();
      }
      return "(" + prettyPercentage(duration, top.duration) + ") " + toString();
    }

    void report(int depth, Node top) {
      if (duration < minimumReportNanos) {
        return;
      }
      printPrefix(depth);
      out.println(toString(top));
      if (children.isEmpty()) {
        return;
      }
      Collection<Node> childNodes = children.values();
      long childTime = 0;
      for (Node childNode : childNodes) {
        childTime += childNode.duration;
      }
      if (childTime < duration) {
        long unaccounted = duration - childTime;
        if (unaccounted >= minimumReportNanos) {
          printPrefix(depth + 1);
          out.println(
              "("
                  + prettyPercentage(unaccounted, top.duration)
                  + ") Unaccounted: "
                  + prettyTime(unaccounted));
        }
      }
      childNodes.forEach(p -> p.report(depth + 1, top));
    }

    void printPrefix(int depth) {
      if (depth > 0) {
        out.print("  ".repeat(depth));
        out.print("- ");
      }
    }
  }

  private static String prettyPercentage(long part, long total) {
    return (total == 0 ? 100 : part * 100 / total) + "%";
  }

  private static String prettyTime(long value) {
    long micros = value / 1_000;
    if (micros < 1_000) {
      return micros + "us";
    }
    return (micros / 1_000) + "ms";
  }

  @Override
  public Timing begin(String title) {
    Node parent = stack.peek();
    Node child = parent.children.get(title);
    if (child != null) {
      child.restart();
    } else {
      child = new Node(title);
      parent.children.put(title, child);
    }
    stack.push(child);
    return this;
  }

  @Override
  public <E extends Exception> void time(String title, ThrowingAction<E> action) throws E {
    begin(title);
    try {
      action.execute();
    } finally {
      end();
    }
  }

  @Override
  public <T, E extends Exception> T time(String title, ThrowingSupplier<T, E> supplier) throws E {
    begin(title);
    try {
      return supplier.get();
    } finally {
      end();
    }
  }

  @Override
  public Timing end() {
    stack.peek().end(); // record time.
    stack.pop();
    return this;
  }

  @Override
  public void report() {
    assert stack.size() == 1 : "Unexpected non-singleton stack: " + stack;
    Node top = stack.peek();
    assert top == this.top;
    top.end();
    out.println("Recorded timings:");
    top.report(0, top);
  }
}
