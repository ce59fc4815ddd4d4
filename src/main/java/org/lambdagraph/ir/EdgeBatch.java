/*
 * Copyright 2025 The Retrospect Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.lambdagraph.ir;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.common.flogger.FluentLogger;
import java.util.ArrayList;
import java.util.List;

/**
 * An ordered list of link and unlink operations, computed from the current state of the graph
 * before any of them is applied. Each of {@link IrNode}'s mutating methods builds one of these and
 * then commits it.
 *
 * <p>Committing is not transactional: if an operation fails its consistency check, the operations
 * before it remain applied. Such a failure means the caller has a bug, and the graph should not be
 * used further.
 */
final class EdgeBatch {

  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  enum Kind {
    LINK,
    UNLINK
  }

  /**
   * Adds ({@link Kind#LINK}) or removes ({@link Kind#UNLINK}) the edge {@code from --role--> to}.
   */
  record Op(Kind kind, IrNode from, IrNode to, Role role) {
    @Override
    public String toString() {
      return String.format("%s %s --%s--> %s", kind, from, role, to);
    }
  }

  private final List<Op> ops = new ArrayList<>();

  @CanIgnoreReturnValue
  EdgeBatch link(IrNode from, IrNode to, Role role) {
    ops.add(new Op(Kind.LINK, from, to, role));
    return this;
  }

  @CanIgnoreReturnValue
  EdgeBatch unlink(IrNode from, IrNode to, Role role) {
    ops.add(new Op(Kind.UNLINK, from, to, role));
    return this;
  }

  /** Appends all of {@code other}'s operations, after this batch's. */
  @CanIgnoreReturnValue
  EdgeBatch addAll(EdgeBatch other) {
    ops.addAll(other.ops);
    return this;
  }

  boolean isEmpty() {
    return ops.isEmpty();
  }

  ImmutableList<Op> ops() {
    return ImmutableList.copyOf(ops);
  }

  /** Applies each operation, in order. */
  void commit() {
    for (Op op : ops) {
      logger.atFinest().log("%s", op);
      switch (op.kind) {
        case LINK -> op.from.addEdge(op.role, op.to);
        case UNLINK -> op.from.removeEdge(op.role, op.to);
      }
    }
  }

  @Override
  public String toString() {
    return ops.toString();
  }
}
