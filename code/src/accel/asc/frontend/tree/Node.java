/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package accel.asc.frontend.tree;

import accel.asc.ast.FilePosition;

/**
 * Base class of all AccelScript AST nodes.
 *
 * Nodes are immutable and form a strict tree: each child is owned by
 * exactly one parent.  Equality is structural, so building the same
 * source twice gives equal trees.
 */
public abstract class Node {
  private final NodeKind kind;
  private final int start;
  private final int end;
  private final FilePosition position;

  /**
   * Offsets are indices of Java chars (UTF-16 code units) in the source
   * string, not byte offsets.  They differ from byte offsets once the
   * source contains non-ASCII characters.
   * @param start offset of first character of construct in source
   * @param end offset of last character of construct in source (inclusive)
   * @param position line information for diagnostics
   */
  protected Node(NodeKind kind, int start, int end, FilePosition position) {
    if (kind == null) {
      throw new IllegalArgumentException("Node kind must be given");
    }
    if (start < 0 || end < start) {
      throw new IllegalArgumentException("Invalid source span [" + start +
                                         ", " + end + "] for " + kind);
    }
    this.kind = kind;
    this.start = start;
    this.end = end;
    this.position = position;
  }

  public NodeKind getKind() {
    return kind;
  }

  /**
   * Display name of the node type, e.g. StructDeclaration or
   * computeShaderDeclaration.  For messages only: compare
   * {@link #getKind()} instead.
   */
  public abstract String typeName();

  /** @return char offset of the first character, see constructor */
  public int getStart() {
    return start;
  }

  public int getEnd() {
    return end;
  }

  public FilePosition getPosition() {
    return position;
  }

  /**
   * View this node as a particular variant.
   * @return this node, or null if it is not an instance of variant
   */
  public <T extends Node> T as(Class<T> variant) {
    if (variant.isInstance(this)) {
      return variant.cast(this);
    }
    return null;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = kind.hashCode();
    result = prime * result + start;
    result = prime * result + end;
    result = prime * result + ((position == null) ? 0 : position.hashCode());
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    Node other = (Node) obj;
    if (kind != other.kind || start != other.start || end != other.end)
      return false;
    if (position == null) {
      return other.position == null;
    }
    return position.equals(other.position);
  }

  @Override
  public String toString() {
    return typeName() + "[" + start + ", " + end + "]";
  }

  static boolean equalOrBothNull(Object a, Object b) {
    if (a == null) {
      return b == null;
    }
    return a.equals(b);
  }

  static int hashOrZero(Object o) {
    return (o == null) ? 0 : o.hashCode();
  }
}
