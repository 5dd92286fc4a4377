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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Multimaps;

import accel.asc.ast.FilePosition;

/**
 * All top level declarations of a compilation unit, in source order
 */
public class Program extends Node {
  public static final String TYPE_NAME = "Program";

  private final List<Node> declarations;

  public Program(List<Node> declarations, int start, int end,
                 FilePosition position) {
    super(NodeKind.PROGRAM, start, end, position);
    if (declarations == null) {
      throw new IllegalArgumentException("Declarations must not be null");
    }
    for (Node decl: declarations) {
      if (!decl.getKind().isDeclaration()) {
        throw new IllegalArgumentException(decl.typeName() +
                                     " is not a top level declaration");
      }
    }
    this.declarations = Collections.unmodifiableList(
                                      new ArrayList<Node>(declarations));
  }

  @Override
  public String typeName() {
    return TYPE_NAME;
  }

  public List<Node> getDeclarations() {
    return declarations;
  }

  /**
   * Group declarations by kind, keeping source order within each kind.
   * Lets later passes handle all structs before any shader.
   */
  public ListMultimap<NodeKind, Node> declarationsByKind() {
    ListMultimap<NodeKind, Node> result = ArrayListMultimap.create();
    for (Node decl: declarations) {
      result.put(decl.getKind(), decl);
    }
    return Multimaps.unmodifiableListMultimap(result);
  }

  /**
   * @return first struct declared with the name, or null if none
   */
  public StructDeclaration lookupStruct(String name) {
    for (Node decl: declarations) {
      StructDeclaration struct = decl.as(StructDeclaration.class);
      if (struct != null && struct.getName().equals(name)) {
        return struct;
      }
    }
    return null;
  }

  @Override
  public int hashCode() {
    return 31 * super.hashCode() + declarations.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (!super.equals(obj))
      return false;
    return declarations.equals(((Program) obj).declarations);
  }
}
