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

import org.apache.commons.lang3.StringUtils;

import accel.asc.ast.AccelAST;
import accel.asc.ast.FilePosition;
import accel.asc.ast.antlr.AccelScriptParser;
import accel.asc.frontend.ParsedUnit;

/**
 * struct Name { field: type; ... }
 */
public class StructDeclaration extends Node {
  public static final String TYPE_NAME = "StructDeclaration";

  private final String name;
  /** Field list, or null if not attached */
  private final FieldList body;

  public StructDeclaration(String name, FieldList body, int start, int end,
                           FilePosition position) {
    super(NodeKind.STRUCT_DECLARATION, start, end, position);
    if (StringUtils.isEmpty(name)) {
      throw new IllegalArgumentException("Struct name must be non-empty");
    }
    this.name = name;
    this.body = body;
  }

  /**
   * Build from a STRUCT_DECLARATION subtree
   * @param unit parsed unit the tree belongs to
   * @param tree
   * @return
   */
  public static StructDeclaration fromAST(ParsedUnit unit, AccelAST tree) {
    assert(tree.getType() == AccelScriptParser.STRUCT_DECLARATION);
    assert(tree.getChildCount() >= 1 && tree.getChildCount() <= 2);
    String name = tree.child(0).getText();

    FieldList body = null;
    if (tree.getChildCount() == 2) {
      body = FieldList.fromAST(unit, tree.child(1));
    }
    return new StructDeclaration(name, body, unit.startOffset(tree),
                          unit.stopOffset(tree), unit.position(tree));
  }

  @Override
  public String typeName() {
    return TYPE_NAME;
  }

  public String getName() {
    return name;
  }

  public FieldList getBody() {
    return body;
  }

  @Override
  public int hashCode() {
    int result = super.hashCode();
    result = 31 * result + name.hashCode();
    result = 31 * result + hashOrZero(body);
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (!super.equals(obj))
      return false;
    StructDeclaration other = (StructDeclaration) obj;
    return name.equals(other.name) && equalOrBothNull(body, other.body);
  }

  @Override
  public String toString() {
    return "struct " + name + " " + super.toString();
  }
}
