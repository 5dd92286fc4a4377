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

import org.apache.commons.lang3.StringUtils;

import accel.asc.ast.AccelAST;
import accel.asc.ast.FilePosition;
import accel.asc.ast.antlr.AccelScriptParser;
import accel.asc.common.exceptions.UnsupportedConstructException;
import accel.asc.frontend.LogHelper;
import accel.asc.frontend.ParsedUnit;

/**
 * A shader entry point, e.g.
 * <pre>
 *   vertex Main(v: Vertex, u: Uniforms) -> VertexOutput { ... }
 * </pre>
 * Parameter and return types are kept as their source text; they are
 * resolved by the type checker.
 */
public class ShaderDeclaration extends Node {
  public static final String TYPE_NAME_SUFFIX = "ShaderDeclaration";

  private final ShaderStage stage;
  private final String id;
  private final List<Param> params;
  /** Return type text, null if none declared */
  private final String returnType;
  /** Statement block, or null if not attached */
  private final Block body;

  public ShaderDeclaration(ShaderStage stage, String id, List<Param> params,
                           String returnType, Block body,
                           int start, int end, FilePosition position) {
    super(NodeKind.SHADER_DECLARATION, start, end, position);
    if (stage == null) {
      throw new IllegalArgumentException("Shader stage must be given");
    }
    if (StringUtils.isEmpty(id)) {
      throw new IllegalArgumentException("Shader name must be non-empty");
    }
    if (params == null) {
      throw new IllegalArgumentException("Parameter list must not be null");
    }
    if (returnType != null && returnType.isEmpty()) {
      throw new IllegalArgumentException("Return type of " + id +
                                         " must be absent or non-empty");
    }
    this.stage = stage;
    this.id = id;
    this.params = Collections.unmodifiableList(new ArrayList<Param>(params));
    this.returnType = returnType;
    this.body = body;
  }

  /**
   * Build from a SHADER_DECLARATION subtree
   * @param unit parsed unit the tree belongs to
   * @param tree
   * @return
   */
  public static ShaderDeclaration fromAST(ParsedUnit unit, AccelAST tree) {
    assert(tree.getType() == AccelScriptParser.SHADER_DECLARATION);
    assert(tree.getChildCount() >= 2);
    ShaderStage stage = extractStage(tree.child(0));
    String id = tree.child(1).getText();

    List<Param> params = new ArrayList<Param>();
    String returnType = null;
    Block body = null;
    for (AccelAST subtree: tree.children(2)) {
      switch (subtree.getType()) {
        case AccelScriptParser.PARAMETER_LIST:
          params.addAll(extractParams(unit, subtree));
          break;
        case AccelScriptParser.RETURN_TYPE:
          assert(subtree.getChildCount() == 1);
          returnType = unit.text(subtree.child(0));
          break;
        case AccelScriptParser.BLOCK:
          body = Block.fromAST(unit, subtree);
          break;
        default:
          throw new UnsupportedConstructException(subtree.getType(),
                                  LogHelper.tokName(subtree.getType()));
      }
    }

    return new ShaderDeclaration(stage, id, params, returnType, body,
          unit.startOffset(tree), unit.stopOffset(tree), unit.position(tree));
  }

  private static ShaderStage extractStage(AccelAST stageT) {
    switch (stageT.getType()) {
      case AccelScriptParser.COMPUTE:
        return ShaderStage.COMPUTE;
      case AccelScriptParser.VERTEX:
        return ShaderStage.VERTEX;
      case AccelScriptParser.FRAGMENT:
        return ShaderStage.FRAGMENT;
      default:
        throw new UnsupportedConstructException(stageT.getType(),
                                  LogHelper.tokName(stageT.getType()));
    }
  }

  private static List<Param> extractParams(ParsedUnit unit,
                                           AccelAST paramListT) {
    List<Param> params = new ArrayList<Param>(paramListT.getChildCount());
    for (AccelAST paramT: paramListT.children()) {
      assert(paramT.getType() == AccelScriptParser.PARAMETER);
      assert(paramT.getChildCount() == 2);
      AccelAST typeT = paramT.child(1);
      assert(typeT.getType() == AccelScriptParser.TYPE_SPECIFIER);
      params.add(new Param(paramT.child(0).getText(), unit.text(typeT)));
    }
    return params;
  }

  /**
   * @return stage keyword followed by ShaderDeclaration,
   *         e.g. computeShaderDeclaration
   */
  @Override
  public String typeName() {
    return stage.keyword() + TYPE_NAME_SUFFIX;
  }

  public ShaderStage getStage() {
    return stage;
  }

  public String getId() {
    return id;
  }

  /**
   * @return parameters in declaration order, empty if none
   */
  public List<Param> getParams() {
    return params;
  }

  public boolean hasReturnType() {
    return returnType != null;
  }

  /**
   * @return return type text, or null if the shader declares none
   */
  public String getReturnType() {
    return returnType;
  }

  public Block getBody() {
    return body;
  }

  @Override
  public int hashCode() {
    int result = super.hashCode();
    result = 31 * result + stage.hashCode();
    result = 31 * result + id.hashCode();
    result = 31 * result + params.hashCode();
    result = 31 * result + hashOrZero(returnType);
    result = 31 * result + hashOrZero(body);
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (!super.equals(obj))
      return false;
    ShaderDeclaration other = (ShaderDeclaration) obj;
    return stage == other.stage && id.equals(other.id) &&
           params.equals(other.params) &&
           equalOrBothNull(returnType, other.returnType) &&
           equalOrBothNull(body, other.body);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(stage.keyword()).append(' ').append(id).append('(');
    for (int i = 0; i < params.size(); i++) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(params.get(i));
    }
    sb.append(')');
    if (returnType != null) {
      sb.append(" -> ").append(returnType);
    }
    sb.append(' ').append(super.toString());
    return sb.toString();
  }

  /**
   * A formal parameter.  The type is the annotation's source text,
   * e.g. Buffer&lt;f32&gt;.
   */
  public static class Param {
    public final String name;
    public final String type;

    public Param(String name, String type) {
      if (StringUtils.isEmpty(name) || StringUtils.isEmpty(type)) {
        throw new IllegalArgumentException("Parameter needs name and type: "
                                           + name + ": " + type);
      }
      this.name = name;
      this.type = type;
    }

    @Override
    public int hashCode() {
      return 31 * name.hashCode() + type.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj)
        return true;
      if (!(obj instanceof Param))
        return false;
      Param other = (Param) obj;
      return name.equals(other.name) && type.equals(other.type);
    }

    @Override
    public String toString() {
      return name + ": " + type;
    }
  }
}
