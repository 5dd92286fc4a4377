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
 * Body of a struct declaration: the members in declaration order
 */
public class FieldList extends Node {
  public static final String TYPE_NAME = "FieldList";

  private final List<Field> fields;

  public FieldList(List<Field> fields, int start, int end,
                   FilePosition position) {
    super(NodeKind.FIELD_LIST, start, end, position);
    if (fields == null) {
      throw new IllegalArgumentException("Field list must not be null");
    }
    this.fields = Collections.unmodifiableList(new ArrayList<Field>(fields));
  }

  public static FieldList fromAST(ParsedUnit unit, AccelAST tree) {
    if (tree.getType() != AccelScriptParser.FIELD_LIST) {
      throw new UnsupportedConstructException(tree.getType(),
                                  LogHelper.tokName(tree.getType()));
    }
    List<Field> fields = new ArrayList<Field>(tree.getChildCount());
    for (AccelAST fieldT: tree.children()) {
      assert(fieldT.getType() == AccelScriptParser.FIELD);
      assert(fieldT.getChildCount() == 2);
      fields.add(new Field(fieldT.child(0).getText(),
                           unit.text(fieldT.child(1))));
    }
    return new FieldList(fields, unit.startOffset(tree),
                         unit.stopOffset(tree), unit.position(tree));
  }

  @Override
  public String typeName() {
    return TYPE_NAME;
  }

  public List<Field> getFields() {
    return fields;
  }

  @Override
  public int hashCode() {
    return 31 * super.hashCode() + fields.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (!super.equals(obj))
      return false;
    return fields.equals(((FieldList) obj).fields);
  }

  /**
   * A struct member.  The type is the annotation's source text.
   */
  public static class Field {
    public final String name;
    public final String type;

    public Field(String name, String type) {
      if (StringUtils.isEmpty(name) || StringUtils.isEmpty(type)) {
        throw new IllegalArgumentException("Field needs name and type: "
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
      if (!(obj instanceof Field))
        return false;
      Field other = (Field) obj;
      return name.equals(other.name) && type.equals(other.type);
    }

    @Override
    public String toString() {
      return name + ": " + type;
    }
  }
}
