package accel.asc.frontend.tree;

/**
 * Discriminant for the node variants.  Dispatch on this, never on
 * {@link Node#typeName()}.
 */
public enum NodeKind {
  PROGRAM,
  STRUCT_DECLARATION,
  SHADER_DECLARATION,
  FIELD_LIST,
  BLOCK;

  /**
   * @return true for kinds that may appear at top level of a program
   */
  public boolean isDeclaration() {
    return this == STRUCT_DECLARATION || this == SHADER_DECLARATION;
  }
}
