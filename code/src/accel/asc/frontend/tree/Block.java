package accel.asc.frontend.tree;

import accel.asc.ast.AccelAST;
import accel.asc.ast.FilePosition;
import accel.asc.ast.antlr.AccelScriptParser;
import accel.asc.common.exceptions.UnsupportedConstructException;
import accel.asc.frontend.LogHelper;
import accel.asc.frontend.ParsedUnit;

/**
 * Statement block of a shader.  Only the span is recorded; statements
 * are left to later stages.
 */
public class Block extends Node {
  public static final String TYPE_NAME = "BlockStatement";

  public Block(int start, int end, FilePosition position) {
    super(NodeKind.BLOCK, start, end, position);
  }

  public static Block fromAST(ParsedUnit unit, AccelAST tree) {
    if (tree.getType() != AccelScriptParser.BLOCK) {
      throw new UnsupportedConstructException(tree.getType(),
                                  LogHelper.tokName(tree.getType()));
    }
    return new Block(unit.startOffset(tree), unit.stopOffset(tree),
                     unit.position(tree));
  }

  @Override
  public String typeName() {
    return TYPE_NAME;
  }
}
