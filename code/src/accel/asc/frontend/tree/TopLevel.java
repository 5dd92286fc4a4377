package accel.asc.frontend.tree;

import accel.asc.ast.antlr.AccelScriptParser;

/**
 * Helpers to classify top level AST elements
 */
public class TopLevel {

  /**
   * @param token
   * @return true if the token is the root of a top level declaration
   */
  public static boolean isDeclaration(int token) {
    switch (token) {
      case AccelScriptParser.STRUCT_DECLARATION:
      case AccelScriptParser.SHADER_DECLARATION:
        return true;
      default:
        return false;
    }
  }

}
