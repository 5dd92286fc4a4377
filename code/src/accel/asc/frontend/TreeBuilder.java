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
package accel.asc.frontend;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import accel.asc.ast.AccelAST;
import accel.asc.ast.FilePosition;
import accel.asc.ast.antlr.AccelScriptParser;
import accel.asc.common.Logging;
import accel.asc.common.Settings;
import accel.asc.common.exceptions.ASCRuntimeError;
import accel.asc.common.exceptions.InvalidOptionException;
import accel.asc.common.exceptions.UnsupportedConstructException;
import accel.asc.frontend.tree.Node;
import accel.asc.frontend.tree.Program;
import accel.asc.frontend.tree.ShaderDeclaration;
import accel.asc.frontend.tree.StructDeclaration;
import accel.asc.frontend.tree.TopLevel;

/**
 * Walks the syntax tree of a parsed unit and builds the typed AST.
 *
 * Holds no state between calls, so one builder can be shared, including
 * across threads.
 */
public class TreeBuilder {

  private final Logger logger;

  public TreeBuilder(Logger logger) {
    super();
    this.logger = logger;
  }

  public TreeBuilder() {
    this(Logging.getASCLogger());
  }

  /**
   * Build the AST for a compilation unit.
   *
   * A program with exactly one declaration is represented by that
   * declaration's node.  Otherwise a {@link Program} is returned.
   * @param unit
   * @return root of the AST
   * @throws UnsupportedConstructException if the tree contains a
   *        production with no corresponding node type
   */
  public Node build(ParsedUnit unit) {
    AccelAST tree = unit.ast;
    logTree(tree);
    Node result;
    switch (tree.getType()) {
      case AccelScriptParser.PROGRAM: {
        Program program = walkProgram(unit, tree);
        if (program.getDeclarations().size() == 1) {
          result = program.getDeclarations().get(0);
        } else {
          result = program;
        }
        break;
      }
      case AccelScriptParser.STRUCT_DECLARATION:
      case AccelScriptParser.SHADER_DECLARATION:
        result = walkDeclaration(unit, tree, 0);
        break;
      default:
        throw unsupported(tree);
    }
    logger.debug("Built " + result.typeName() + " from " + unit.fileName);
    return result;
  }

  /**
   * Build a Program node regardless of the number of declarations
   * @param unit
   * @return
   * @throws UnsupportedConstructException if the tree is not a program
   *        or contains unknown productions
   */
  public Program buildProgram(ParsedUnit unit) {
    AccelAST tree = unit.ast;
    if (tree.getType() != AccelScriptParser.PROGRAM) {
      throw unsupported(tree);
    }
    logTree(tree);
    Program program = walkProgram(unit, tree);
    logger.debug("Built program with " + program.getDeclarations().size()
                 + " declarations from " + unit.fileName);
    return program;
  }

  private Program walkProgram(ParsedUnit unit, AccelAST tree) {
    LogHelper.trace(logger, 0, "program " + unit.fileName);
    List<Node> decls = new ArrayList<Node>(tree.getChildCount());
    for (AccelAST declT: tree.children()) {
      decls.add(walkDeclaration(unit, declT, 2));
    }

    int start, end;
    FilePosition position;
    if (decls.isEmpty()) {
      start = 0;
      end = 0;
      position = new FilePosition(unit.fileName, 1, 0);
    } else {
      Node first = decls.get(0);
      start = first.getStart();
      end = decls.get(decls.size() - 1).getEnd();
      position = first.getPosition();
    }
    return new Program(decls, start, end, position);
  }

  private Node walkDeclaration(ParsedUnit unit, AccelAST tree, int indent) {
    if (!TopLevel.isDeclaration(tree.getType())) {
      throw unsupported(tree);
    }

    Node decl;
    switch (tree.getType()) {
      case AccelScriptParser.STRUCT_DECLARATION:
        decl = StructDeclaration.fromAST(unit, tree);
        break;
      case AccelScriptParser.SHADER_DECLARATION:
        decl = ShaderDeclaration.fromAST(unit, tree);
        break;
      default:
        throw new ASCRuntimeError("Unexpected declaration token: " +
                                  LogHelper.tokName(tree.getType()));
    }
    LogHelper.trace(logger, indent, decl.toString());
    return decl;
  }

  private void logTree(AccelAST tree) {
    boolean printTree;
    try {
      printTree = Settings.getBoolean(Settings.PRINT_TREE);
    } catch (InvalidOptionException e) {
      throw new ASCRuntimeError(e.toString());
    }
    if (printTree) {
      logger.debug(tree.printTree());
    }
  }

  private static UnsupportedConstructException unsupported(AccelAST tree) {
    return new UnsupportedConstructException(tree.getType(),
                                   LogHelper.tokName(tree.getType()));
  }
}
