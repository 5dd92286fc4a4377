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
package accel.asc.ast;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Collections;
import java.util.List;

import org.antlr.runtime.Token;
import org.antlr.runtime.tree.CommonTree;
import org.antlr.runtime.tree.CommonTreeAdaptor;
import org.antlr.runtime.tree.Tree;

/**
 * Concrete syntax tree node produced by the AccelScript grammar.
 * Rule roots carry the indices of their first and last token in the
 * token stream, which is how source spans are recovered.
 */
public class AccelAST extends CommonTree {

  public AccelAST(Token t) {
    super(t);
  }

  public AccelAST(AccelAST node) {
    super(node);
  }

  /**
   * Shorter alternative to getChildCount()
   */
  public int childCount() {
    return getChildCount();
  }

  /**
   * alternative to getChild so we can avoid having the cast to
   * AccelAST everywhere
   */
  public AccelAST child(int i) {
    return (AccelAST)super.getChild(i);
  }

  @SuppressWarnings({ "unchecked", "rawtypes" })
  public List<AccelAST> children() {
    if (children == null) {
      return Collections.emptyList();
    }
    return (List)(this.children);
  }

  public List<AccelAST> children(int start) {
    // Return empty list if nothing in range
    if (childCount() <= start) {
      return Collections.emptyList();
    }
    return children().subList(start, children.size());
  }

  /**
   * @return true if the parser recorded token boundaries for this node
   */
  public boolean hasTokenBoundaries() {
    return getTokenStartIndex() >= 0 && getTokenStopIndex() >= 0;
  }

  @Override
  public Tree dupNode() {
    return new AccelAST(this);
  }

  public String printTree() {
    StringWriter sw = new StringWriter();
    PrintWriter writer = new PrintWriter(sw);
    writer.println("printTree:");
    printTree(writer, 0);
    writer.flush();
    return sw.toString();
  }

  private void printTree(PrintWriter writer, int indent) {
    indent(writer, indent);
    writer.println(this.getText());
    for (int i = 0; i < this.getChildCount(); i++)
      this.child(i).printTree(writer, indent+2);
  }

  private static void indent(PrintWriter writer, int indent)
  {
    for (int i = 0; i < indent; i++)
      writer.print(' ');
  }

  /**
   * Makes the parser build AccelAST nodes instead of CommonTree
   */
  public static class Adaptor extends CommonTreeAdaptor {
    @Override
    public Object create(Token t) {
      return new AccelAST(t);
    }
  }
}
