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
package accel.asc.common.exceptions;

/**
 * Thrown by the tree builder when a production in the syntax tree has no
 * corresponding AST node.  The grammar never produces such trees, so this
 * points at a grammar/builder mismatch rather than bad user input.
 */
public class UnsupportedConstructException extends ASCRuntimeError {

  private final int tokenType;
  private final String constructKind;

  /**
   * @param tokenType ANTLR token type of the production
   * @param constructKind token name of the production, e.g. FIELD
   */
  public UnsupportedConstructException(int tokenType, String constructKind) {
    super("Unsupported construct: " + constructKind);
    this.tokenType = tokenType;
    this.constructKind = constructKind;
  }

  public int getTokenType() {
    return tokenType;
  }

  public String getConstructKind() {
    return constructKind;
  }

  private static final long serialVersionUID = 1L;
}
