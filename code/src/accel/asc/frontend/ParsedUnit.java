package accel.asc.frontend;

import java.io.File;
import java.io.IOException;
import java.util.List;

import org.antlr.runtime.ANTLRStringStream;
import org.antlr.runtime.BaseRecognizer;
import org.antlr.runtime.CommonToken;
import org.antlr.runtime.CommonTokenStream;
import org.antlr.runtime.MismatchedSetException;
import org.antlr.runtime.RecognitionException;
import org.antlr.runtime.Token;
import org.antlr.runtime.TokenStream;
import org.apache.commons.io.FileUtils;

import accel.asc.ast.AccelAST;
import accel.asc.ast.FilePosition;
import accel.asc.ast.antlr.AccelScriptLexer;
import accel.asc.ast.antlr.AccelScriptParser;
import accel.asc.common.Settings;
import accel.asc.common.exceptions.ASCRuntimeError;
import accel.asc.common.exceptions.InvalidSyntaxException;

/**
 * Represents one parsed AccelScript compilation unit: the source text,
 * its token stream and the concrete syntax tree.  Spans of tree nodes are
 * resolved through the token stream.
 */
public class ParsedUnit {

  public ParsedUnit(String fileName, String source, TokenStream tokens,
                    AccelAST ast) {
    this.fileName = fileName;
    this.source = source;
    this.tokens = tokens;
    this.ast = ast;
  }

  /** Name used in diagnostics */
  public final String fileName;
  public final String source;
  public final TokenStream tokens;
  public final AccelAST ast;

  /**
   * Parse the specified file and create a ParsedUnit object
   * @param path
   * @return
   * @throws IOException if the file could not be read
   * @throws InvalidSyntaxException if the file is not valid AccelScript
   */
  public static ParsedUnit parseFile(String path)
      throws IOException, InvalidSyntaxException {
    String source = FileUtils.readFileToString(new File(path),
                                  Settings.get(Settings.INPUT_ENCODING));
    return parse(path, source);
  }

  /**
   * Parse source text and create a ParsedUnit object
   * @param fileName name to report in error messages
   * @param source program text
   * @return
   * @throws InvalidSyntaxException on the first lexer or parser error
   */
  public static ParsedUnit parse(String fileName, String source)
      throws InvalidSyntaxException {
    AccelScriptLexer lexer = new AccelScriptLexer(
                                      new ANTLRStringStream(source));
    CommonTokenStream tokens = new CommonTokenStream(lexer);
    AccelScriptParser parser = new AccelScriptParser(tokens);
    parser.setTreeAdaptor(new AccelAST.Adaptor());

    AccelScriptParser.program_return program;
    try {
      program = parser.program();
    } catch (RecognitionException e) {
      // ANTLR reports and recovers from errors itself, so this is
      // an internal error
      throw new ASCRuntimeError("Parsing failed: internal error", e);
    }

    // The token stream is filled by now, so lexer errors are all in
    checkErrors(fileName, lexer, lexer.lexerErrors);
    checkErrors(fileName, parser, parser.syntaxErrors);

    if (program == null || program.getTree() == null)
      throw new ASCRuntimeError("PARSER FAILED!");

    return new ParsedUnit(fileName, source, tokens,
                          (AccelAST)program.getTree());
  }

  private static void checkErrors(String fileName, BaseRecognizer recognizer,
      List<RecognitionException> errors) throws InvalidSyntaxException {
    if (errors.isEmpty()) {
      return;
    }
    RecognitionException first = errors.get(0);
    String msg;
    if (first instanceof MismatchedSetException && first.token != null &&
        ((MismatchedSetException)first).expecting == null) {
      // Inline token sets carry no expected set to report
      msg = mismatchedSetMessage(recognizer, first);
    } else {
      msg = recognizer.getErrorMessage(first, recognizer.getTokenNames());
    }
    throw new InvalidSyntaxException(fileName, first.line,
                                     first.charPositionInLine, msg);
  }

  /**
   * Name the grammar rule that failed instead of the missing token set
   */
  private static String mismatchedSetMessage(BaseRecognizer recognizer,
                                             RecognitionException e) {
    String msg = "mismatched input " +
                 recognizer.getTokenErrorDisplay(e.token);
    List<String> rules = BaseRecognizer.getRuleInvocationStack(e,
                                  recognizer.getClass().getName());
    if (rules.isEmpty()) {
      return msg;
    }
    String rule = rules.get(rules.size() - 1);
    if (rule.equals("identifier")) {
      return msg + " expecting a name";
    }
    return msg + " in " + rule.replace('_', ' ');
  }

  /**
   * @return character offset of first character of tree's first token
   */
  public int startOffset(AccelAST tree) {
    return charToken(firstToken(tree)).getStartIndex();
  }

  /**
   * @return character offset of last character of tree's last token
   */
  public int stopOffset(AccelAST tree) {
    return charToken(lastToken(tree)).getStopIndex();
  }

  /**
   * @return position of tree's first token
   */
  public FilePosition position(AccelAST tree) {
    Token first = firstToken(tree);
    return new FilePosition(fileName, first.getLine(),
                            first.getCharPositionInLine());
  }

  /**
   * Text of the tokens spanned by tree.  Off-channel tokens (whitespace,
   * comments) between them are not included.
   */
  public String text(AccelAST tree) {
    checkBoundaries(tree);
    StringBuilder sb = new StringBuilder();
    for (int i = tree.getTokenStartIndex(); i <= tree.getTokenStopIndex();
         i++) {
      Token t = tokens.get(i);
      if (t.getChannel() == Token.DEFAULT_CHANNEL &&
          t.getType() != Token.EOF) {
        sb.append(t.getText());
      }
    }
    return sb.toString();
  }

  private Token firstToken(AccelAST tree) {
    checkBoundaries(tree);
    return tokens.get(tree.getTokenStartIndex());
  }

  private Token lastToken(AccelAST tree) {
    checkBoundaries(tree);
    return tokens.get(tree.getTokenStopIndex());
  }

  private void checkBoundaries(AccelAST tree) {
    if (!tree.hasTokenBoundaries()) {
      throw new ASCRuntimeError("No token boundaries recorded for "
          + LogHelper.tokName(tree.getType()) + " node");
    }
  }

  private static CommonToken charToken(Token t) {
    if (!(t instanceof CommonToken)) {
      throw new ASCRuntimeError("Token without character offsets: " + t);
    }
    return (CommonToken)t;
  }
}
