package accel.asc.common.exceptions;

public class InvalidSyntaxException extends UserException {

  /**
   *
   */
  private static final long serialVersionUID = 1060914609057739598L;

  public InvalidSyntaxException(String file, int line, int col,
                                String message) {
    super(file, line, col, message);
  }

}
