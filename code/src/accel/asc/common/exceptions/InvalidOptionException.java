package accel.asc.common.exceptions;

/**
 * A compiler setting has a missing or malformed value
 */
public class InvalidOptionException extends Exception {

  public InvalidOptionException(String message) {
    super(message);
  }

  private static final long serialVersionUID = 1L;
}
