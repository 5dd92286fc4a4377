
package accel.asc.common.exceptions;

/**
 * This represents a compiler internal error.
 * These always indicate a compiler bug (or missing feature).
 * */
public class ASCRuntimeError extends RuntimeException
{
  public ASCRuntimeError(String msg)
  {
    super(msg);
  }

  public ASCRuntimeError(String msg, Throwable cause)
  {
    super(msg, cause);
  }

  private static final long serialVersionUID = 1L;
}
