package asl.specparam.errors;

/**
 * Data error for frequency and power arrays that do not have the same length.
 */
public class InconsistentDataError extends DataError {

  private static final long serialVersionUID = 1L;

  public InconsistentDataError(String message) {
    super(message);
  }

}
