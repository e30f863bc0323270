package asl.specparam.errors;

/**
 * Thrown when a fit is requested before any spectrum has been added.
 */
public class NoDataError extends IllegalStateException {

  private static final long serialVersionUID = 1L;

  public NoDataError(String message) {
    super(message);
  }

}
