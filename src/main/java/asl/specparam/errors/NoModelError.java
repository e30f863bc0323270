package asl.specparam.errors;

/**
 * Thrown when model results are requested before a fit has been run.
 */
public class NoModelError extends IllegalStateException {

  private static final long serialVersionUID = 1L;

  public NoModelError(String message) {
    super(message);
  }

}
