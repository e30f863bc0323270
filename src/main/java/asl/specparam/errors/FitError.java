package asl.specparam.errors;

/**
 * Numerical failure at one of the nonlinear fitting stages. By default these are captured by
 * the fitter and turned into a null result; they only reach the caller in debug mode.
 */
public class FitError extends Exception {

  private static final long serialVersionUID = 1L;

  private final FitErrorKind kind;

  public FitError(FitErrorKind kind) {
    this(kind, null);
  }

  public FitError(FitErrorKind kind, Throwable cause) {
    super(kind.getDescription(), cause);
    this.kind = kind;
  }

  /**
   * Get the stage and failure type that produced this error
   *
   * @return kind of fit failure
   */
  public FitErrorKind getKind() {
    return kind;
  }

}
