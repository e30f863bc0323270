package asl.specparam.errors;

/**
 * Thrown when input frequencies or power values are malformed or unusable: mismatched or
 * too-short arrays, uneven frequency spacing, complex values, or NaN/Inf after the log10
 * transform. Input problems are never repaired silently, so this always reaches the caller.
 */
public class DataError extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  public DataError(String message) {
    super(message);
  }

}
