package asl.specparam.fit;

import asl.specparam.errors.FitError;
import asl.specparam.errors.FitErrorKind;
import asl.specparam.model.AperiodicMode;
import asl.specparam.output.FitResult;

/**
 * Either the result of a successful fit or the error that stopped it.
 */
public class FitOutcome {

  private final FitResult result;
  private final FitError error;

  private FitOutcome(FitResult result, FitError error) {
    this.result = result;
    this.error = error;
  }

  public static FitOutcome success(FitResult result) {
    if (result == null) {
      throw new IllegalArgumentException("Successful outcome needs a result");
    }
    return new FitOutcome(result, null);
  }

  public static FitOutcome failure(FitError error) {
    if (error == null) {
      throw new IllegalArgumentException("Failed outcome needs an error");
    }
    return new FitOutcome(null, error);
  }

  public boolean isSuccess() {
    return result != null;
  }

  /**
   * @return the fit result; null if the fit failed
   */
  public FitResult getResult() {
    return result;
  }

  /**
   * Get the fit result, or the null result for the given mode if the fit failed
   *
   * @param mode Aperiodic mode of the fit
   * @return fit result or null result
   */
  public FitResult getResultOrNull(AperiodicMode mode) {
    return isSuccess() ? result : FitResult.nullResult(mode);
  }

  /**
   * @return the error that stopped the fit; null if it succeeded
   */
  public FitError getError() {
    return error;
  }

  public FitErrorKind getErrorKind() {
    return error == null ? null : error.getKind();
  }

}
