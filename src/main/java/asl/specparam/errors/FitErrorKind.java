package asl.specparam.errors;

/**
 * Identifies which stage of the fitting procedure failed, and how.
 */
public enum FitErrorKind {

  /**
   * Power values contained NaN or Inf and data checking was disabled when they were added.
   */
  INVALID_DATA("Model fitting was skipped because there are NaN or Inf values in the data."),
  APERIODIC_NOT_CONVERGED("Model fitting failed due to not finding parameters in "
      + "the simple aperiodic component fit."),
  APERIODIC_SINGULAR("Model fitting failed due to a degenerate system in "
      + "the simple aperiodic component fit."),
  ROBUST_APERIODIC_NOT_CONVERGED("Model fitting failed due to not finding parameters in "
      + "the robust aperiodic fit."),
  /**
   * Too few points survived the percentile cut for the second robust aperiodic pass.
   */
  ROBUST_SUBSAMPLE_DEGENERATE("Model fitting failed due to sub-sampling in "
      + "the robust aperiodic fit."),
  PEAK_NOT_CONVERGED("Model fitting failed due to not finding parameters in "
      + "the peak component fit."),
  /**
   * Usually caused by settings liberal enough to produce many closely overlapping guesses
   * that cannot be fit together.
   */
  PEAK_SINGULAR("Model fitting failed due to a singular system during peak fitting. "
      + "This can happen with settings that are too liberal, leading to a large number "
      + "of guess peaks that cannot be fit together.");

  private final String description;

  FitErrorKind(String description) {
    this.description = description;
  }

  public String getDescription() {
    return description;
  }

}
