package asl.specparam.model;

/**
 * A function that can be fit to spectral data by the least-squares solver. Implementations
 * provide evaluation over a frequency vector and the number of parameters they take; they may
 * override the jacobian with an analytic form, otherwise a forward-difference approximation
 * is used.
 */
public interface FitFunction {

  /**
   * Relative step used in forward-difference derivative approximation
   */
  double STEP_FACTOR = 1E-8;

  /**
   * Evaluate the function at each of the given frequencies
   *
   * @param freqs Frequency values, in linear space (Hz)
   * @param params Function parameters
   * @return Function output, one value per frequency
   */
  double[] evaluate(double[] freqs, double[] params);

  /**
   * Number of parameters for one instance of this function. Functions that can be summed
   * (i.e., multiple peaks) take a multiple of this count.
   *
   * @return parameter count
   */
  int getParameterCount();

  /**
   * Partial derivatives of the function with respect to each parameter, evaluated at
   * each frequency. The default implementation uses forward differences.
   *
   * @param freqs Frequency values, in linear space (Hz)
   * @param params Point at which to evaluate derivatives
   * @return matrix with one row per frequency and one column per parameter
   */
  default double[][] jacobian(double[] freqs, double[] params) {
    double[][] jacobian = new double[freqs.length][params.length];
    double[] init = evaluate(freqs, params);
    for (int j = 0; j < params.length; ++j) {
      double[] shifted = params.clone();
      double step = STEP_FACTOR * Math.max(Math.abs(params[j]), 1.);
      shifted[j] += step;
      double[] diff = evaluate(freqs, shifted);
      for (int i = 0; i < freqs.length; ++i) {
        jacobian[i][j] = (diff[i] - init[i]) / step;
      }
    }
    return jacobian;
  }

}
