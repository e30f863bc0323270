package asl.specparam.utils;

import java.util.Arrays;

/**
 * Frequency-vector helpers and conversions between peak-width and aperiodic parameters.
 */
public class SpectrumUtils {

  /**
   * Ratio between a gaussian's full width at half maximum and its standard deviation,
   * 2 * sqrt(2 * ln 2).
   */
  public static final double FWHM_PER_STD = 2. * Math.sqrt(2. * Math.log(2.));

  /**
   * Restrict frequencies and power values to the inclusive range [low, high].
   *
   * @param freqs Frequency values
   * @param power Power values matching the frequency array
   * @param freqRange Two-element range as {low, high}
   * @return Nested array where index 0 is the trimmed frequencies and 1 the trimmed power
   */
  public static double[][] trimSpectrum(double[] freqs, double[] power, double[] freqRange) {
    int count = 0;
    for (double freq : freqs) {
      if (freq >= freqRange[0] && freq <= freqRange[1]) {
        ++count;
      }
    }
    double[] trimmedFreqs = new double[count];
    double[] trimmedPower = new double[count];
    int idx = 0;
    for (int i = 0; i < freqs.length; ++i) {
      if (freqs[i] >= freqRange[0] && freqs[i] <= freqRange[1]) {
        trimmedFreqs[idx] = freqs[i];
        trimmedPower[idx] = power[i];
        ++idx;
      }
    }
    return new double[][]{trimmedFreqs, trimmedPower};
  }

  /**
   * Generate an evenly spaced frequency vector that includes both ends of the range.
   * Half a step is allowed past the upper bound so that rounding error doesn't drop the last
   * point.
   *
   * @param freqRange Frequency range as {low, high}
   * @param freqRes Spacing between frequency values
   * @return Frequency values from low to high
   */
  public static double[] generateFreqs(double[] freqRange, double freqRes) {
    double stop = freqRange[1] + (0.5 * freqRes);
    int count = (int) Math.ceil((stop - freqRange[0]) / freqRes);
    double[] freqs = new double[Math.max(count, 0)];
    for (int i = 0; i < freqs.length; ++i) {
      freqs[i] = freqRange[0] + i * freqRes;
    }
    return freqs;
  }

  /**
   * Check that consecutive frequency values are the same distance apart, using numpy-style
   * closeness (absolute tolerance 1e-8 plus relative tolerance 1e-5 of the expected spacing).
   *
   * @param freqs Frequency values
   * @param freqRes Expected spacing
   * @return true if all differences match the spacing
   */
  public static boolean isEvenlySpaced(double[] freqs, double freqRes) {
    for (int i = 1; i < freqs.length; ++i) {
      double diff = freqs[i] - freqs[i - 1];
      if (Math.abs(diff - freqRes) > 1E-8 + 1E-5 * Math.abs(freqRes)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Gaussian standard deviation from a full width at half maximum.
   *
   * @param fwhm full-width half-max value
   * @return equivalent standard deviation
   */
  public static double computeGaussStd(double fwhm) {
    return fwhm / FWHM_PER_STD;
  }

  /**
   * Full width at half maximum from a gaussian standard deviation.
   *
   * @param std standard deviation
   * @return equivalent full-width half-max
   */
  public static double computeFwhm(double std) {
    return std * FWHM_PER_STD;
  }

  /**
   * Frequency, in Hz, at which the knee occurs given knee and exponent parameters.
   *
   * @param knee Knee parameter
   * @param exponent Exponent parameter
   * @return knee frequency
   */
  public static double computeKneeFrequency(double knee, double exponent) {
    return Math.pow(knee, 1. / exponent);
  }

  /**
   * Characteristic time constant tau implied by a knee parameter.
   *
   * @param knee Knee parameter
   * @return time constant, in seconds
   */
  public static double computeTimeConstant(double knee) {
    return 1. / (2 * Math.PI * knee);
  }

  /**
   * Deep copy of a row-oriented parameter matrix.
   *
   * @param rows matrix to copy
   * @return copy of each row
   */
  public static double[][] copyRows(double[][] rows) {
    double[][] out = new double[rows.length][];
    for (int i = 0; i < rows.length; ++i) {
      out[i] = Arrays.copyOf(rows[i], rows[i].length);
    }
    return out;
  }

}
