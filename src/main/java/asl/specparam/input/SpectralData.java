package asl.specparam.input;

import asl.specparam.errors.DataError;
import asl.specparam.errors.InconsistentDataError;
import asl.specparam.utils.NumericUtils;
import asl.specparam.utils.SpectrumUtils;
import java.util.Arrays;
import org.apache.commons.math3.complex.Complex;
import org.apache.log4j.Logger;

/**
 * A single power spectrum prepared for fitting. Frequencies are kept in linear space, and the
 * power values are stored in log10 space, which is the space the model operates in.
 *
 * Instances are validated at construction and immutable afterwards: frequencies must be
 * strictly increasing and evenly spaced, and the logged power values must be finite. A leading
 * 0 Hz bin is dropped (with a warning) as the aperiodic function is undefined there.
 *
 * Input power must be in linear space. Passing in already-logged values usually produces
 * NaN or Inf values after the log transform and is rejected, but is not guaranteed to be
 * detected.
 */
public class SpectralData {

  private static final Logger logger = Logger.getLogger(SpectralData.class);

  private final double[] freqs;
  private final double[] powerSpectrum;
  private final double[] freqRange;
  private final double freqRes;

  private SpectralData(double[] freqs, double[] powerSpectrum) {
    this.freqs = freqs;
    this.powerSpectrum = powerSpectrum;
    freqRange = new double[]{freqs[0], freqs[freqs.length - 1]};
    freqRes = freqs[1] - freqs[0];
  }

  /**
   * Validate and log-transform a power spectrum over its full frequency range.
   *
   * @param freqs Frequency values, linear space
   * @param power Power values, linear space
   * @return prepared spectrum
   * @throws DataError if the data cannot be used for fitting
   */
  public static SpectralData create(double[] freqs, double[] power) {
    return create(freqs, power, null);
  }

  /**
   * Validate and log-transform a power spectrum, restricting it to a frequency range.
   *
   * @param freqs Frequency values, linear space
   * @param power Power values, linear space
   * @param freqRange Inclusive range to restrict to as {low, high}, or null to keep all
   * @return prepared spectrum
   * @throws DataError if the data cannot be used for fitting
   */
  public static SpectralData create(double[] freqs, double[] power, double[] freqRange) {
    return create(freqs, power, freqRange, true, true);
  }

  /**
   * Validate a power spectrum given as complex values, as produced by an FFT. The values
   * must be real (zero imaginary part); complex power is not supported.
   *
   * @param freqs Frequency values, linear space
   * @param power Power values, linear space
   * @param freqRange Inclusive range to restrict to as {low, high}, or null to keep all
   * @return prepared spectrum
   * @throws DataError if any value has an imaginary component or the data is otherwise invalid
   */
  public static SpectralData create(double[] freqs, Complex[] power, double[] freqRange) {
    if (power == null) {
      throw new DataError("Input data must be non-null arrays.");
    }
    double[] real = new double[power.length];
    for (int i = 0; i < power.length; ++i) {
      if (power[i].getImaginary() != 0.) {
        throw new DataError("Input power spectra are complex values. "
            + "Complex inputs are not supported.");
      }
      real[i] = power[i].getReal();
    }
    return create(freqs, real, freqRange);
  }

  /**
   * Validate and log-transform a power spectrum, with control over which checks are run.
   *
   * @param freqs Frequency values, linear space
   * @param power Power values, linear space
   * @param freqRange Inclusive range to restrict to as {low, high}, or null to keep all
   * @param checkFreqs True to reject unevenly spaced frequencies
   * @param checkData True to reject NaN or Inf values after the log transform. If false,
   * such data is accepted here and the fit itself will fail on it.
   * @return prepared spectrum
   * @throws DataError if the data cannot be used for fitting
   */
  public static SpectralData create(double[] freqs, double[] power, double[] freqRange,
      boolean checkFreqs, boolean checkData) {

    if (freqs == null || power == null) {
      throw new DataError("Input data must be non-null arrays.");
    }
    if (freqs.length != power.length) {
      throw new InconsistentDataError("The input frequencies and power spectra "
          + "are not consistent size.");
    }

    double[] workFreqs = freqs.clone();
    double[] workPower = power.clone();

    if (freqRange != null) {
      if (freqRange.length != 2 || freqRange[0] > freqRange[1]) {
        throw new DataError("Frequency range must be given as {low, high}: "
            + Arrays.toString(freqRange));
      }
      double[][] trimmed = SpectrumUtils.trimSpectrum(workFreqs, workPower, freqRange);
      workFreqs = trimmed[0];
      workPower = trimmed[1];
    }

    if (workFreqs.length > 0 && workFreqs[0] == 0.) {
      logger.warn("Skipping frequency == 0, as this causes a problem with fitting.");
      workFreqs = Arrays.copyOfRange(workFreqs, 1, workFreqs.length);
      workPower = Arrays.copyOfRange(workPower, 1, workPower.length);
    }

    if (workFreqs.length < 2) {
      throw new DataError("At least two frequency values are needed to fit a spectrum, got "
          + workFreqs.length + ".");
    }

    for (int i = 1; i < workFreqs.length; ++i) {
      if (!(workFreqs[i] > workFreqs[i - 1])) {
        throw new DataError("The input frequency values must be strictly increasing.");
      }
    }
    double freqRes = workFreqs[1] - workFreqs[0];
    if (checkFreqs && !SpectrumUtils.isEvenlySpaced(workFreqs, freqRes)) {
      throw new DataError("The input frequency values are not evenly spaced. "
          + "The model expects equidistant frequency values in linear space.");
    }

    double[] logPower = new double[workPower.length];
    for (int i = 0; i < workPower.length; ++i) {
      logPower[i] = Math.log10(workPower[i]);
    }

    if (checkData && !NumericUtils.allFinite(logPower)) {
      throw new DataError("The input power spectra data, after logging, contains NaNs or Infs. "
          + "This will cause the fitting to fail. "
          + "One reason this can happen is if inputs are already logged. "
          + "Inputs data should be in linear spacing, not log.");
    }

    return new SpectralData(workFreqs, logPower);
  }

  /**
   * Get the frequency values, in Hz
   *
   * @return copy of the frequency vector
   */
  public double[] getFreqs() {
    return freqs.clone();
  }

  /**
   * Get the power values, in log10 space
   *
   * @return copy of the logged power spectrum
   */
  public double[] getPowerSpectrum() {
    return powerSpectrum.clone();
  }

  /**
   * Get the lowest and highest frequency of the data
   *
   * @return {low, high}
   */
  public double[] getFreqRange() {
    return freqRange.clone();
  }

  /**
   * Spacing between consecutive frequency values
   *
   * @return frequency resolution, in Hz
   */
  public double getFreqRes() {
    return freqRes;
  }

  public int size() {
    return freqs.length;
  }

}
