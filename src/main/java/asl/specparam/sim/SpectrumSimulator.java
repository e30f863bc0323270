package asl.specparam.sim;

import asl.specparam.model.AperiodicMode;
import asl.specparam.model.PeriodicMode;
import asl.specparam.utils.SpectrumUtils;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.random.Well19937c;

/**
 * Generates synthetic power spectra from known aperiodic and peak parameters, for testing and
 * for checking how well parameters are recovered.
 */
public class SpectrumSimulator {

  /**
   * Default standard deviation of the noise added in log10 power
   */
  public static final double DEFAULT_NOISE_LEVEL = 0.005;

  /**
   * Default frequency resolution, in Hz
   */
  public static final double DEFAULT_FREQ_RES = 0.5;

  /**
   * Frequency vector covering the range, inclusive of both ends
   *
   * @param freqRange Lowest and highest frequency
   * @param freqRes Spacing between frequencies
   * @return frequencies
   */
  public static double[] genFreqs(double[] freqRange, double freqRes) {
    return SpectrumUtils.generateFreqs(freqRange, freqRes);
  }

  /**
   * Aperiodic component in log10 power. The mode is chosen by the number of parameters:
   * {offset, exponent} or {offset, knee, exponent}.
   *
   * @param freqs Frequencies to evaluate at
   * @param aperiodicParams Aperiodic parameters
   * @return log10 power of the aperiodic component
   */
  public static double[] genAperiodic(double[] freqs, double[] aperiodicParams) {
    AperiodicMode mode = AperiodicMode.fromParameterCount(aperiodicParams.length);
    return mode.evaluate(freqs, aperiodicParams);
  }

  /**
   * Periodic component in log10 power
   *
   * @param freqs Frequencies to evaluate at
   * @param gaussianParams Peaks as rows of {center, height, std}
   * @return log10 power of the peaks
   */
  public static double[] genPeriodic(double[] freqs, double[][] gaussianParams) {
    double[] flattened = new double[gaussianParams.length * 3];
    for (int i = 0; i < gaussianParams.length; ++i) {
      if (gaussianParams[i].length != 3) {
        throw new IllegalArgumentException("Peak parameters must be {center, height, std}");
      }
      System.arraycopy(gaussianParams[i], 0, flattened, i * 3, 3);
    }
    return PeriodicMode.GAUSSIAN.evaluate(freqs, flattened);
  }

  /**
   * Gaussian white noise
   *
   * @param length Number of values
   * @param noiseLevel Standard deviation of the noise; zero gives no noise
   * @param seed Seed for the random generator, so output is reproducible
   * @return noise values
   */
  public static double[] genNoise(int length, double noiseLevel, long seed) {
    if (noiseLevel < 0.) {
      throw new IllegalArgumentException("Noise level cannot be negative: " + noiseLevel);
    }
    double[] noise = new double[length];
    if (noiseLevel == 0.) {
      return noise;
    }
    NormalDistribution dist = new NormalDistribution(new Well19937c(seed), 0., noiseLevel,
        NormalDistribution.DEFAULT_INVERSE_ABSOLUTE_ACCURACY);
    for (int i = 0; i < length; ++i) {
      noise[i] = dist.sample();
    }
    return noise;
  }

  /**
   * Generate a power spectrum as 10 ^ (aperiodic + peaks + noise)
   *
   * @param freqRange Lowest and highest frequency
   * @param aperiodicParams {offset, exponent} or {offset, knee, exponent}
   * @param gaussianParams Peaks as rows of {center, height, std}
   * @param noiseLevel Standard deviation of noise in log10 power
   * @param freqRes Frequency resolution
   * @param seed Seed for the noise
   * @return two arrays: frequencies, then linear power values
   */
  public static double[][] genPowerSpectrum(double[] freqRange, double[] aperiodicParams,
      double[][] gaussianParams, double noiseLevel, double freqRes, long seed) {
    double[] freqs = genFreqs(freqRange, freqRes);
    double[] aperiodic = genAperiodic(freqs, aperiodicParams);
    double[] periodic = genPeriodic(freqs, gaussianParams);
    double[] noise = genNoise(freqs.length, noiseLevel, seed);
    double[] powers = new double[freqs.length];
    for (int i = 0; i < powers.length; ++i) {
      powers[i] = Math.pow(10., aperiodic[i] + periodic[i] + noise[i]);
    }
    return new double[][]{freqs, powers};
  }

}
