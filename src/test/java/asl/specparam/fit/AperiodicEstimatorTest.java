package asl.specparam.fit;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import asl.specparam.errors.FitError;
import asl.specparam.errors.FitErrorKind;
import asl.specparam.input.AlgorithmSettings;
import asl.specparam.model.AperiodicMode;
import asl.specparam.sim.SpectrumSimulator;
import asl.specparam.utils.NumericUtils;
import org.junit.Test;

public class AperiodicEstimatorTest {

  private static final double[] FREQS = SpectrumSimulator.genFreqs(new double[]{2., 40.}, 0.5);

  private static AperiodicEstimator estimator(AperiodicMode mode) {
    AlgorithmSettings algorithm = AlgorithmSettings.defaults();
    return new AperiodicEstimator(mode, algorithm,
        new CurveFitter(algorithm.getMaxEvaluations()));
  }

  @Test
  public void simpleFit_recoversExactLine() throws FitError {
    double[] spectrum = SpectrumSimulator.genAperiodic(FREQS, new double[]{1.5, 1.8});
    double[] fit = estimator(AperiodicMode.FIXED).simpleFit(FREQS, spectrum);
    assertArrayEquals(new double[]{1.5, 1.8}, fit, 1E-6);
  }

  @Test
  public void robustFit_lessBiasedByPeakThanSimpleFit() throws FitError {
    double[] aperiodic = SpectrumSimulator.genAperiodic(FREQS, new double[]{1.5, 1.8});
    double[] peak = SpectrumSimulator.genPeriodic(FREQS, new double[][]{{12., 0.8, 2.5}});
    double[] spectrum = NumericUtils.add(aperiodic, peak);

    AperiodicEstimator estimator = estimator(AperiodicMode.FIXED);
    double[] simple = estimator.simpleFit(FREQS, spectrum);
    double[] robust = estimator.robustFit(FREQS, spectrum);

    assertTrue(Math.abs(robust[1] - 1.8) < Math.abs(simple[1] - 1.8));
    assertEquals(1.8, robust[1], 0.05);
    assertEquals(1.5, robust[0], 0.05);
  }

  @Test
  public void selectSubsample_clipsNegativesToZero() {
    double[] flat = {-1., 0., 0.5, 2., 3.};
    int[] keep = AperiodicEstimator.selectSubsample(flat, 2.5);
    assertArrayEquals(new int[]{0, 1}, keep);
  }

  @Test
  public void selectSubsample_distinctValuesKeepsLowest() {
    double[] flat = {3., 1., 5., 2., 4.};
    int[] keep = AperiodicEstimator.selectSubsample(flat, 2.5);
    assertArrayEquals(new int[]{1}, keep);
  }

  @Test
  public void selectSubsample_fullPercentileKeepsAll() {
    double[] flat = {3., 1., 5., 2., 4.};
    int[] keep = AperiodicEstimator.selectSubsample(flat, 100.);
    assertEquals(5, keep.length);
  }

  @Test
  public void robustFit_tooFewPointsBelowPercentile_throwsSubsampleDegenerate() {
    // only the middle point lies below the initial fit, leaving one point for two parameters
    double[] freqs = {1., 2., 3.};
    double[] spectrum = {1., 0., 0.};
    try {
      estimator(AperiodicMode.FIXED).robustFit(freqs, spectrum);
      fail("Refit on a single point should not succeed");
    } catch (FitError e) {
      assertEquals(FitErrorKind.ROBUST_SUBSAMPLE_DEGENERATE, e.getKind());
    }
  }

}
