package asl.specparam.fit;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import asl.specparam.errors.FitError;
import asl.specparam.errors.FitErrorKind;
import asl.specparam.input.AlgorithmSettings;
import asl.specparam.input.ModelSettings;
import asl.specparam.input.SpectralData;
import asl.specparam.model.AperiodicMode;
import asl.specparam.output.FitResult;
import asl.specparam.output.ModelComponents;
import asl.specparam.sim.SpectrumSimulator;
import org.junit.Test;

public class SpectrumFitterTest {

  private static final double[] FREQ_RANGE = {3., 50.};

  private static SpectralData simulate(double[] apParams, double[][] peaks, double noise,
      double freqRes) {
    double[][] spectrum = SpectrumSimulator.genPowerSpectrum(FREQ_RANGE, apParams, peaks,
        noise, freqRes, 42L);
    return SpectralData.create(spectrum[0], spectrum[1]);
  }

  private static SpectrumFitter fitter(ModelSettings settings) {
    return new SpectrumFitter(settings, AlgorithmSettings.defaults(), false);
  }

  private static SpectrumFitter failingFitter(boolean debug) {
    AlgorithmSettings algorithm = AlgorithmSettings.builder().maxEvaluations(1).build();
    return new SpectrumFitter(ModelSettings.defaults(), algorithm, debug);
  }

  @Test
  public void fit_recoversSimulatedParameters() throws FitError {
    SpectralData data = simulate(new double[]{50., 2.}, new double[][]{{10., 0.5, 2.}}, 0., 0.5);
    ModelSettings settings = ModelSettings.builder().minPeakHeight(0.1).build();
    FitResult result = fitter(settings).fit(data);

    assertTrue(result.hasModel());
    assertEquals(50., result.getAperiodicParams()[0], 0.05);
    assertEquals(2., result.getAperiodicParams()[1], 0.05);
    assertEquals(1, result.getNumberOfPeaks());
    double[] peak = result.getPeakParams()[0];
    assertEquals(10., peak[0], 0.1);
    assertEquals(0.5, peak[1], 0.05);
    assertEquals(4., peak[2], 0.1);
    assertTrue(result.getRSquared() > 0.99);
  }

  @Test
  public void fit_noPeaksInPureAperiodicSpectrum() throws FitError {
    SpectralData data = simulate(new double[]{1., 1.5}, new double[0][3], 0., 0.5);
    ModelSettings settings = ModelSettings.builder().minPeakHeight(0.1).build();
    FitResult result = fitter(settings).fit(data);

    assertTrue(result.hasModel());
    assertEquals(0, result.getNumberOfPeaks());
    assertEquals(1., result.getAperiodicParams()[0], 1E-4);
    assertEquals(1.5, result.getAperiodicParams()[1], 1E-4);
    assertEquals(0., result.getError(), 1E-4);
  }

  @Test
  public void fit_peakAtEdgeIsDropped() throws FitError {
    SpectralData data = simulate(new double[]{1., 1.5}, new double[][]{{3.5, 0.5, 1.5}}, 0., 0.5);
    ModelSettings settings = ModelSettings.builder().minPeakHeight(0.1).build();
    FitResult result = fitter(settings).fit(data);
    assertTrue(result.hasModel());
    assertEquals(0, result.getNumberOfPeaks());
  }

  @Test
  public void fit_twoPeaksSortedByCenter() throws FitError {
    SpectralData data = simulate(new double[]{1., 1.5},
        new double[][]{{25., 0.4, 2.}, {10., 0.6, 1.5}}, 0., 0.25);
    ModelSettings settings = ModelSettings.builder().minPeakHeight(0.1).build();
    FitResult result = fitter(settings).fit(data);

    assertEquals(2, result.getNumberOfPeaks());
    double[][] peaks = result.getPeakParams();
    assertEquals(10., peaks[0][0], 0.5);
    assertEquals(25., peaks[1][0], 0.5);
    double[][] gaussians = result.getGaussianParams();
    assertTrue(gaussians[0][0] < gaussians[1][0]);
  }

  @Test
  public void fit_maxPeaksLimitsCount() throws FitError {
    SpectralData data = simulate(new double[]{1., 1.5},
        new double[][]{{25., 0.4, 2.}, {10., 0.6, 1.5}}, 0., 0.25);
    ModelSettings settings = ModelSettings.builder().minPeakHeight(0.1).maxNPeaks(1).build();
    FitResult result = fitter(settings).fit(data);
    assertEquals(1, result.getNumberOfPeaks());
    assertEquals(10., result.getPeakParams()[0][0], 0.5);
  }

  @Test
  public void fit_kneeModeWithNoise() throws FitError {
    double[][] spectrum = SpectrumSimulator.genPowerSpectrum(new double[]{1., 150.},
        new double[]{50., 10., 1.}, new double[][]{{10., 0.3, 1.}}, 0.0025, 0.5, 7L);
    SpectralData data = SpectralData.create(spectrum[0], spectrum[1]);
    ModelSettings settings = ModelSettings.builder()
        .aperiodicMode(AperiodicMode.KNEE)
        .minPeakHeight(0.05)
        .build();
    FitResult result = fitter(settings).fit(data);

    assertTrue(result.hasModel());
    assertEquals(3, result.getAperiodicParams().length);
    assertEquals(1., result.getExponent(), 0.5);
    assertTrue(result.getRSquared() > 0.95);
  }

  @Test
  public void fit_goodnessOfFitInRange() throws FitError {
    SpectralData data = simulate(new double[]{1., 1.5}, new double[][]{{12., 0.4, 1.5}},
        0.01, 0.5);
    ModelSettings settings = ModelSettings.builder().minPeakHeight(0.1).build();
    FitResult result = fitter(settings).fit(data);
    assertTrue(result.hasModel());
    assertTrue(result.getRSquared() >= 0. && result.getRSquared() <= 1.);
    assertTrue(result.getError() >= 0.);
    assertEquals(data.size(), result.getComponents().getFullModel().length);
  }

  @Test
  public void fit_failureGivesNullResult() throws FitError {
    SpectralData data = simulate(new double[]{1., 1.5}, new double[][]{{12., 0.4, 1.5}},
        0.01, 0.5);
    FitResult result = failingFitter(false).fit(data);
    assertFalse(result.hasModel());
    assertEquals(2, result.getAperiodicParams().length);
    assertTrue(Double.isNaN(result.getAperiodicParams()[0]));
    assertEquals(0, result.getNumberOfPeaks());
    assertTrue(Double.isNaN(result.getRSquared()));
    assertTrue(Double.isNaN(result.getError()));
  }

  @Test
  public void fit_failureInDebugModeThrows() {
    SpectralData data = simulate(new double[]{1., 1.5}, new double[][]{{12., 0.4, 1.5}},
        0.01, 0.5);
    try {
      failingFitter(true).fit(data);
      fail("Debug mode should raise the fit error");
    } catch (FitError e) {
      assertEquals(FitErrorKind.APERIODIC_NOT_CONVERGED, e.getKind());
    }
  }

  @Test
  public void withDebugMode_keepsSettings() {
    SpectrumFitter fitter = failingFitter(false);
    SpectrumFitter debugFitter = fitter.withDebugMode(true);
    assertTrue(debugFitter.isDebug());
    assertFalse(fitter.isDebug());
    assertEquals(1, debugFitter.getAlgorithmSettings().getMaxEvaluations());
  }

  @Test
  public void tryFit_reportsFailureKind() {
    SpectralData data = simulate(new double[]{1., 1.5}, new double[0][3], 0.01, 0.5);
    FitOutcome outcome = failingFitter(false).tryFit(data);
    assertFalse(outcome.isSuccess());
    assertNull(outcome.getResult());
    assertEquals(FitErrorKind.APERIODIC_NOT_CONVERGED, outcome.getErrorKind());
    assertFalse(outcome.getResultOrNull(AperiodicMode.FIXED).hasModel());
  }

  @Test
  public void fit_degenerateRobustSubsample_givesNullResult() throws FitError {
    SpectralData data = SpectralData.create(new double[]{1., 2., 3.},
        new double[]{10., 1., 1.});
    SpectrumFitter fitter = fitter(ModelSettings.defaults());

    FitResult result = fitter.fit(data);
    assertFalse(result.hasModel());
    assertTrue(Double.isNaN(result.getAperiodicParams()[1]));

    FitOutcome outcome = fitter.tryFit(data);
    assertFalse(outcome.isSuccess());
    assertEquals(FitErrorKind.ROBUST_SUBSAMPLE_DEGENERATE, outcome.getErrorKind());
  }

  @Test
  public void fit_invalidDataWithoutCheck_givesNullResult() throws FitError {
    double[] freqs = SpectrumSimulator.genFreqs(FREQ_RANGE, 0.5);
    double[] power = SpectrumSimulator.genPowerSpectrum(FREQ_RANGE, new double[]{1., 1.5},
        new double[0][3], 0., 0.5, 1L)[1];
    power[10] = Double.NaN;
    SpectralData data = SpectralData.create(freqs, power, null, true, false);

    SpectrumFitter fitter = fitter(ModelSettings.defaults());
    assertFalse(fitter.fit(data).hasModel());
    assertEquals(FitErrorKind.INVALID_DATA, fitter.tryFit(data).getErrorKind());
  }

  @Test
  public void fit_sameInputGivesIdenticalResults() throws FitError {
    SpectralData data = simulate(new double[]{1., 1.5}, new double[][]{{12., 0.4, 1.5}},
        0.01, 0.5);
    SpectrumFitter fitter = fitter(ModelSettings.builder().minPeakHeight(0.1).build());
    FitResult first = fitter.fit(data);
    FitResult second = fitter.fit(data);
    assertArrayEquals(first.getAperiodicParams(), second.getAperiodicParams(), 0.);
    assertEquals(first.getNumberOfPeaks(), second.getNumberOfPeaks());
    for (int i = 0; i < first.getNumberOfPeaks(); ++i) {
      assertArrayEquals(first.getPeakParams()[i], second.getPeakParams()[i], 0.);
    }
    assertEquals(first.getRSquared(), second.getRSquared(), 0.);
  }

  @Test
  public void fit_fullModelIsSumOfComponents() throws FitError {
    SpectralData data = simulate(new double[]{1., 1.5}, new double[][]{{12., 0.4, 1.5}},
        0.01, 0.5);
    FitResult result = fitter(ModelSettings.builder().minPeakHeight(0.1).build()).fit(data);
    ModelComponents components = result.getComponents();
    double[] full = components.getFullModel();
    double[] apFit = components.getAperiodicFit();
    double[] peakFit = components.getPeakFit();
    for (int i = 0; i < full.length; ++i) {
      assertEquals(apFit[i] + peakFit[i], full[i], 1E-12);
    }
  }

  @Test
  public void checkWidthLimits_warnsNearResolution() {
    SpectrumFitter fitter = fitter(ModelSettings.defaults());
    assertTrue(fitter.checkWidthLimits(0.5));
    assertFalse(fitter.checkWidthLimits(0.25));
  }

}
