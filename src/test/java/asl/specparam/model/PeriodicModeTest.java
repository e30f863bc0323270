package asl.specparam.model;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class PeriodicModeTest {

  private static final double[] FREQS = {5., 8., 9.5, 10., 10.5, 12., 15.};

  @Test
  public void gaussian_peakAtCenterEqualsHeight() {
    double[] out = PeriodicMode.GAUSSIAN.evaluate(new double[]{10.}, new double[]{10., 0.7, 2.});
    assertEquals(0.7, out[0], 1E-15);
  }

  @Test
  public void gaussian_sumsPeaks() {
    double[] params = {8., 0.5, 1., 12., 0.3, 1.5};
    double[] first = PeriodicMode.GAUSSIAN.evaluate(FREQS, new double[]{8., 0.5, 1.});
    double[] second = PeriodicMode.GAUSSIAN.evaluate(FREQS, new double[]{12., 0.3, 1.5});
    double[] sum = PeriodicMode.GAUSSIAN.evaluate(FREQS, params);
    for (int i = 0; i < FREQS.length; ++i) {
      assertEquals(first[i] + second[i], sum[i], 1E-15);
    }
  }

  @Test
  public void gaussian_noPeaksIsZero() {
    double[] out = PeriodicMode.GAUSSIAN.evaluate(FREQS, new double[0]);
    assertArrayEquals(new double[FREQS.length], out, 0.);
  }

  @Test
  public void gaussian_jacobianMatchesNumeric() {
    final double[] params = {9., 0.5, 1.2, 12.5, 0.3, 2.};
    double[][] analytic = PeriodicMode.GAUSSIAN.jacobian(FREQS, params);
    FitFunction numeric = new FitFunction() {
      @Override
      public double[] evaluate(double[] freqs, double[] p) {
        return PeriodicMode.GAUSSIAN.evaluate(freqs, p);
      }

      @Override
      public int getParameterCount() {
        return 3;
      }
    };
    double[][] approx = numeric.jacobian(FREQS, params);
    for (int i = 0; i < FREQS.length; ++i) {
      assertArrayEquals(approx[i], analytic[i], 1E-6);
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void gaussian_partialGroup_throws() {
    PeriodicMode.GAUSSIAN.evaluate(FREQS, new double[]{1., 2., 3., 4.});
  }

  @Test
  public void buildBounds_centerWindowAndLimits() {
    double[][] guesses = {{10., 0.5, 1.}};
    ParameterBounds bounds = PeriodicMode.GAUSSIAN.buildBounds(guesses, 1.5,
        new double[]{0.25, 6.}, new double[]{1., 50.});
    assertArrayEquals(new double[]{7., 0., 0.25}, bounds.getLower(), 1E-12);
    assertArrayEquals(new double[]{13., Double.POSITIVE_INFINITY, 6.}, bounds.getUpper(), 1E-12);
  }

  @Test
  public void buildBounds_centerClippedToRange() {
    double[][] guesses = {{3., 0.5, 2.}, {48., 0.5, 2.}};
    ParameterBounds bounds = PeriodicMode.GAUSSIAN.buildBounds(guesses, 1.5,
        new double[]{0.25, 6.}, new double[]{1., 50.});
    assertEquals(1., bounds.getLower()[0], 0.);
    assertEquals(9., bounds.getUpper()[0], 1E-12);
    assertEquals(42., bounds.getLower()[3], 1E-12);
    assertEquals(50., bounds.getUpper()[3], 0.);
  }

  @Test
  public void fromName_findsGaussian() {
    assertEquals(PeriodicMode.GAUSSIAN, PeriodicMode.fromName("GAUSSIAN"));
  }

}
