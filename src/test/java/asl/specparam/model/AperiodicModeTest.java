package asl.specparam.model;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class AperiodicModeTest {

  private static final double[] FREQS = {1., 2., 5., 10., 20., 40.};

  /**
   * Wraps a mode so the default forward-difference jacobian is used
   */
  private static FitFunction numeric(final AperiodicMode mode) {
    return new FitFunction() {
      @Override
      public double[] evaluate(double[] freqs, double[] params) {
        return mode.evaluate(freqs, params);
      }

      @Override
      public int getParameterCount() {
        return mode.getParameterCount();
      }
    };
  }

  @Test
  public void fixed_evaluatesLineInLogLog() {
    double[] out = AperiodicMode.FIXED.evaluate(new double[]{1., 10., 100.},
        new double[]{1., 2.});
    assertArrayEquals(new double[]{1., -1., -3.}, out, 1E-12);
  }

  @Test
  public void knee_evaluatesBend() {
    double[] out = AperiodicMode.KNEE.evaluate(new double[]{3.}, new double[]{2., 1., 2.});
    assertEquals(1., out[0], 1E-12);
  }

  @Test
  public void fixed_jacobianMatchesNumeric() {
    double[] params = {1.5, 1.2};
    double[][] analytic = AperiodicMode.FIXED.jacobian(FREQS, params);
    double[][] approx = numeric(AperiodicMode.FIXED).jacobian(FREQS, params);
    for (int i = 0; i < FREQS.length; ++i) {
      assertArrayEquals(approx[i], analytic[i], 1E-6);
    }
  }

  @Test
  public void knee_jacobianMatchesNumeric() {
    double[] params = {2., 10., 1.5};
    double[][] analytic = AperiodicMode.KNEE.jacobian(FREQS, params);
    double[][] approx = numeric(AperiodicMode.KNEE).jacobian(FREQS, params);
    for (int i = 0; i < FREQS.length; ++i) {
      assertArrayEquals(approx[i], analytic[i], 1E-6);
    }
  }

  @Test
  public void fromName_ignoresCase() {
    assertEquals(AperiodicMode.KNEE, AperiodicMode.fromName("Knee"));
    assertEquals(AperiodicMode.FIXED, AperiodicMode.fromName(" fixed "));
  }

  @Test(expected = IllegalArgumentException.class)
  public void fromName_unknown_throws() {
    AperiodicMode.fromName("lorentzian");
  }

  @Test
  public void fromParameterCount_selectsMode() {
    assertEquals(AperiodicMode.FIXED, AperiodicMode.fromParameterCount(2));
    assertEquals(AperiodicMode.KNEE, AperiodicMode.fromParameterCount(3));
  }

  @Test(expected = IllegalArgumentException.class)
  public void fromParameterCount_unknown_throws() {
    AperiodicMode.fromParameterCount(4);
  }

  @Test
  public void buildBounds_fixedDropsKnee() {
    ParameterBounds bounds = AperiodicMode.FIXED.buildBounds(
        new double[]{-1., -2., -3.}, new double[]{1., 2., 3.});
    assertArrayEquals(new double[]{-1., -3.}, bounds.getLower(), 0.);
    assertArrayEquals(new double[]{1., 3.}, bounds.getUpper(), 0.);
  }

  @Test
  public void initialGuess_derivesOffsetAndExponent() {
    double[] spectrum = AperiodicMode.FIXED.evaluate(FREQS, new double[]{3., 2.});
    double[] guess = AperiodicMode.FIXED.initialGuess(FREQS, spectrum,
        new double[]{Double.NaN, 0., Double.NaN});
    assertArrayEquals(new double[]{3., 2.}, guess, 1E-12);
  }

  @Test
  public void initialGuess_keepsGivenValues() {
    double[] spectrum = AperiodicMode.KNEE.evaluate(FREQS, new double[]{3., 0., 2.});
    double[] guess = AperiodicMode.KNEE.initialGuess(FREQS, spectrum,
        new double[]{1., 5., 0.5});
    assertArrayEquals(new double[]{1., 5., 0.5}, guess, 0.);
  }

}
