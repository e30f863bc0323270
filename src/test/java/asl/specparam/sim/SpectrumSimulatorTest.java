package asl.specparam.sim;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import java.util.Arrays;
import org.junit.Test;

public class SpectrumSimulatorTest {

  @Test
  public void genFreqs_includesBothEnds() {
    double[] freqs = SpectrumSimulator.genFreqs(new double[]{3., 50.}, 0.5);
    assertEquals(95, freqs.length);
    assertEquals(3., freqs[0], 0.);
    assertEquals(50., freqs[freqs.length - 1], 1E-12);
  }

  @Test
  public void genAperiodic_modeFromParameterCount() {
    double[] freqs = {1., 10.};
    assertArrayEquals(new double[]{2., 0.}, SpectrumSimulator.genAperiodic(freqs,
        new double[]{2., 2.}), 1E-12);
    assertArrayEquals(new double[]{2. - Math.log10(2.), 2. - Math.log10(101.)},
        SpectrumSimulator.genAperiodic(freqs, new double[]{2., 1., 2.}), 1E-12);
  }

  @Test
  public void genPeriodic_heightAtCenter() {
    double[] out = SpectrumSimulator.genPeriodic(new double[]{10., 20.},
        new double[][]{{10., 0.4, 1.}, {20., 0.2, 1.}});
    assertEquals(0.4, out[0], 1E-12);
    assertEquals(0.2, out[1], 1E-12);
  }

  @Test
  public void genNoise_reproducibleWithSeed() {
    double[] first = SpectrumSimulator.genNoise(50, 0.1, 11L);
    double[] second = SpectrumSimulator.genNoise(50, 0.1, 11L);
    double[] other = SpectrumSimulator.genNoise(50, 0.1, 12L);
    assertArrayEquals(first, second, 0.);
    assertFalse(Arrays.equals(first, other));
  }

  @Test
  public void genNoise_zeroLevelIsSilent() {
    assertArrayEquals(new double[10], SpectrumSimulator.genNoise(10, 0., 1L), 0.);
  }

  @Test(expected = IllegalArgumentException.class)
  public void genNoise_negativeLevel_throws() {
    SpectrumSimulator.genNoise(10, -0.1, 1L);
  }

  @Test
  public void genPowerSpectrum_noiselessIsUnloggedSum() {
    double[] range = {2., 20.};
    double[] ap = {1., 1.};
    double[][] peaks = {{8., 0.3, 1.}};
    double[][] spectrum = SpectrumSimulator.genPowerSpectrum(range, ap, peaks, 0., 1., 0L);
    double[] freqs = spectrum[0];
    double[] apVals = SpectrumSimulator.genAperiodic(freqs, ap);
    double[] peVals = SpectrumSimulator.genPeriodic(freqs, peaks);
    for (int i = 0; i < freqs.length; ++i) {
      assertEquals(apVals[i] + peVals[i], Math.log10(spectrum[1][i]), 1E-12);
    }
  }

}
