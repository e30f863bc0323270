package asl.specparam.utils;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Arrays;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

/**
 * Array helpers and summary statistics used throughout the fitting procedure.
 */
public class NumericUtils {

  public static final ThreadLocal<DecimalFormat> DECIMAL_FORMAT =
      ThreadLocal.withInitial(() -> {
        DecimalFormat format = new DecimalFormat("#.####");
        setNonFinitePrintable(format);
        return format;
      });

  /**
   * Index of the largest value in the array. Ties resolve to the first (lowest) index.
   *
   * @param values Array to search, must be non-empty
   * @return index of the maximum value
   */
  public static int argmax(double[] values) {
    int maxIdx = 0;
    for (int i = 1; i < values.length; ++i) {
      if (values[i] > values[maxIdx]) {
        maxIdx = i;
      }
    }
    return maxIdx;
  }

  /**
   * Index of the array entry closest to the given value. Ties resolve to the lowest index.
   *
   * @param values Array to search (e.g., a frequency vector)
   * @param target Value to find the nearest entry to
   * @return index of the closest entry
   */
  public static int nearestIndex(double[] values, double target) {
    int nearest = 0;
    double bestDistance = Math.abs(values[0] - target);
    for (int i = 1; i < values.length; ++i) {
      double distance = Math.abs(values[i] - target);
      if (distance < bestDistance) {
        bestDistance = distance;
        nearest = i;
      }
    }
    return nearest;
  }

  /**
   * Population standard deviation (divides by n, not n - 1).
   *
   * @param values data to get deviation of
   * @return standard deviation
   */
  public static double populationStdDev(double[] values) {
    return new StandardDeviation(false).evaluate(values);
  }

  /**
   * Percentile of the data with linear interpolation between closest ranks, which is the
   * R-7 estimator (and numpy's default).
   *
   * @param values data to evaluate
   * @param percentile percentile to get, in range (0, 100]
   * @return the interpolated percentile value
   */
  public static double percentile(double[] values, double percentile) {
    return new Percentile().withEstimationType(EstimationType.R_7).evaluate(values, percentile);
  }

  /**
   * Squared Pearson correlation between two equal-length series.
   *
   * @param first first series
   * @param second second series
   * @return r^2; NaN if either series has no variance
   */
  public static double rSquared(double[] first, double[] second) {
    double r = new PearsonsCorrelation().correlation(first, second);
    return r * r;
  }

  /**
   * Pointwise sum of two equal-length arrays.
   *
   * @param first first array
   * @param second second array
   * @return new array with first[i] + second[i]
   */
  public static double[] add(double[] first, double[] second) {
    double[] out = new double[first.length];
    for (int i = 0; i < out.length; ++i) {
      out[i] = first[i] + second[i];
    }
    return out;
  }

  /**
   * Pointwise difference of two equal-length arrays.
   *
   * @param first array to subtract from
   * @param second array to subtract
   * @return new array with first[i] - second[i]
   */
  public static double[] subtract(double[] first, double[] second) {
    double[] out = new double[first.length];
    for (int i = 0; i < out.length; ++i) {
      out[i] = first[i] - second[i];
    }
    return out;
  }

  /**
   * Check that every value in the array is neither NaN nor infinite.
   *
   * @param values array to check
   * @return true if all values are finite
   */
  public static boolean allFinite(double[] values) {
    for (double value : values) {
      if (Double.isNaN(value) || Double.isInfinite(value)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Array of the given length filled with NaN.
   *
   * @param length length of array
   * @return NaN-filled array
   */
  public static double[] nanArray(int length) {
    double[] out = new double[length];
    Arrays.fill(out, Double.NaN);
    return out;
  }

  /**
   * Sets the formatter to print infinite and NaN values as short readable strings
   *
   * @param df formatter to modify
   */
  public static void setNonFinitePrintable(DecimalFormat df) {
    DecimalFormatSymbols symbols = df.getDecimalFormatSymbols();
    symbols.setInfinity("Inf.");
    symbols.setNaN("NaN");
    df.setDecimalFormatSymbols(symbols);
  }

}
