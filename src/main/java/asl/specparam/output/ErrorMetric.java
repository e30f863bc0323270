package asl.specparam.output;

/**
 * Measures of the overall difference between the log power spectrum and the full model.
 */
public enum ErrorMetric {

  /**
   * Mean absolute error
   */
  MAE {
    @Override
    public double compute(double[] data, double[] model) {
      checkLengths(data, model);
      double sum = 0.;
      for (int i = 0; i < data.length; ++i) {
        sum += Math.abs(data[i] - model[i]);
      }
      return sum / data.length;
    }
  },

  /**
   * Mean squared error
   */
  MSE {
    @Override
    public double compute(double[] data, double[] model) {
      checkLengths(data, model);
      double sum = 0.;
      for (int i = 0; i < data.length; ++i) {
        double diff = data[i] - model[i];
        sum += diff * diff;
      }
      return sum / data.length;
    }
  },

  /**
   * Root mean squared error
   */
  RMSE {
    @Override
    public double compute(double[] data, double[] model) {
      return Math.sqrt(MSE.compute(data, model));
    }
  };

  /**
   * Compute the error between data and a model of it
   *
   * @param data Observed values
   * @param model Modeled values, same length as data
   * @return error value
   */
  public abstract double compute(double[] data, double[] model);

  /**
   * Get a metric by its name ("MAE", "MSE" or "RMSE", case insensitive)
   *
   * @param name Name of the metric
   * @return matching metric
   * @throws IllegalArgumentException if the name is not a known metric
   */
  public static ErrorMetric fromName(String name) {
    for (ErrorMetric metric : values()) {
      if (metric.name().equalsIgnoreCase(name.trim())) {
        return metric;
      }
    }
    throw new IllegalArgumentException(
        "Error metric '" + name + "' not understood or not implemented.");
  }

  private static void checkLengths(double[] data, double[] model) {
    if (data.length != model.length) {
      throw new IllegalArgumentException("Data and model lengths differ: " + data.length
          + ", " + model.length);
    }
  }

}
