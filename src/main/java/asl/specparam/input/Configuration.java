package asl.specparam.input;

import asl.specparam.output.ErrorMetric;
import java.io.File;
import java.io.IOException;
import java.net.URL;
import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.XMLConfiguration;
import org.apache.log4j.Logger;

/**
 * Configuration file holding the internal tuning values of the fitting procedure and the
 * default run modes. These include the percentile used for robust aperiodic fitting, the
 * edge, overlap and center-frequency thresholds for peaks (in units of gaussian standard
 * deviation), the solver's evaluation budget, the error metric reported after fitting, and
 * whether debug mode and data checks are enabled.
 *
 * Any value missing from the file keeps its compiled-in default.
 */
public class Configuration {

  private static Configuration instance;

  private static final String DEFAULT_CONFIG_PATH = "specparam-config.xml";
  private static final Logger logger = Logger.getLogger(Configuration.class);

  private String loadedConfigPath = DEFAULT_CONFIG_PATH;

  private double apPercentileThreshold = AlgorithmSettings.DEFAULT_AP_PERCENTILE_THRESHOLD;
  private double bwStdEdge = AlgorithmSettings.DEFAULT_BW_STD_EDGE;
  private double gaussOverlapThreshold = AlgorithmSettings.DEFAULT_GAUSS_OVERLAP_THRESHOLD;
  private double cfBound = AlgorithmSettings.DEFAULT_CF_BOUND;
  private int maxEvaluations = AlgorithmSettings.DEFAULT_MAX_EVALUATIONS;
  private ErrorMetric errorMetric = ErrorMetric.MAE;

  private boolean debug = false;
  private boolean checkFreqs = true;
  private boolean checkData = true;

  private Configuration(XMLConfiguration config, String source) {
    apPercentileThreshold =
        config.getDouble("Aperiodic.PercentileThreshold", apPercentileThreshold);
    bwStdEdge = config.getDouble("PeakSearch.EdgeStdThreshold", bwStdEdge);
    gaussOverlapThreshold = config.getDouble("PeakSearch.OverlapThreshold", gaussOverlapThreshold);
    cfBound = config.getDouble("PeakSearch.CenterFrequencyBound", cfBound);
    maxEvaluations = config.getInt("Solver.MaxEvaluations", maxEvaluations);

    String errorMetricParam = config.getString("Metrics.ErrorMetric");
    if (errorMetricParam != null) {
      try {
        errorMetric = ErrorMetric.fromName(errorMetricParam);
      } catch (IllegalArgumentException e) {
        logger.warn("Unknown error metric in configuration, keeping " + errorMetric, e);
      }
    }

    debug = config.getBoolean("RunModes.Debug", debug);
    checkFreqs = config.getBoolean("RunModes.CheckFreqs", checkFreqs);
    checkData = config.getBoolean("RunModes.CheckData", checkData);

    loadedConfigPath = source;
    logger.info("Succesfully loaded in configuration: " + loadedConfigPath);
  }

  private Configuration() {
    logger.warn("Using compiled-in configuration defaults");
    loadedConfigPath = null;
  }

  /**
   * Gets the current instance of the configuration, or creates one if none exists. A
   * configuration file in the working directory takes precedence over the one embedded in the
   * jar.
   *
   * @return the current configuration instance
   */
  synchronized public static Configuration getInstance() {
    if (instance == null) {
      File local = new File(System.getProperty("user.dir") + File.separator
          + DEFAULT_CONFIG_PATH);
      if (local.exists()) {
        instance = load(local.getAbsolutePath());
      } else {
        instance = loadEmbedded();
      }
    }
    return instance;
  }

  /**
   * Read a configuration from a specific file. This does not replace the shared instance.
   * If the file cannot be read, the failure is logged and defaults are used.
   *
   * @param configLocation Path of the XML file to read
   * @return configuration with the file's values
   */
  public static Configuration load(String configLocation) {
    logger.info("Attempting reading in config file from " + configLocation);
    try {
      XMLConfiguration config = new XMLConfiguration(configLocation);
      String source = configLocation;
      File file = config.getFile();
      if (file != null) {
        try {
          source = file.getCanonicalPath();
        } catch (IOException e) {
          logger.debug("Could not resolve canonical config path", e);
        }
      }
      return new Configuration(config, source);
    } catch (ConfigurationException e) {
      logger.error("Error encountered while reading XML file, load failed, using defaults", e);
      return new Configuration();
    }
  }

  private static Configuration loadEmbedded() {
    URL embedded = Configuration.class.getClassLoader().getResource(DEFAULT_CONFIG_PATH);
    if (embedded == null) {
      logger.error("Major error: config XML file not part of resources!!");
      return new Configuration();
    }
    logger.info("Attempting reading in embedded config file " + embedded);
    try {
      return new Configuration(new XMLConfiguration(embedded), embedded.toString());
    } catch (ConfigurationException e) {
      logger.error("Error encountered while reading embedded XML file, using defaults", e);
      return new Configuration();
    }
  }

  /**
   * Build algorithm settings from the values in this configuration
   *
   * @return settings for the fitting procedure
   */
  public AlgorithmSettings getAlgorithmSettings() {
    return AlgorithmSettings.builder()
        .apPercentileThreshold(apPercentileThreshold)
        .bwStdEdge(bwStdEdge)
        .gaussOverlapThreshold(gaussOverlapThreshold)
        .cfBound(cfBound)
        .maxEvaluations(maxEvaluations)
        .errorMetric(errorMetric)
        .build();
  }

  /**
   * Path of the file the configuration was read from
   *
   * @return path or URL of the file; null if compiled-in defaults are in use
   */
  public String getLoadedConfigPath() {
    return loadedConfigPath;
  }

  public double getApPercentileThreshold() {
    return apPercentileThreshold;
  }

  public double getBwStdEdge() {
    return bwStdEdge;
  }

  public double getGaussOverlapThreshold() {
    return gaussOverlapThreshold;
  }

  public double getCfBound() {
    return cfBound;
  }

  public int getMaxEvaluations() {
    return maxEvaluations;
  }

  public ErrorMetric getErrorMetric() {
    return errorMetric;
  }

  /**
   * Whether fits run in debug mode by default, raising fit errors rather than returning
   * null results. Set from RunModes.Debug.
   *
   * @return true if debug mode is the default
   */
  public boolean isDebug() {
    return debug;
  }

  public boolean isCheckFreqs() {
    return checkFreqs;
  }

  public boolean isCheckData() {
    return checkData;
  }

}
