package asl.specparam.fit;

import asl.specparam.errors.FitError;
import asl.specparam.errors.FitErrorKind;
import asl.specparam.input.AlgorithmSettings;
import asl.specparam.input.ModelSettings;
import asl.specparam.model.ParameterBounds;
import asl.specparam.model.PeriodicMode;
import asl.specparam.utils.NumericUtils;
import asl.specparam.utils.SpectrumUtils;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.apache.log4j.Logger;

/**
 * Finds gaussian peaks in a flattened spectrum (log power with the aperiodic fit removed).
 *
 * Candidates are found one at a time at the maximum of the residual, each guess gaussian
 * being subtracted before the next search. Candidates too close to the edges of the
 * frequency range or overlapping a taller neighbor are dropped, and the rest are fit jointly.
 */
public class PeakExtractor {

  private static final Logger logger = Logger.getLogger(PeakExtractor.class);

  private static final Comparator<PeakCandidate> BY_CENTER =
      Comparator.comparingDouble(PeakCandidate::getCenter);

  private final double[] freqs;
  private final double[] freqRange;
  private final double freqRes;
  private final ModelSettings settings;
  private final AlgorithmSettings algorithm;
  private final CurveFitter fitter;
  private final PeriodicMode periodicMode = PeriodicMode.GAUSSIAN;

  /**
   * @param freqs Frequencies of the spectrum, evenly spaced
   * @param settings Peak search limits
   * @param algorithm Edge, overlap and center-frequency thresholds
   * @param fitter Solver for the joint peak fit
   */
  public PeakExtractor(double[] freqs, ModelSettings settings, AlgorithmSettings algorithm,
      CurveFitter fitter) {
    if (freqs.length < 2) {
      throw new IllegalArgumentException("Need at least two frequencies to search for peaks");
    }
    this.freqs = freqs.clone();
    freqRange = new double[]{freqs[0], freqs[freqs.length - 1]};
    freqRes = freqs[1] - freqs[0];
    this.settings = settings;
    this.algorithm = algorithm;
    this.fitter = fitter;
  }

  /**
   * Run the full peak procedure: search, drop edge and overlapping candidates, then fit.
   *
   * @param flat Flattened spectrum
   * @return gaussian parameters as rows of {mean, height, std}, ascending by mean
   * @throws FitError if the joint fit fails
   */
  public double[][] fitPeaks(double[] flat) throws FitError {
    List<PeakCandidate> guesses = findPeakGuesses(flat);
    int found = guesses.size();
    guesses = dropPeakEdge(guesses);
    guesses = dropPeakOverlap(guesses);
    logger.debug("Found " + found + " candidate peaks, " + guesses.size()
        + " remain after edge and overlap checks");
    if (guesses.isEmpty()) {
      return new double[0][3];
    }
    return fitPeakGuess(guesses, flat);
  }

  /**
   * Iteratively find candidate peaks. The search stops when the maximum number of peaks is
   * reached, or when the largest remaining value is no more than the relative threshold
   * times the standard deviation of the residual, or is not above the absolute minimum height.
   *
   * @param flat Flattened spectrum; not modified
   * @return candidates in the order they were found
   */
  public List<PeakCandidate> findPeakGuesses(double[] flat) {
    double[] residual = flat.clone();
    double[] stdLimits = settings.getGaussStdLimits();
    double[] widthLimits = settings.getPeakWidthLimits();
    List<PeakCandidate> guesses = new ArrayList<PeakCandidate>();

    while (guesses.size() < settings.getMaxNPeaks()) {
      int maxIdx = NumericUtils.argmax(residual);
      double maxHeight = residual[maxIdx];

      if (maxHeight <= settings.getPeakThreshold() * NumericUtils.populationStdDev(residual)) {
        break;
      }
      if (!(maxHeight > settings.getMinPeakHeight())) {
        break;
      }

      double halfHeight = 0.5 * maxHeight;
      // leftward search stops before index 0
      int leftIdx = -1;
      for (int i = maxIdx - 1; i > 0; --i) {
        if (residual[i] <= halfHeight) {
          leftIdx = i;
          break;
        }
      }
      int rightIdx = -1;
      for (int i = maxIdx + 1; i < residual.length; ++i) {
        if (residual[i] <= halfHeight) {
          rightIdx = i;
          break;
        }
      }

      double guessStd;
      if (leftIdx < 0 && rightIdx < 0) {
        guessStd = (widthLimits[0] + widthLimits[1]) / 2.;
      } else {
        int shortSide = Integer.MAX_VALUE;
        if (leftIdx >= 0) {
          shortSide = maxIdx - leftIdx;
        }
        if (rightIdx >= 0) {
          shortSide = Math.min(shortSide, rightIdx - maxIdx);
        }
        guessStd = SpectrumUtils.computeGaussStd(shortSide * 2 * freqRes);
      }
      guessStd = Math.max(guessStd, stdLimits[0]);
      guessStd = Math.min(guessStd, stdLimits[1]);

      PeakCandidate candidate = new PeakCandidate(freqs[maxIdx], maxHeight, guessStd);
      guesses.add(candidate);
      residual = NumericUtils.subtract(residual,
          periodicMode.evaluate(freqs, candidate.toArray()));
    }

    return guesses;
  }

  /**
   * Drop candidates whose center is within the edge threshold (in standard deviations) of
   * either end of the frequency range.
   *
   * @param guesses Candidates to check
   * @return candidates kept, in their original order
   */
  public List<PeakCandidate> dropPeakEdge(List<PeakCandidate> guesses) {
    List<PeakCandidate> kept = new ArrayList<PeakCandidate>();
    for (PeakCandidate guess : guesses) {
      double edgeDist = guess.getStd() * algorithm.getBwStdEdge();
      if (Math.abs(guess.getCenter() - freqRange[0]) > edgeDist
          && Math.abs(guess.getCenter() - freqRange[1]) > edgeDist) {
        kept.add(guess);
      }
    }
    return kept;
  }

  /**
   * Drop candidates that overlap a neighbor. Candidates are sorted by center and each
   * adjacent pair is compared once, left to right, using windows of the overlap threshold
   * times the standard deviation around each center; where windows overlap the shorter of
   * the pair is dropped (the left one if heights are equal). A candidate dropped from one pair
   * still takes part in the comparison with its other neighbor.
   *
   * @param guesses Candidates to check
   * @return candidates kept, ascending by center
   */
  public List<PeakCandidate> dropPeakOverlap(List<PeakCandidate> guesses) {
    List<PeakCandidate> sorted = new ArrayList<PeakCandidate>(guesses);
    Collections.sort(sorted, BY_CENTER);
    double threshold = algorithm.getGaussOverlapThreshold();

    Set<Integer> dropped = new HashSet<Integer>();
    for (int i = 0; i < sorted.size() - 1; ++i) {
      PeakCandidate left = sorted.get(i);
      PeakCandidate right = sorted.get(i + 1);
      double leftUpper = left.getCenter() + left.getStd() * threshold;
      double rightLower = right.getCenter() - right.getStd() * threshold;
      if (leftUpper > rightLower) {
        dropped.add(right.getHeight() < left.getHeight() ? i + 1 : i);
      }
    }

    List<PeakCandidate> kept = new ArrayList<PeakCandidate>();
    for (int i = 0; i < sorted.size(); ++i) {
      if (!dropped.contains(i)) {
        kept.add(sorted.get(i));
      }
    }
    return kept;
  }

  /**
   * Fit all candidates jointly as a sum of gaussians against the flattened spectrum.
   *
   * @param guesses Candidates used as the starting point
   * @param flat Flattened spectrum
   * @return gaussian parameters as rows of {mean, height, std}, ascending by mean
   * @throws FitError if the solver fails
   */
  public double[][] fitPeakGuess(List<PeakCandidate> guesses, double[] flat) throws FitError {
    if (guesses.isEmpty()) {
      return new double[0][3];
    }
    double[][] guessRows = new double[guesses.size()][];
    double[] start = new double[guesses.size() * 3];
    for (int i = 0; i < guessRows.length; ++i) {
      guessRows[i] = guesses.get(i).toArray();
      System.arraycopy(guessRows[i], 0, start, i * 3, 3);
    }

    ParameterBounds bounds = periodicMode.buildBounds(guessRows, algorithm.getCfBound(),
        settings.getGaussStdLimits(), freqRange);
    double[] fit = fitter.fit(periodicMode, freqs, flat, start, bounds,
        FitErrorKind.PEAK_NOT_CONVERGED, FitErrorKind.PEAK_SINGULAR);

    double[][] gaussianParams = new double[guesses.size()][];
    for (int i = 0; i < gaussianParams.length; ++i) {
      gaussianParams[i] = Arrays.copyOfRange(fit, i * 3, i * 3 + 3);
    }
    Arrays.sort(gaussianParams, Comparator.comparingDouble((double[] row) -> row[0]));
    return gaussianParams;
  }

}
