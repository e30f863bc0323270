package asl.specparam.fit;

import asl.specparam.errors.FitError;
import asl.specparam.errors.FitErrorKind;
import asl.specparam.model.FitFunction;
import asl.specparam.model.ParameterBounds;
import asl.specparam.utils.NumericUtils;
import org.apache.commons.math3.exception.ConvergenceException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;
import org.apache.log4j.Logger;

/**
 * Bounded nonlinear least-squares fitting of a {@link FitFunction} to data over frequency.
 * Uses Levenberg-Marquardt with every trial point projected into the parameter bounds, and
 * translates solver failures into {@link FitError}s of the kinds given by the caller.
 */
public class CurveFitter {

  /**
   * Relative tolerance on cost and parameter change for convergence
   */
  public static final double TOLERANCE = 1E-8;

  private static final Logger logger = Logger.getLogger(CurveFitter.class);

  private final int maxEvaluations;

  /**
   * @param maxEvaluations limit on function evaluations, also used as the iteration limit
   */
  public CurveFitter(int maxEvaluations) {
    if (maxEvaluations < 1) {
      throw new IllegalArgumentException("Evaluation budget must be positive: "
          + maxEvaluations);
    }
    this.maxEvaluations = maxEvaluations;
  }

  public int getMaxEvaluations() {
    return maxEvaluations;
  }

  /**
   * Fit the function to the target values.
   *
   * @param function Function to fit
   * @param freqs Frequencies at which target values are given
   * @param target Values to fit the function to
   * @param start Initial parameter guess; it is clipped into the bounds before fitting
   * @param bounds Limits on each parameter
   * @param notConverged Kind of error to raise if the solver exhausts its budget
   * @param degenerate Kind of error to raise if the problem cannot be solved, including when
   * there are fewer observations than parameters
   * @return best-fit parameters
   * @throws FitError if the fit fails
   */
  public double[] fit(final FitFunction function, final double[] freqs, double[] target,
      double[] start, ParameterBounds bounds, FitErrorKind notConverged,
      FitErrorKind degenerate) throws FitError {

    if (freqs.length != target.length) {
      throw new IllegalArgumentException("Frequency and target lengths differ: "
          + freqs.length + ", " + target.length);
    }
    if (start.length != bounds.getDimension()) {
      throw new IllegalArgumentException("Guess has " + start.length
          + " parameters but bounds are given for " + bounds.getDimension());
    }
    if (freqs.length < start.length) {
      logger.debug("Only " + freqs.length + " points to fit " + start.length + " parameters");
      throw new FitError(degenerate);
    }

    MultivariateJacobianFunction model = new MultivariateJacobianFunction() {
      @Override
      public Pair<RealVector, RealMatrix> value(RealVector point) {
        double[] params = point.toArray();
        RealVector value = new ArrayRealVector(function.evaluate(freqs, params), false);
        RealMatrix jacobian = new Array2DRowRealMatrix(function.jacobian(freqs, params), false);
        return new Pair<RealVector, RealMatrix>(value, jacobian);
      }
    };

    LeastSquaresProblem lsp = new LeastSquaresBuilder().
        start(bounds.clip(start)).
        target(target).
        model(model).
        parameterValidator(bounds).
        lazyEvaluation(false).
        maxEvaluations(maxEvaluations).
        maxIterations(maxEvaluations).
        build();

    LeastSquaresOptimizer optimizer = new LevenbergMarquardtOptimizer().
        withCostRelativeTolerance(TOLERANCE).
        withParameterRelativeTolerance(TOLERANCE);

    LeastSquaresOptimizer.Optimum optimum;
    try {
      optimum = optimizer.optimize(lsp);
    } catch (TooManyEvaluationsException | TooManyIterationsException e) {
      throw new FitError(notConverged, e);
    } catch (ConvergenceException e) {
      throw new FitError(degenerate, e);
    }

    double[] fitParams = optimum.getPoint().toArray();
    if (!NumericUtils.allFinite(fitParams)) {
      throw new FitError(degenerate);
    }
    logger.debug("Fit converged after " + optimum.getEvaluations() + " evaluations, RMS "
        + optimum.getRMS());
    return fitParams;
  }

}
