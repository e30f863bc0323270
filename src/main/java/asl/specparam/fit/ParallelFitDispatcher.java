package asl.specparam.fit;

import asl.specparam.errors.FitError;
import asl.specparam.input.SpectralData;
import asl.specparam.output.FitResult;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.apache.log4j.Logger;

/**
 * Runs fits on a fixed-size thread pool. Each spectrum is fit exactly as
 * {@link SpectrumFitter#fit(SpectralData)} would fit it alone.
 */
public class ParallelFitDispatcher implements FitDispatcher, AutoCloseable {

  private static final Logger logger = Logger.getLogger(ParallelFitDispatcher.class);

  private final SpectrumFitter fitter;
  private final ExecutorService threadPool;

  /**
   * Create a dispatcher using one thread per available processor
   *
   * @param fitter Fitter applied to each spectrum
   */
  public ParallelFitDispatcher(SpectrumFitter fitter) {
    this(fitter, Runtime.getRuntime().availableProcessors());
  }

  public ParallelFitDispatcher(SpectrumFitter fitter, int threadCount) {
    this.fitter = fitter;
    threadPool = Executors.newFixedThreadPool(Math.max(threadCount, 1));
    logger.info("Fit dispatcher started with " + Math.max(threadCount, 1) + " threads");
  }

  @Override
  public List<FitResult> fitAll(List<SpectralData> spectra) throws FitError {
    List<Future<FitResult>> futures = new ArrayList<Future<FitResult>>();
    for (final SpectralData data : spectra) {
      futures.add(threadPool.submit(new Callable<FitResult>() {
        @Override
        public FitResult call() throws FitError {
          return fitter.fit(data);
        }
      }));
    }

    List<FitResult> results = new ArrayList<FitResult>();
    try {
      for (Future<FitResult> future : futures) {
        results.add(future.get());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      cancelAll(futures);
      throw new IllegalStateException("Interrupted while waiting for fits to finish", e);
    } catch (ExecutionException e) {
      cancelAll(futures);
      Throwable cause = e.getCause();
      if (cause instanceof FitError) {
        throw (FitError) cause;
      }
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw new IllegalStateException("Unexpected failure while fitting", cause);
    }
    return results;
  }

  private static void cancelAll(List<Future<FitResult>> futures) {
    for (Future<FitResult> future : futures) {
      future.cancel(true);
    }
  }

  @Override
  public void close() {
    threadPool.shutdown();
  }

}
