package asl.specparam.fit;

import asl.specparam.errors.FitError;
import asl.specparam.input.SpectralData;
import asl.specparam.output.FitResult;
import java.util.List;

/**
 * Fits many spectra independently with one fitter.
 */
public interface FitDispatcher {

  /**
   * Fit each spectrum in the list
   *
   * @param spectra Spectra to fit
   * @return one result per spectrum, in the same order as the input
   * @throws FitError if the fitter is in debug mode and any fit failed
   */
  List<FitResult> fitAll(List<SpectralData> spectra) throws FitError;

}
