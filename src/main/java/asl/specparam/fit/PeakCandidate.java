package asl.specparam.fit;

/**
 * Initial guess at one gaussian peak, found by searching the flattened spectrum.
 */
public class PeakCandidate {

  private final double center;
  private final double height;
  private final double std;

  public PeakCandidate(double center, double height, double std) {
    this.center = center;
    this.height = height;
    this.std = std;
  }

  public double getCenter() {
    return center;
  }

  public double getHeight() {
    return height;
  }

  public double getStd() {
    return std;
  }

  /**
   * @return guess as {center, height, std}
   */
  public double[] toArray() {
    return new double[]{center, height, std};
  }

  @Override
  public String toString() {
    return "PeakCandidate{center=" + center + ", height=" + height + ", std=" + std + '}';
  }

}
