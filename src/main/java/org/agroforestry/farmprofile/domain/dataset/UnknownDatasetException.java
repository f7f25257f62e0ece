package org.agroforestry.farmprofile.domain.dataset;

/**
 * Raised when a dataset name is not present in the {@link DatasetRegistry}.
 *
 * @since 0.1.0
 */
public final class UnknownDatasetException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final String datasetName;

  /**
   * Creates an exception for the missing dataset.
   *
   * @param datasetName name that failed to resolve
   */
  public UnknownDatasetException(String datasetName) {
    super("Unknown dataset: " + datasetName);
    this.datasetName = datasetName;
  }

  /**
   * Returns the name that failed to resolve.
   *
   * @return dataset name as requested by the caller
   */
  public String datasetName() {
    return datasetName;
  }
}
