package org.agroforestry.farmprofile.domain.dataset;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Read-only table of dataset descriptors keyed by dataset name.
 * <p><strong>Why:</strong> Built once at startup and passed explicitly to the components that resolve datasets,
 * instead of being consulted as ambient global state.</p>
 * <p><strong>Role:</strong> Domain lookup consumed by the extraction engine.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction; safe for unsynchronized concurrent reads.</p>
 *
 * @since 0.1.0
 * @see org.agroforestry.farmprofile.config.DatasetCatalogLoader
 */
public final class DatasetRegistry {
  private final Map<String, DatasetConfig> datasets;

  private DatasetRegistry(Map<String, DatasetConfig> datasets) {
    this.datasets = datasets;
  }

  /**
   * Creates a registry from descriptors, preserving their iteration order.
   *
   * @param configs dataset descriptors; names must be unique
   * @return immutable registry
   * @throws IllegalArgumentException if two descriptors share a name
   */
  public static DatasetRegistry of(Collection<DatasetConfig> configs) {
    Objects.requireNonNull(configs, "configs");
    Map<String, DatasetConfig> map = new LinkedHashMap<>();
    for (DatasetConfig config : configs) {
      Objects.requireNonNull(config, "config");
      if (map.putIfAbsent(config.name(), config) != null) {
        throw new IllegalArgumentException("Duplicate dataset name: " + config.name());
      }
    }
    return new DatasetRegistry(map);
  }

  /**
   * Resolves a dataset by name.
   *
   * @param name dataset key, e.g. {@code rainfall}
   * @return matching descriptor
   * @throws UnknownDatasetException if no dataset carries that name
   */
  public DatasetConfig get(String name) {
    DatasetConfig config = name == null ? null : datasets.get(name);
    if (config == null) {
      throw new UnknownDatasetException(name);
    }
    return config;
  }

  /**
   * Reports whether a dataset is configured.
   *
   * @param name dataset key
   * @return {@code true} when {@link #get(String)} would succeed
   */
  public boolean contains(String name) {
    return name != null && datasets.containsKey(name);
  }

  /**
   * Lists configured dataset names in catalog order.
   *
   * @return unmodifiable ordered set of names
   */
  public Set<String> list() {
    return Collections.unmodifiableSet(datasets.keySet());
  }
}
