package org.agroforestry.farmprofile.application.bulk;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.function.Function;
import org.agroforestry.farmprofile.application.port.MetricsPort;
import org.agroforestry.farmprofile.application.profile.FarmProfileBuilder;
import org.agroforestry.farmprofile.application.profile.FarmProfileUpdater;
import org.agroforestry.farmprofile.domain.profile.FarmProfile;
import org.agroforestry.farmprofile.infrastructure.exec.ExecutorFactories;
import org.agroforestry.farmprofile.logging.Logs;
import org.agroforestry.farmprofile.validation.Numbers;
import org.agroforestry.farmprofile.validation.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Builds or refreshes many farm profiles concurrently.
 * <p><strong>Why:</strong> Each profile costs several blocking remote round-trips; farms are independent, so
 * they are fanned out across a bounded worker pool.</p>
 * <p><strong>Role:</strong> Application use case on top of {@link FarmProfileBuilder} and
 * {@link FarmProfileUpdater}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Submit one task per input item to a pool of at most {@code maxWorkers} threads.</li>
 *   <li>Capture every per-item exception as that item's failed record.</li>
 *   <li>Return exactly one record per input, in input order, whatever the completion order.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent calls; each call owns its pool and result slots.</p>
 * <p><strong>Observability:</strong> Logs start and finish at INFO, per-item failures at WARN with the farm id in
 * MDC key {@code farmId}; records {@code bulk.item.latencyMs}.</p>
 *
 * @since 0.1.0
 */
public final class BulkOrchestrator {
  public static final String DEFAULT_GEOMETRY_FIELD = "geometry";
  public static final String DEFAULT_ID_FIELD = "farm_id";
  static final int MAX_WORKERS_LIMIT = 256;

  private static final Logger log = LoggerFactory.getLogger(BulkOrchestrator.class);
  private static final String MDC_FARM_ID = "farmId";

  private final FarmProfileBuilder builder;
  private final FarmProfileUpdater updater;
  private final MetricsPort metrics;
  private final int defaultYear;
  private final int defaultMaxWorkers;
  private final int errorMessageMaxBytes;

  /**
   * Creates the orchestrator.
   *
   * @param builder single-profile builder
   * @param updater single-profile updater
   * @param metrics metrics sink; {@code null} selects {@link MetricsPort#NO_OP}
   * @param defaultYear year stamped on failed records when the caller passes none
   * @param defaultMaxWorkers pool size used when the caller passes none
   * @param errorMessageMaxBytes UTF-8 budget of the {@code error} column
   */
  public BulkOrchestrator(FarmProfileBuilder builder, FarmProfileUpdater updater, MetricsPort metrics,
      int defaultYear, int defaultMaxWorkers, int errorMessageMaxBytes) {
    this.builder = Objects.requireNonNull(builder, "builder");
    this.updater = Objects.requireNonNull(updater, "updater");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.defaultYear = defaultYear;
    this.defaultMaxWorkers =
        (int) Numbers.requireRange("maxWorkers", defaultMaxWorkers, 1, MAX_WORKERS_LIMIT);
    this.errorMessageMaxBytes = errorMessageMaxBytes;
  }

  /**
   * Creates profiles using the default field names, year and worker count.
   *
   * @param items farm items
   * @return one record per item, in input order
   */
  public List<FarmProfile> bulkCreate(List<? extends Map<String, ?>> items) {
    return bulkCreate(items, DEFAULT_GEOMETRY_FIELD, DEFAULT_ID_FIELD, null, null);
  }

  /**
   * Creates profiles concurrently.
   *
   * @param items farm items; every key other than the geometry and id fields is a pass-through attribute
   * @param geometryField key holding the raw geometry
   * @param idField key holding the farm id
   * @param year reference year, or {@code null} for the default year
   * @param maxWorkers pool size (1-256), or {@code null} for the configured default
   * @return one record per item, in input order
   */
  public List<FarmProfile> bulkCreate(List<? extends Map<String, ?>> items, String geometryField, String idField,
      Integer year, Integer maxWorkers) {
    Objects.requireNonNull(items, "items");
    String geometryKey = Strings.requireNonBlank("geometryField", geometryField);
    String idKey = Strings.requireNonBlank("idField", idField);
    int effectiveYear = year == null ? defaultYear : year;

    List<ItemTask> tasks = new ArrayList<>(items.size());
    for (int i = 0; i < items.size(); i++) {
      Map<String, ?> item = items.get(i);
      Object rawId = item == null ? null : item.get(idKey);
      String id = rawId == null ? "" : String.valueOf(rawId);
      Map<String, Object> extras = passThrough(item, geometryKey, idKey);
      tasks.add(new ItemTask(id, effectiveYear, () -> {
        if (item == null) {
          throw new IllegalArgumentException("Farm item is null");
        }
        if (rawId == null) {
          throw new IllegalArgumentException("Farm item has no '" + idKey + "' field");
        }
        Object geometry = item.get(geometryKey);
        if (geometry == null) {
          throw new IllegalArgumentException("Farm " + id + " has no '" + geometryKey + "' field");
        }
        return builder.build(geometry, year, rawId, extras);
      }, ex -> FarmProfile.builder(id, effectiveYear)
          .attributes(extras)
          .failed(Logs.describe(ex, errorMessageMaxBytes))
          .build()));
    }
    return run("create", tasks, maxWorkers);
  }

  /**
   * Refreshes profiles concurrently.
   *
   * @param profiles existing profiles
   * @param geometries raw geometry per farm id; keys are matched in string form
   * @param fields data-dictionary keys to refresh, or {@code null} for a full refresh
   * @param year reference year, or {@code null} for the default year
   * @param maxWorkers pool size (1-256), or {@code null} for the configured default
   * @return one record per profile, in input order
   */
  public List<FarmProfile> bulkUpdate(List<FarmProfile> profiles, Map<?, ?> geometries, Collection<String> fields,
      Integer year, Integer maxWorkers) {
    Objects.requireNonNull(profiles, "profiles");
    Objects.requireNonNull(geometries, "geometries");
    Map<String, Object> byId = new LinkedHashMap<>();
    geometries.forEach((key, value) -> byId.put(String.valueOf(key), value));
    int effectiveYear = year == null ? defaultYear : year;

    List<ItemTask> tasks = new ArrayList<>(profiles.size());
    for (FarmProfile profile : profiles) {
      Objects.requireNonNull(profile, "profile");
      tasks.add(new ItemTask(profile.id(), effectiveYear, () -> {
        Object geometry = byId.get(profile.id());
        if (geometry == null) {
          throw new IllegalArgumentException("No geometry supplied for farm " + profile.id());
        }
        return updater.update(profile, geometry, fields, year);
      }, ex -> profile.toBuilder().year(effectiveYear).failed(Logs.describe(ex, errorMessageMaxBytes)).build()));
    }
    return run("update", tasks, maxWorkers);
  }

  private List<FarmProfile> run(String operation, List<ItemTask> tasks, Integer maxWorkers) {
    if (tasks.isEmpty()) {
      return List.of();
    }
    int requested = maxWorkers == null ? defaultMaxWorkers : maxWorkers;
    Numbers.requireRange("maxWorkers", requested, 1, MAX_WORKERS_LIMIT);
    int workers = Math.min(requested, tasks.size());
    log.info("Bulk {} started: {} farms on {} workers", operation, tasks.size(), workers);

    FarmProfile[] slots = new FarmProfile[tasks.size()];
    ThreadPoolExecutor executor = ExecutorFactories.newBulkPool(workers, tasks.size(), "farm-bulk",
        (thread, ex) -> log.error("Uncaught failure on bulk worker {}", thread.getName(), ex));
    List<Future<FarmProfile>> futures = new ArrayList<>(tasks.size());
    try {
      for (ItemTask task : tasks) {
        futures.add(executor.submit(task));
      }
      for (int i = 0; i < futures.size(); i++) {
        slots[i] = await(futures.get(i), tasks.get(i));
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Bulk {} interrupted; cancelling remaining farms", operation);
      for (Future<FarmProfile> future : futures) {
        future.cancel(true);
      }
    } finally {
      executor.shutdownNow();
    }

    int failed = 0;
    for (int i = 0; i < slots.length; i++) {
      if (slots[i] == null) {
        slots[i] = tasks.get(i).fail(new IllegalStateException("Bulk " + operation + " interrupted"));
      }
      if (!slots[i].isSuccess()) {
        failed++;
      }
    }
    log.info("Bulk {} finished: {} farms, {} failed", operation, slots.length, failed);
    return Collections.unmodifiableList(Arrays.asList(slots));
  }

  private static FarmProfile await(Future<FarmProfile> future, ItemTask task) throws InterruptedException {
    try {
      return future.get();
    } catch (ExecutionException ex) {
      return task.fail(ex.getCause() == null ? ex : ex.getCause());
    } catch (CancellationException ex) {
      return task.fail(ex);
    }
  }

  private static Map<String, Object> passThrough(Map<String, ?> item, String geometryKey, String idKey) {
    Map<String, Object> extras = new LinkedHashMap<>();
    if (item == null) {
      return extras;
    }
    item.forEach((key, value) -> {
      if (!geometryKey.equals(key) && !idKey.equals(key)) {
        extras.put(key, value);
      }
    });
    return extras;
  }

  /** One farm's work; converts any failure into that farm's failed record. */
  private final class ItemTask implements Callable<FarmProfile> {
    private final String farmId;
    private final int year;
    private final Callable<FarmProfile> work;
    private final Function<Throwable, FarmProfile> onFailure;

    private ItemTask(String farmId, int year, Callable<FarmProfile> work,
        Function<Throwable, FarmProfile> onFailure) {
      this.farmId = farmId;
      this.year = year;
      this.work = work;
      this.onFailure = onFailure;
    }

    @Override
    public FarmProfile call() {
      String previousFarmId = MDC.get(MDC_FARM_ID);
      long started = System.nanoTime();
      try {
        MDC.put(MDC_FARM_ID, farmId);
        return work.call();
      } catch (Exception ex) {
        log.warn("Farm {} failed: {}", farmId, ex.getMessage());
        return fail(ex);
      } finally {
        metrics.observe("bulk.item.latencyMs", (System.nanoTime() - started) / 1_000_000L);
        if (previousFarmId == null) {
          MDC.remove(MDC_FARM_ID);
        } else {
          MDC.put(MDC_FARM_ID, previousFarmId);
        }
      }
    }

    FarmProfile fail(Throwable cause) {
      try {
        return onFailure.apply(cause);
      } catch (IllegalArgumentException ex) {
        // Pass-through attributes that shadow a profile column cannot be carried on the failed record.
        return FarmProfile.builder(farmId, year).failed(Logs.describe(cause, errorMessageMaxBytes)).build();
      }
    }
  }
}
