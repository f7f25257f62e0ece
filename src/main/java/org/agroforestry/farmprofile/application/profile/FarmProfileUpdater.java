package org.agroforestry.farmprofile.application.profile;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import org.agroforestry.farmprofile.application.extract.EnvironmentalExtractor;
import org.agroforestry.farmprofile.application.port.MetricsPort;
import org.agroforestry.farmprofile.application.port.RemoteQueryException;
import org.agroforestry.farmprofile.domain.geometry.Geometry;
import org.agroforestry.farmprofile.domain.geometry.GeometryParser;
import org.agroforestry.farmprofile.domain.profile.FarmProfile;
import org.agroforestry.farmprofile.domain.profile.ProfileField;
import org.agroforestry.farmprofile.logging.Logs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Refreshes an existing farm profile, fully or for selected fields.
 * <p><strong>Why:</strong> Yearly data (rainfall, temperature) changes while terrain and location do not; a
 * selective refresh avoids re-querying year-invariant datasets.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>With {@code fields == null}, recompute every schema field.</li>
 *   <li>Otherwise recompute only the listed temporal fields; listed year-invariant fields are skipped.</li>
 *   <li>Keep the id and pass-through attributes untouched; stamp the requested year.</li>
 *   <li>On failure, return the pre-update values with {@code status=failed}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; one instance serves all bulk workers.</p>
 * <p><strong>Observability:</strong> Increments {@code profile.update.success} or {@code profile.update.failed}.</p>
 *
 * @since 0.1.0
 */
public final class FarmProfileUpdater {
  private static final Logger log = LoggerFactory.getLogger(FarmProfileUpdater.class);

  private final ProfileAssembler assembler;
  private final MetricsPort metrics;
  private final int errorMessageMaxBytes;

  /**
   * Creates the updater.
   *
   * @param extractor typed attribute extraction
   * @param metrics metrics sink; {@code null} selects {@link MetricsPort#NO_OP}
   * @param errorMessageMaxBytes UTF-8 budget of the {@code error} column
   */
  public FarmProfileUpdater(EnvironmentalExtractor extractor, MetricsPort metrics, int errorMessageMaxBytes) {
    this.assembler = new ProfileAssembler(extractor);
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.errorMessageMaxBytes = errorMessageMaxBytes;
  }

  /**
   * Updates a profile.
   *
   * @param existing profile to refresh; never modified
   * @param geometry raw or canonical geometry of the farm
   * @param fields data-dictionary keys to refresh, or {@code null} for a full refresh
   * @param year reference year, or {@code null} for the default year
   * @return new profile carrying the requested year; failed, with the previous values, when a field key is
   *     unknown or a recomputation fails
   * @throws org.agroforestry.farmprofile.domain.geometry.InvalidGeometryException if the geometry is invalid
   */
  public FarmProfile update(FarmProfile existing, Object geometry, Collection<String> fields, Integer year) {
    Objects.requireNonNull(existing, "existing");
    Geometry parsed = GeometryParser.parse(geometry);
    int effectiveYear = year == null ? assembler.defaultYear() : year;

    try {
      Set<ProfileField> targets = fields == null ? ProfileAssembler.EXTRACTED : temporalOnly(existing, fields);
      FarmProfile.Builder builder = existing.toBuilder().year(effectiveYear).succeeded();
      FarmProfile updated = assembler.recompute(builder, targets, parsed, effectiveYear);
      metrics.increment("profile.update.success");
      return updated;
    } catch (RemoteQueryException | RuntimeException ex) {
      metrics.increment("profile.update.failed");
      log.warn("Profile update failed for farm {}: {}", existing.id(), ex.getMessage(), ex);
      return existing.toBuilder()
          .year(effectiveYear)
          .failed(Logs.describe(ex, errorMessageMaxBytes))
          .build();
    }
  }

  private static Set<ProfileField> temporalOnly(FarmProfile existing, Collection<String> keys) {
    Set<ProfileField> selected = EnumSet.noneOf(ProfileField.class);
    for (ProfileField field : ProfileField.fromKeys(keys)) {
      if (field.temporal()) {
        selected.add(field);
      } else {
        log.debug("Farm {}: field {} does not vary by year; keeping existing value", existing.id(), field.key());
      }
    }
    return selected;
  }
}
