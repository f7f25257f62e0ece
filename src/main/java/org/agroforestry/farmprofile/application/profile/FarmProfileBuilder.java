package org.agroforestry.farmprofile.application.profile;

import java.util.Map;
import org.agroforestry.farmprofile.application.extract.EnvironmentalExtractor;
import org.agroforestry.farmprofile.application.port.MetricsPort;
import org.agroforestry.farmprofile.application.port.RemoteQueryException;
import org.agroforestry.farmprofile.domain.geometry.Geometry;
import org.agroforestry.farmprofile.domain.geometry.GeometryParser;
import org.agroforestry.farmprofile.domain.profile.FarmProfile;
import org.agroforestry.farmprofile.logging.Logs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Assembles a complete farm profile from one geometry.
 * <p><strong>Why:</strong> Callers get one schema-compliant record per farm, or a failed record carrying the
 * cause, never an exception from the extraction layer.</p>
 * <p><strong>Role:</strong> Application use case invoked directly or per item by the bulk orchestrator.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Parse the geometry once; invalid geometry is a caller error and propagates.</li>
 *   <li>Extract every schema field sequentially and derive {@code coastal}.</li>
 *   <li>Carry pass-through attributes verbatim.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; one instance serves all bulk workers.</p>
 * <p><strong>Observability:</strong> Increments {@code profile.build.success} or {@code profile.build.failed};
 * failures log at WARN with the farm id.</p>
 *
 * @since 0.1.0
 */
public final class FarmProfileBuilder {
  private static final Logger log = LoggerFactory.getLogger(FarmProfileBuilder.class);

  private final ProfileAssembler assembler;
  private final MetricsPort metrics;
  private final int errorMessageMaxBytes;

  /**
   * Creates the builder.
   *
   * @param extractor typed attribute extraction
   * @param metrics metrics sink; {@code null} selects {@link MetricsPort#NO_OP}
   * @param errorMessageMaxBytes UTF-8 budget of the {@code error} column
   */
  public FarmProfileBuilder(EnvironmentalExtractor extractor, MetricsPort metrics, int errorMessageMaxBytes) {
    this.assembler = new ProfileAssembler(extractor);
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.errorMessageMaxBytes = errorMessageMaxBytes;
  }

  /**
   * Builds a profile without pass-through attributes.
   *
   * @param geometry raw or canonical geometry
   * @param year reference year, or {@code null} for the default year
   * @param farmId farm identifier
   * @return successful or failed profile
   */
  public FarmProfile build(Object geometry, Integer year, Object farmId) {
    return build(geometry, year, farmId, Map.of());
  }

  /**
   * Builds a profile.
   *
   * @param geometry raw or canonical geometry
   * @param year reference year, or {@code null} for the default year
   * @param farmId farm identifier; stored in string form
   * @param extras pass-through attributes, carried verbatim
   * @return successful profile, or a failed profile with {@code error} set; a missing id or a pass-through
   *     attribute that reuses a profile column also yields a failed profile
   * @throws org.agroforestry.farmprofile.domain.geometry.InvalidGeometryException if the geometry is invalid
   */
  public FarmProfile build(Object geometry, Integer year, Object farmId, Map<String, Object> extras) {
    String id = farmId == null ? "" : String.valueOf(farmId);
    Geometry parsed = GeometryParser.parse(geometry);
    int effectiveYear = year == null ? assembler.defaultYear() : year;

    try {
      if (farmId == null) {
        throw new IllegalArgumentException("Farm id is missing");
      }
      ProfileAssembler.requirePassThrough(extras);
      FarmProfile.Builder builder = FarmProfile.builder(id, effectiveYear).attributes(extras);
      FarmProfile profile = assembler.recompute(builder, ProfileAssembler.EXTRACTED, parsed, effectiveYear);
      metrics.increment("profile.build.success");
      return profile;
    } catch (RemoteQueryException | RuntimeException ex) {
      metrics.increment("profile.build.failed");
      log.warn("Profile build failed for farm {}: {}", id, ex.getMessage(), ex);
      return FarmProfile.builder(id, effectiveYear)
          .attributes(ProfileAssembler.carriedOnFailure(extras))
          .failed(Logs.describe(ex, errorMessageMaxBytes))
          .build();
    }
  }
}
