package org.atrack.application.pipeline;

import org.atrack.config.DetectionConfig;
import org.atrack.config.ExclusionZone;
import org.atrack.domain.Candidate;
import org.atrack.domain.Catalog;
import org.atrack.domain.ImageCandidates;
import org.atrack.domain.MasterCatalog;
import org.atrack.domain.SkyGeometry;
import org.atrack.domain.SourceRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reduces per-image source catalogs to transient candidates.
 * <p><strong>How:</strong> records pass a quality screen (flags, FWHM window, flux, background, SNR, elongation),
 * are dropped when inside an exclusion zone, and are kept only when fewer than two screened master records lie
 * within the transience radius.</p>
 * <p><strong>Failure mode:</strong> an empty master, or one whose mean FWHM is not finite, yields no candidates
 * for any image instead of an error.</p>
 * <p><strong>Thread-safety:</strong> Immutable; one instance serves all filter workers. The
 * {@link ScreenedMaster} is computed once per run and shared read-only.</p>
 *
 * @since 0.1.0
 */
public final class CandidateFilter {
  private static final Logger log = LoggerFactory.getLogger(CandidateFilter.class);
  private static final int STATIC_SOURCE_MATCHES = 2;

  private final DetectionConfig config;

  public CandidateFilter(DetectionConfig config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  /**
   * Derives the FWHM ceiling from the raw master and screens the master records.
   *
   * @param master stacked reference catalog
   * @return screened master; {@link ScreenedMaster#usable()} is {@code false} when no candidates can be selected
   */
  public ScreenedMaster screenMaster(MasterCatalog master) {
    Objects.requireNonNull(master, "master");
    double maxFwhm = master.meanFwhm() * config.fwhmCoefficient();
    if (master.isEmpty() || !Double.isFinite(maxFwhm)) {
      log.warn("Master catalog is empty or has no usable FWHM (records={}); no candidates will be selected",
          master.records().size());
      return new ScreenedMaster(Double.NaN, List.of(), false);
    }
    List<SourceRecord> kept = screen(master.records(), maxFwhm);
    log.debug("Master catalog screened: {} of {} records kept, maxFwhm={}",
        kept.size(), master.records().size(), maxFwhm);
    return new ScreenedMaster(maxFwhm, kept, true);
  }

  /**
   * Selects the transient candidates of one image.
   *
   * @param catalog image catalog
   * @param master screened master from {@link #screenMaster(MasterCatalog)}
   * @return candidates tagged with the catalog's image index
   */
  public ImageCandidates select(Catalog catalog, ScreenedMaster master) {
    Objects.requireNonNull(catalog, "catalog");
    Objects.requireNonNull(master, "master");
    if (!master.usable()) {
      return new ImageCandidates(catalog.imageIndex(), catalog.name(), catalog.metadata(), List.of());
    }
    List<SourceRecord> screened = screen(catalog.records(), master.maxFwhm());
    double radius = config.transienceRadiusRad();
    List<Candidate> candidates = new ArrayList<>();
    for (SourceRecord record : screened) {
      if (isTransient(record, master.records(), radius)) {
        candidates.add(new Candidate(catalog.imageIndex(), record));
      }
    }
    log.debug("Image {} ({}): {} records, {} screened, {} candidates",
        catalog.imageIndex(), catalog.name(), catalog.records().size(), screened.size(), candidates.size());
    return new ImageCandidates(catalog.imageIndex(), catalog.name(), catalog.metadata(), candidates);
  }

  /**
   * Applies the quality screen and the exclusion zones.
   *
   * @param records records in catalog order
   * @param maxFwhm FWHM ceiling
   * @return surviving records, order preserved
   */
  List<SourceRecord> screen(List<SourceRecord> records, double maxFwhm) {
    List<SourceRecord> kept = new ArrayList<>(records.size());
    for (SourceRecord record : records) {
      if (passesQuality(record, maxFwhm) && !isExcluded(record)) {
        kept.add(record);
      }
    }
    return kept;
  }

  boolean passesQuality(SourceRecord record, double maxFwhm) {
    return record.flag() <= config.maxFlagSum()
        && record.fwhm() >= config.minFwhm()
        && record.fwhm() <= maxFwhm
        && record.flux() <= config.maxFlux()
        && record.flux() > record.background()
        && record.snr() > config.minSnr()
        && record.elongation() <= config.maxElongation();
  }

  boolean isExcluded(SourceRecord record) {
    for (ExclusionZone zone : config.exclusionZones()) {
      if (zone.contains(record.x(), record.y())) {
        return true;
      }
    }
    return false;
  }

  private static boolean isTransient(SourceRecord record, List<SourceRecord> master, double radius) {
    int matches = 0;
    for (SourceRecord reference : master) {
      if (SkyGeometry.isWithin(reference, record, radius)) {
        matches++;
        if (matches >= STATIC_SOURCE_MATCHES) {
          return false;
        }
      }
    }
    return true;
  }

  /**
   * Master catalog after screening, with the FWHM ceiling derived from the unscreened records.
   *
   * @param maxFwhm FWHM ceiling applied to every catalog of the run
   * @param records screened master records
   * @param usable whether candidates can be selected at all
   */
  public record ScreenedMaster(double maxFwhm, List<SourceRecord> records, boolean usable) {
    public ScreenedMaster {
      records = List.copyOf(Objects.requireNonNull(records, "records"));
    }
  }
}
