package org.atrack.api;

import org.atrack.application.pipeline.DetectionUseCase;
import org.atrack.application.pipeline.DetectionUseCase.DetectionResult;
import org.atrack.config.CompositionRoot;
import org.atrack.domain.Catalog;
import org.atrack.domain.MasterCatalog;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code atrack detect}: full pipeline from catalogs to {@code <out>/tracks.ndjson}.
 *
 * @since 0.1.0
 */
public final class DetectCli {
  private static final Logger log = LoggerFactory.getLogger(DetectCli.class);
  static final String SUMMARY_USAGE =
      "usage: atrack detect catalogs=DIR [out=DIR] [frames=PATH] [master=PATH] [workers=N] "
          + "[keepSegments=true|false] [mergeStrategy=GREEDY|CONNECTED] [pointIdentity=EXACT|TOLERANCE] "
          + "[config=PATH] [threshold=VALUE ...] [--dry-run] [--allow-overwrite] [--verbose]";
  static final String HELP_TEXT = """
      A-Track moving-object detection

      Usage:
        atrack detect catalogs=./catalogs out=./out [options]

      Required:
        catalogs=DIR             Directory of per-image catalogs; at least 3 are needed

      Optional:
        out=DIR                  Output root (default ~/.atrack/out)
        frames=PATH              Frame manifest (default catalogs/frames.yaml)
        master=PATH              Master catalog (default catalogs/master.*, else union of all catalogs)
        workers=N                Worker threads for filtering and triplet search
        keepSegments=true|false  Keep out/segments/worker-NNNN.ndjson after merging (default false)
        mergeStrategy=GREEDY|CONNECTED   Segment merge algorithm (default GREEDY)
        pointIdentity=EXACT|TOLERANCE    Shared-point test (default EXACT)
        pointTolerance=ARCSEC            Match radius for TOLERANCE
        config=PATH              YAML file with 'common' and 'detect' sections
        minFwhm=PX fwhmCoefficient=X maxFlux=F maxFlagSum=N maxElongation=E minSnr=S
        minTravel=PX maxHeight=PX pixelScale=ARCSEC maxAngularVelocity=ARCSEC_PER_S
        tolerance=PX minSpeed=ARCSEC_PER_MIN rejectArea='"x1:x2","y1:y2";...'
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL           OTLP endpoint when metricsExporter=otlp
        otelResourceAttributes=K=V Comma-separated resource attributes
        --dry-run                Validate and print the plan only
        --allow-overwrite        Permit a non-empty output directory
        --verbose                Enable DEBUG logging
        --help                   Show this message

      Notes:
        No moving objects is a normal outcome and exits 0.
      """;

  private static final PipelineCliSupport.Command COMMAND = new PipelineCliSupport.Command() {
    @Override
    public String mode() {
      return "detect";
    }

    @Override
    public String summaryUsage() {
      return SUMMARY_USAGE;
    }

    @Override
    public String helpText() {
      return HELP_TEXT;
    }

    @Override
    public List<String> plan(PipelineCliSupport.Settings settings) {
      List<String> lines = new ArrayList<>(PipelineCliSupport.commonPlan(
          "Detect dry-run: no files will be produced.", settings));
      lines.add(" Merge strategy    : " + settings.detection().mergeStrategy()
          + " / " + settings.detection().pointIdentity());
      lines.add(" Segment batches   : " + settings.run().segmentsDirectory()
          + (settings.run().keepSegments() ? " (kept)" : " (deleted after merge)"));
      lines.add(" Tracks file       : " + settings.run().tracksFile());
      lines.add(" Re-run without --dry-run to detect moving objects.");
      return lines;
    }

    @Override
    public void run(
        PipelineCliSupport.Settings settings, CompositionRoot root, List<Catalog> catalogs, MasterCatalog master)
        throws IOException, InterruptedException {
      DetectionUseCase useCase = root.detectUseCase();
      DetectionResult result = useCase.run(catalogs, master);
      log.info("Wrote {} tracks to {}", result.classification().all().size(), settings.run().tracksFile());
    }
  };

  private DetectCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    return PipelineCliSupport.execute(args, COMMAND, log);
  }
}
