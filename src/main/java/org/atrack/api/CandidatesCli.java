package org.atrack.api;

import org.atrack.application.pipeline.DetectionUseCase;
import org.atrack.config.CompositionRoot;
import org.atrack.domain.CandidateSet;
import org.atrack.domain.Catalog;
import org.atrack.domain.MasterCatalog;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code atrack candidates}: filters every catalog against the master and writes {@code <out>/candidates/*.cnd}.
 *
 * @since 0.1.0
 */
public final class CandidatesCli {
  private static final Logger log = LoggerFactory.getLogger(CandidatesCli.class);
  static final String SUMMARY_USAGE =
      "usage: atrack candidates catalogs=DIR [out=DIR] [frames=PATH] [master=PATH] [workers=N] "
          + "[config=PATH] [threshold=VALUE ...] [--dry-run] [--allow-overwrite] [--verbose]";
  static final String HELP_TEXT = """
      A-Track candidate selection

      Usage:
        atrack candidates catalogs=./catalogs out=./out [options]

      Required:
        catalogs=DIR             Directory of per-image catalogs (*.cat, *.pysexcat, *.txt)

      Optional:
        out=DIR                  Output root (default ~/.atrack/out); candidates go to out/candidates
        frames=PATH              Frame manifest (default catalogs/frames.yaml)
        master=PATH              Master catalog (default catalogs/master.*, else union of all catalogs)
        workers=N                Worker threads (default: available processors)
        config=PATH              YAML file with 'common' and 'candidates' sections
        minFwhm=PX fwhmCoefficient=X maxFlux=F maxFlagSum=N maxElongation=E minSnr=S
        minTravel=PX pixelScale=ARCSEC rejectArea='"x1:x2","y1:y2";...'
        metricsExporter=otlp|none  Metrics exporter (default none)
        otelEndpoint=URL           OTLP endpoint when metricsExporter=otlp
        otelResourceAttributes=K=V Comma-separated resource attributes
        --dry-run                Validate and print the plan only
        --allow-overwrite        Permit a non-empty output directory
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private static final PipelineCliSupport.Command COMMAND = new PipelineCliSupport.Command() {
    @Override
    public String mode() {
      return "candidates";
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
          "Candidates dry-run: no files will be produced.", settings));
      lines.add(" Candidate files   : " + settings.run().candidatesDirectory());
      lines.add(" Re-run without --dry-run to select candidates.");
      return lines;
    }

    @Override
    public void run(
        PipelineCliSupport.Settings settings, CompositionRoot root, List<Catalog> catalogs, MasterCatalog master)
        throws IOException, InterruptedException {
      DetectionUseCase useCase = root.candidatesUseCase();
      CandidateSet candidates = useCase.selectCandidates(catalogs, master);
      log.info("Wrote candidates for {} images to {}", candidates.imageCount(),
          settings.run().candidatesDirectory());
    }
  };

  private CandidatesCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    return PipelineCliSupport.execute(args, COMMAND, log);
  }
}
