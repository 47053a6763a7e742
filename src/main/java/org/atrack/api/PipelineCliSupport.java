package org.atrack.api;

import org.atrack.application.pipeline.MasterCatalogBuilder;
import org.atrack.application.port.CatalogSource;
import org.atrack.config.CompositionRoot;
import org.atrack.config.ConfigMerger;
import org.atrack.config.DefaultsForMode;
import org.atrack.config.DetectionConfig;
import org.atrack.config.RunConfig;
import org.atrack.config.YamlConfigLoader;
import org.atrack.domain.Catalog;
import org.atrack.domain.MasterCatalog;
import org.atrack.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import org.atrack.infrastructure.metrics.TelemetrySettings;
import org.atrack.infrastructure.persistence.MasterCatalogWriter;
import org.atrack.logging.LoggingConfigurator;
import org.atrack.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Shared argument handling and run lifecycle for the {@code candidates} and {@code detect}
 * commands.
 * <p><strong>Flow:</strong> flags, {@code key=value} parsing, YAML loading, precedence merge, telemetry and config
 * records, path validation, then either a dry-run plan or the run itself with catalogs and master loaded.</p>
 * <p><strong>Exit codes:</strong> argument, YAML and path problems map to {@link ExitCode#INVALID_ARGS}; failures
 * during the run map by exception type.</p>
 *
 * @since 0.1.0
 */
final class PipelineCliSupport {
  static final String RUN_MDC_KEY = "atrack.run";
  static final int MIN_CATALOGS = 3;
  static final String MASTER_FILE = "master.cat";

  private PipelineCliSupport() {}

  /** Resolved settings of one command invocation. */
  record Settings(
      RunConfig run,
      DetectionConfig detection,
      TelemetrySettings telemetry,
      Path framesManifest,
      boolean dryRun,
      boolean allowOverwrite) {}

  /** Command-specific behavior plugged into {@link #execute}. */
  interface Command {
    /** Mode name used for YAML sections and defaults. */
    String mode();

    String summaryUsage();

    String helpText();

    /** Lines printed by {@code --dry-run} after validation. */
    List<String> plan(Settings settings);

    /** Runs the command with catalogs and master already loaded. */
    void run(Settings settings, CompositionRoot root, List<Catalog> catalogs, MasterCatalog master)
        throws IOException, InterruptedException;
  }

  static ExitCode execute(String[] args, Command command, Logger log) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(command.helpText().stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose() && LoggingConfigurator.enableVerboseLogging()) {
      log.debug("Verbose logging enabled for {}", command.mode());
    }

    Settings settings;
    try {
      settings = resolveSettings(input, command, log);
    } catch (IOException ex) {
      log.error("Unable to read configuration for {}", command.mode(), ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", command.mode(), ex.getMessage());
      CliPrinter.println(command.summaryUsage());
      return ExitCode.INVALID_ARGS;
    }

    if (settings.dryRun()) {
      CliPrinter.printLines(command.plan(settings));
      return ExitCode.SUCCESS;
    }
    return runCommand(settings, command, log);
  }

  private static Settings resolveSettings(CliInput input, Command command, Logger log) throws IOException {
    Map<String, String> cli = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    String configPath = ConfigCliUtils.extractConfigPath(cli);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.isRegularFile(yamlPath)) {
        throw new IllegalArgumentException("configuration file does not exist: " + yamlPath);
      }
      yaml = YamlConfigLoader.load(yamlPath, command.mode());
    }

    Map<String, String> effective = new LinkedHashMap<>(ConfigMerger.buildEffectiveConfig(
        command.mode(), yaml, cli, DefaultsForMode.asFlatMap(command.mode()), log::warn));
    boolean dryRun = input.hasFlag(CliInput.DRY_RUN) || ConfigCliUtils.parseBoolean(effective, "dryRun", false);
    boolean allowOverwrite = input.hasFlag(CliInput.ALLOW_OVERWRITE)
        || ConfigCliUtils.parseBoolean(effective, "allowOverwrite", false);

    TelemetrySettings telemetry = TelemetryConfigurator.configure(effective);
    DetectionConfig detection = DetectionConfig.fromMap(effective);
    RunConfig run = RunConfig.fromMap(effective);

    Paths.requireReadableDirectory("catalogs", run.catalogDirectory());
    Path manifest = Paths.requireReadableFile("frames", run.effectiveFramesManifest());
    run.masterCatalog().ifPresent(master -> Paths.requireReadableFile("master", master));
    Paths.validateWritableDir(run.outputDirectory(), !dryRun, allowOverwrite);
    return new Settings(run, detection, telemetry, manifest, dryRun, allowOverwrite);
  }

  private static ExitCode runCommand(Settings settings, Command command, Logger log) {
    RunConfig run = settings.run();
    MDC.put(RUN_MDC_KEY, run.catalogDirectory().toString());
    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter(settings.telemetry())) {
      CompositionRoot root = new CompositionRoot(settings.detection(), run, metrics);
      CatalogSource source = root.catalogSource();
      List<Catalog> catalogs = source.loadCatalogs();
      if (catalogs.size() < MIN_CATALOGS) {
        log.error("At least {} catalogs are required in {} (found {})",
            MIN_CATALOGS, run.catalogDirectory(), catalogs.size());
        CliPrinter.println(command.summaryUsage());
        return ExitCode.INVALID_ARGS;
      }
      MasterCatalog master = loadOrBuildMaster(source, catalogs, run, log);
      command.run(settings, root, catalogs, master);
      metrics.forceFlush();
      log.info("{} completed for {}", command.mode(), run.catalogDirectory());
      return ExitCode.SUCCESS;
    } catch (IllegalArgumentException ex) {
      log.error("{} configuration error: {}", command.mode(), ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("{} I/O failure for {}", command.mode(), run.catalogDirectory(), ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("{} interrupted; shutting down", command.mode(), ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in {}", command.mode(), ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      MDC.remove(RUN_MDC_KEY);
    }
  }

  private static MasterCatalog loadOrBuildMaster(
      CatalogSource source, List<Catalog> catalogs, RunConfig run, Logger log) throws IOException {
    Optional<MasterCatalog> loaded = source.loadMaster();
    if (loaded.isPresent()) {
      return loaded.get();
    }
    MasterCatalog master = MasterCatalogBuilder.union(catalogs);
    Path file = run.outputDirectory().resolve(MASTER_FILE);
    MasterCatalogWriter.write(master, file);
    log.info("No master catalog supplied; wrote union of {} catalogs ({} records) to {}",
        catalogs.size(), master.records().size(), file);
    return master;
  }

  /** Common dry-run lines shared by both commands. */
  static List<String> commonPlan(String title, Settings settings) {
    RunConfig run = settings.run();
    DetectionConfig detection = settings.detection();
    return List.of(
        title,
        " Catalog directory : " + run.catalogDirectory(),
        " Frame manifest    : " + settings.framesManifest(),
        " Master catalog    : " + run.masterCatalog().map(Path::toString)
            .orElse("<master.* in catalogs or union of all catalogs>"),
        " Output directory  : " + run.outputDirectory(),
        " Workers           : " + run.workers(),
        " Pixel scale       : " + detection.pixelScale() + " arcsec/px",
        " Exclusion zones   : " + detection.exclusionZones().size(),
        " Metrics exporter  : " + settings.telemetry().exporter(),
        " Allow overwrite   : " + settings.allowOverwrite());
  }
}
