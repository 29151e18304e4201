package org.birdguide.hotspot.application.pipeline;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import org.birdguide.hotspot.application.port.ClockPort;
import org.birdguide.hotspot.application.port.GuideOutputPort;
import org.birdguide.hotspot.application.port.MetricsPort;
import org.birdguide.hotspot.application.port.RecordSource;
import org.birdguide.hotspot.application.port.RecordStream;
import org.birdguide.hotspot.config.GuideConfig;
import org.birdguide.hotspot.domain.ChecklistRecord;
import org.birdguide.hotspot.domain.ChecklistTotals;
import org.birdguide.hotspot.domain.DetectionTotals;
import org.birdguide.hotspot.domain.GuideBuild;
import org.birdguide.hotspot.domain.HotspotGuide;
import org.birdguide.hotspot.domain.HotspotTally;
import org.birdguide.hotspot.domain.ObservationRecord;
import org.birdguide.hotspot.domain.RankedHotspot;
import org.birdguide.hotspot.domain.RunMetadata;
import org.birdguide.hotspot.domain.SourceStats;
import org.birdguide.hotspot.domain.SpeciesGuide;
import org.birdguide.hotspot.util.ProjectVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Builds and publishes the hotspot guide from an eBird sampling file and observation file.
 * <p><strong>Why:</strong> Sequences the passes so every checklist total is final before a single rate is
 * computed.</p>
 * <p><strong>Role:</strong> Application-layer use case coordinating record sources, accumulators and the output
 * port.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Pass 1: stream the sampling file through {@link ChecklistAccumulator}.</li>
 *   <li>Pass 2: stream the observation file through {@link DetectionAccumulator}.</li>
 *   <li>Join with {@link OccurrenceCalculator}, order with {@link RankingAssembler} and publish.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one build per instance at a time.</p>
 * <p><strong>Performance:</strong> Two sequential streaming passes; memory bounded by the tallies plus one
 * chunk.</p>
 * <p><strong>Observability:</strong> MDC keys {@code guide.pass} and {@code guide.source}; metrics
 * {@code guide.pass.latencyMs}, {@code guide.build.latencyMs}, {@code guide.hotspots.excluded} and
 * {@code guide.results.emitted}.</p>
 *
 * @since 0.1.0
 */
public final class GuideBuildUseCase {
  private static final Logger log = LoggerFactory.getLogger(GuideBuildUseCase.class);
  private static final int SAMPLE_SIZE = 3;

  private final GuideConfig config;
  private final RecordSource<ChecklistRecord> checklistSource;
  private final RecordSource<ObservationRecord> observationSource;
  private final GuideOutputPort output;
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates a build use case.
   *
   * @param config build configuration
   * @param checklistSource sampling-event records
   * @param observationSource observation records
   * @param output publication target
   * @param metrics metrics sink
   * @param clock time source for run metadata
   */
  public GuideBuildUseCase(
      GuideConfig config,
      RecordSource<ChecklistRecord> checklistSource,
      RecordSource<ObservationRecord> observationSource,
      GuideOutputPort output,
      MetricsPort metrics,
      ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.checklistSource = Objects.requireNonNull(checklistSource, "checklistSource");
    this.observationSource = Objects.requireNonNull(observationSource, "observationSource");
    this.output = Objects.requireNonNull(output, "output");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Runs both passes, computes the guide and publishes it.
   *
   * @return the published build
   * @throws org.birdguide.hotspot.application.port.SourceReadException if an input cannot be read
   * @throws IOException if publication fails
   * @throws org.birdguide.hotspot.domain.ConsistencyFaultException if the tallies contradict each other
   */
  public GuideBuild run() throws IOException {
    long started = clock.nowMillis();
    MDC.put("guide.out", config.outputDirectory().toString());
    try {
      ChecklistAccumulator checklistAccumulator = new ChecklistAccumulator(metrics);
      SourceStats samplingStats = drain("checklists", checklistSource, checklistAccumulator::accept);
      ChecklistTotals checklists = checklistAccumulator.finish();
      log.info("Counted {} complete checklists at {} hotspots ({} duplicate rows, {} not qualifying)",
          checklists.totalChecklists(), checklists.size(), checklists.duplicateRows(),
          checklists.nonQualifyingRows());

      DetectionAccumulator detectionAccumulator = new DetectionAccumulator(metrics);
      SourceStats observationStats = drain("detections", observationSource, detectionAccumulator::accept);
      DetectionTotals detections = detectionAccumulator.finish();
      log.info("Tallied {} species-hotspot pairs ({} duplicate detections, {} rows on incomplete checklists)",
          detections.pairCount(), detections.duplicateRows(), detections.incompleteRows());

      OccurrenceCalculation calculation =
          new OccurrenceCalculator(config.thresholds(), config.seasons()).calculate(checklists, detections);
      List<HotspotTally> admitted = checklists.admitted(config.thresholds());
      int excluded = checklists.excludedBelowMinimum(config.thresholds());
      metrics.increment("guide.hotspots.excluded", excluded);
      if (calculation.pairsWithoutChecklists() > 0) {
        log.warn("{} species-hotspot pairs had no complete checklist total and were dropped",
            calculation.pairsWithoutChecklists());
      }
      log.info("Computed {} occurrences for {} species at {} hotspots ({} hotspots below {} checklists)",
          calculation.resultCount(), calculation.bySpecies().size(), admitted.size(), excluded,
          config.thresholds().minChecklists());

      RankingAssembler assembler = new RankingAssembler();
      List<SpeciesGuide> species = assembler.rankAll(calculation);
      List<HotspotGuide> hotspots = assembler.byHotspot(admitted, calculation);
      metrics.increment("guide.results.emitted", calculation.resultCount());

      RunMetadata metadata = new RunMetadata(
          clock.now(),
          ProjectVersion.current(),
          observationSource.name(),
          checklistSource.name(),
          config.thresholds(),
          config.seasons(),
          config.topN(),
          samplingStats,
          observationStats,
          checklists.totalChecklists(),
          admitted.size(),
          excluded,
          species.size(),
          checklists.duplicateRows(),
          detections.duplicateRows(),
          detections.incompleteRows(),
          calculation.pairsWithoutChecklists());
      GuideBuild build = new GuideBuild(species, hotspots, metadata);

      MDC.put("guide.pass", "publish");
      output.publish(build);
      long elapsed = clock.nowMillis() - started;
      metrics.observe("guide.build.latencyMs", elapsed);
      log.info("Published guide with {} species and {} hotspots to {} in {} ms",
          species.size(), hotspots.size(), config.outputDirectory(), elapsed);
      logSample(species);
      return build;
    } catch (IOException | RuntimeException ex) {
      log.error("Guide build failed: {}", ex.getMessage());
      throw ex;
    } finally {
      MDC.remove("guide.pass");
      MDC.remove("guide.out");
    }
  }

  private <T> SourceStats drain(String pass, RecordSource<T> source, Consumer<T> sink) throws IOException {
    MDC.put("guide.pass", pass);
    MDC.put("guide.source", source.name());
    long started = clock.nowMillis();
    try (RecordStream<T> stream = source.open()) {
      log.info("Starting {} pass over {}", pass, source.name());
      T record;
      while ((record = stream.next()) != null) {
        sink.accept(record);
      }
      SourceStats stats = stream.stats();
      long elapsed = clock.nowMillis() - started;
      metrics.observe("guide.pass.latencyMs", elapsed);
      log.info("Finished {} pass over {}: {} rows read, {} admitted, {} filtered, {} skipped in {} chunks",
          pass, source.name(), stats.rowsRead(), stats.rowsAdmitted(), stats.rowsFiltered(),
          stats.rowsSkipped(), stats.chunks());
      return stats;
    } finally {
      MDC.remove("guide.source");
    }
  }

  private void logSample(List<SpeciesGuide> species) {
    Optional<String> sample = config.sampleSpecies();
    if (sample.isEmpty()) {
      return;
    }
    Optional<SpeciesGuide> match = species.stream()
        .filter(guide -> guide.species().commonName().equalsIgnoreCase(sample.get()))
        .findFirst();
    if (match.isEmpty()) {
      log.debug("Sample species {} not present in this guide", sample.get());
      return;
    }
    log.info("Top hotspots for {}:", match.get().species().commonName());
    for (RankedHotspot ranked : match.get().top(SAMPLE_SIZE)) {
      log.info("  {}. {} ({}): {}/{} checklists",
          ranked.rank(), ranked.occurrence().hotspot().name(), ranked.occurrence().localityId(),
          ranked.occurrence().detectionCount(), ranked.occurrence().totalChecklists());
    }
  }
}
