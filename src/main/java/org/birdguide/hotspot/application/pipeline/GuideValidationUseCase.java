package org.birdguide.hotspot.application.pipeline;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.birdguide.hotspot.application.port.GuideDocumentSource;
import org.birdguide.hotspot.application.port.GuideLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Re-reads a published guide and checks it for structural and numeric consistency.
 * <p><strong>Why:</strong> Catches guides truncated or edited after publication before they are served.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Require {@code metadata.json} and both indexes, with counts matching the files on disk.</li>
 *   <li>Check each species document: structure, strict ranks 1..n in rate-descending order.</li>
 *   <li>Check every occurrence: rate in [0, 1], detections not above checklists, rate matching
 *   detections / checklists within rounding, checklists at or above the recorded minimum.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe.</p>
 * <p><strong>Observability:</strong> Logs each failed check at WARN; the caller prints the report.</p>
 *
 * @implNote A document that exists but cannot be parsed fails the structure check instead of aborting, so one
 * damaged file does not hide the state of the others.
 * @since 0.1.0
 */
public final class GuideValidationUseCase {
  private static final Logger log = LoggerFactory.getLogger(GuideValidationUseCase.class);
  private static final int MAX_REPORTED = 5;
  private static final double RATE_TOLERANCE = 0.5 / Math.pow(10, GuideLayout.RATE_DECIMAL_PLACES) + 1e-9;

  private final GuideDocumentSource documents;

  /**
   * Creates a validator over a published guide.
   *
   * @param documents guide reader
   */
  public GuideValidationUseCase(GuideDocumentSource documents) {
    this.documents = Objects.requireNonNull(documents, "documents");
  }

  /**
   * Runs every check.
   *
   * @return report listing each check in order
   * @throws IOException if the guide directories cannot be listed
   */
  public ValidationReport run() throws IOException {
    MDC.put("guide.pass", "validate");
    try {
      List<ValidationReport.Check> checks = new ArrayList<>();
      Optional<Map<?, ?>> metadata = readObject(GuideLayout.METADATA);
      long minimum = metadata
          .flatMap(doc -> path(doc, "thresholds", "min_checklists"))
          .map(value -> ((Number) value).longValue())
          .orElse(-1L);
      checks.add(new ValidationReport.Check(
          "metadata",
          minimum > 0,
          metadata.isEmpty() ? "metadata.json missing or unreadable" : minimum > 0
              ? "min_checklists=" + minimum : "thresholds.min_checklists missing"));

      List<String> speciesFiles = documents.list(GuideLayout.SPECIES_DIR);
      List<String> hotspotFiles = documents.list(GuideLayout.HOTSPOTS_DIR);
      checks.add(indexCheck("species index", GuideLayout.SPECIES_INDEX, "total_species", "species",
          speciesFiles.size()));
      checks.add(indexCheck("hotspot index", GuideLayout.HOTSPOT_INDEX, "total_hotspots", "hotspots",
          hotspotFiles.size()));

      Violations structure = new Violations();
      Violations ranks = new Violations();
      Violations rates = new Violations();
      Violations totals = new Violations();
      long occurrences = 0;
      for (String file : speciesFiles) {
        Optional<Map<?, ?>> doc = readObject(file);
        Optional<Object> hotspots = doc.flatMap(d -> path(d, "hotspots"));
        if (doc.isEmpty() || path(doc.get(), "species", "common_name").isEmpty()
            || path(doc.get(), "summary").isEmpty() || !(hotspots.orElse(null) instanceof List<?>)) {
          structure.add(file + " lacks species, summary or hotspots");
          continue;
        }
        List<?> entries = (List<?>) hotspots.get();
        double previousRate = Double.MAX_VALUE;
        for (int i = 0; i < entries.size(); i++) {
          String where = file + "#" + (i + 1);
          if (!(entries.get(i) instanceof Map<?, ?> entry)) {
            structure.add(where + " is not an object");
            continue;
          }
          Object rank = entry.get("rank");
          if (!(rank instanceof Number) || ((Number) rank).intValue() != i + 1) {
            ranks.add(where + " has rank " + rank + ", expected " + (i + 1));
          }
          Optional<Double> rate = checkOccurrence(where, entry.get("occurrence"), minimum, structure, rates, totals);
          occurrences++;
          if (rate.isPresent()) {
            if (rate.get() > previousRate) {
              ranks.add(where + " rate " + rate.get() + " above previous " + previousRate);
            }
            previousRate = rate.get();
          }
        }
      }
      for (String file : hotspotFiles) {
        Optional<Map<?, ?>> doc = readObject(file);
        Optional<Object> species = doc.flatMap(d -> path(d, "species"));
        Optional<Object> total = doc.flatMap(d -> path(d, "checklists", "total"));
        if (doc.isEmpty() || path(doc.get(), "hotspot", "locality_id").isEmpty()
            || !(total.orElse(null) instanceof Number) || !(species.orElse(null) instanceof List<?>)) {
          structure.add(file + " lacks hotspot, checklists.total or species");
          continue;
        }
        long checklists = ((Number) total.get()).longValue();
        if (minimum > 0 && checklists < minimum) {
          totals.add(file + " has " + checklists + " checklists, below " + minimum);
        }
        List<?> entries = (List<?>) species.get();
        for (int i = 0; i < entries.size(); i++) {
          String where = file + "#" + (i + 1);
          Object entry = entries.get(i);
          checkOccurrence(where, entry instanceof Map<?, ?> map ? map.get("occurrence") : null,
              minimum, structure, rates, totals);
          occurrences++;
        }
      }

      checks.add(structure.toCheck("document structure",
          speciesFiles.size() + " species and " + hotspotFiles.size() + " hotspot documents"));
      checks.add(ranks.toCheck("species ranks", "strict ranks in rate order"));
      checks.add(rates.toCheck("occurrence rates", occurrences + " occurrences consistent"));
      checks.add(totals.toCheck("minimum checklists", "all totals >= " + minimum));

      ValidationReport report = new ValidationReport(documents.location(), checks);
      for (ValidationReport.Check failure : report.failures()) {
        log.warn("Validation failed: {}", failure.line());
      }
      log.info("Validated guide at {}: {}", documents.location(), report.passed() ? "PASS" : "FAIL");
      return report;
    } finally {
      MDC.remove("guide.pass");
    }
  }

  private ValidationReport.Check indexCheck(
      String name, String document, String totalKey, String listKey, int files) {
    Optional<Map<?, ?>> index = readObject(document);
    if (index.isEmpty()) {
      return new ValidationReport.Check(name, false, document + " missing or unreadable");
    }
    Object total = index.get().get(totalKey);
    Object list = index.get().get(listKey);
    if (!(total instanceof Number) || !(list instanceof List<?>)) {
      return new ValidationReport.Check(name, false, document + " lacks " + totalKey + " or " + listKey);
    }
    long declared = ((Number) total).longValue();
    int listed = ((List<?>) list).size();
    if (declared != listed || listed != files) {
      return new ValidationReport.Check(name, false,
          totalKey + "=" + declared + ", entries=" + listed + ", files=" + files);
    }
    return new ValidationReport.Check(name, true, declared + " entries");
  }

  private static Optional<Double> checkOccurrence(
      String where, Object node, long minimum, Violations structure, Violations rates, Violations totals) {
    if (!(node instanceof Map<?, ?> occurrence)) {
      structure.add(where + " lacks occurrence");
      return Optional.empty();
    }
    Object rateValue = occurrence.get("rate");
    Object detectionValue = occurrence.get("detection_count");
    Object totalValue = occurrence.get("total_checklists");
    if (!(rateValue instanceof Number) || !(detectionValue instanceof Number)
        || !(totalValue instanceof Number)) {
      structure.add(where + " lacks rate, detection_count or total_checklists");
      return Optional.empty();
    }
    double rate = ((Number) rateValue).doubleValue();
    long detections = ((Number) detectionValue).longValue();
    long total = ((Number) totalValue).longValue();
    if (rate < 0.0 || rate > 1.0) {
      rates.add(where + " rate " + rate + " outside [0, 1]");
    }
    if (detections > total) {
      rates.add(where + " has " + detections + " detections over " + total + " checklists");
    } else if (total > 0 && Math.abs(rate - (double) detections / total) > RATE_TOLERANCE) {
      rates.add(where + " rate " + rate + " does not match " + detections + "/" + total);
    }
    if (minimum > 0 && total < minimum) {
      totals.add(where + " has " + total + " checklists, below " + minimum);
    }
    return Optional.of(rate);
  }

  private Optional<Map<?, ?>> readObject(String relativePath) {
    try {
      Optional<Object> doc = documents.read(relativePath);
      if (doc.isPresent() && doc.get() instanceof Map<?, ?> map) {
        return Optional.of(map);
      }
      return Optional.empty();
    } catch (IOException ex) {
      log.warn("Unable to read {}: {}", relativePath, ex.getMessage());
      return Optional.empty();
    }
  }

  private static Optional<Object> path(Map<?, ?> root, String... keys) {
    Object current = root;
    for (String key : keys) {
      if (!(current instanceof Map<?, ?> map)) {
        return Optional.empty();
      }
      current = map.get(key);
    }
    return Optional.ofNullable(current);
  }

  private static final class Violations {
    private final List<String> samples = new ArrayList<>();
    private long count;

    private void add(String violation) {
      count++;
      if (samples.size() < MAX_REPORTED) {
        samples.add(violation);
      }
    }

    private ValidationReport.Check toCheck(String name, String passDetail) {
      if (count == 0) {
        return new ValidationReport.Check(name, true, passDetail);
      }
      String more = count > samples.size() ? " (+" + (count - samples.size()) + " more)" : "";
      return new ValidationReport.Check(name, false, String.join("; ", samples) + more);
    }
  }
}
