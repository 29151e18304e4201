package org.birdguide.hotspot.infrastructure.source;

import de.siegmar.fastcsv.reader.CsvParseException;
import de.siegmar.fastcsv.reader.CsvReader;
import de.siegmar.fastcsv.reader.CsvRecord;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.Objects;
import java.util.function.Predicate;
import org.birdguide.hotspot.application.port.MetricsPort;
import org.birdguide.hotspot.application.port.RecordSource;
import org.birdguide.hotspot.application.port.RecordStream;
import org.birdguide.hotspot.application.port.SourceReadException;
import org.birdguide.hotspot.domain.SourceStats;
import org.birdguide.hotspot.logging.Logs;
import org.birdguide.hotspot.util.PathUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Tab-separated eBird file exposed as a restartable {@link RecordSource}.
 * <p><strong>Why:</strong> eBird Basic Dataset exports run to tens of gigabytes; rows must be streamed in
 * bounded chunks rather than loaded.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open a fresh FastCSV reader on every {@link #open()} and index the header.</li>
 *   <li>Map rows, skipping and counting malformed ones.</li>
 *   <li>Apply the admission filter, counting rejected rows as filtered.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> The source is immutable; each opened stream belongs to one consumer.</p>
 * <p><strong>Performance:</strong> Holds at most {@code chunkSize} admitted records at a time.</p>
 * <p><strong>Observability:</strong> Counters {@code guide.<label>.rows.read}, {@code .rows.skipped},
 * {@code .rows.filtered}; observation {@code guide.<label>.chunk.rows}; skipped rows at DEBUG.</p>
 *
 * @param <T> record type
 * @since 0.1.0
 */
public final class TsvRecordSource<T> implements RecordSource<T> {
  private static final Logger log = LoggerFactory.getLogger(TsvRecordSource.class);
  private static final int MAX_LOGGED_ROW_BYTES = 512;
  private static final char NO_QUOTE = '\u0000';

  private final Path file;
  private final String label;
  private final int chunkSize;
  private final RowMapper<T> mapper;
  private final Predicate<? super T> admission;
  private final MetricsPort metrics;

  /**
   * Creates a source.
   *
   * @param file tab-separated input file
   * @param label metric label, e.g. {@code sampling}
   * @param chunkSize rows read per chunk; must be positive
   * @param mapper row mapper
   * @param admission row-level admission filter
   * @param metrics metrics sink
   */
  public TsvRecordSource(
      Path file,
      String label,
      int chunkSize,
      RowMapper<T> mapper,
      Predicate<? super T> admission,
      MetricsPort metrics) {
    this.file = Objects.requireNonNull(file, "file");
    this.label = Objects.requireNonNull(label, "label");
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("chunkSize must be positive");
    }
    this.chunkSize = chunkSize;
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.admission = Objects.requireNonNull(admission, "admission");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public String name() {
    return PathUtils.displayName(file);
  }

  public Path file() {
    return file;
  }

  @Override
  public RecordStream<T> open() throws SourceReadException {
    CsvReader<CsvRecord> reader;
    try {
      // eBird exports are unquoted; a stray '"' must not join rows
      reader = CsvReader.builder()
          .fieldSeparator('\t')
          .quoteCharacter(NO_QUOTE)
          .ignoreDifferentFieldCount(true)
          .ofCsvRecord(file);
    } catch (IOException ex) {
      throw new SourceReadException("Unable to open " + file + ": " + ex.getMessage(), ex);
    }
    try {
      Iterator<CsvRecord> rows = reader.iterator();
      if (!rows.hasNext()) {
        throw new SourceReadException(file + " is empty; expected a header row");
      }
      EbirdColumns columns = EbirdColumns.fromHeader(name(), rows.next().getFields(), mapper.requiredColumns());
      log.debug("Opened {} with chunk size {}", file, chunkSize);
      return new Stream(reader, rows, columns);
    } catch (SourceReadException | RuntimeException ex) {
      closeQuietly(reader, ex);
      if (ex instanceof UncheckedIOException || ex instanceof CsvParseException) {
        throw new SourceReadException("Unable to read header of " + file + ": " + ex.getMessage(), ex);
      }
      throw ex;
    }
  }

  private static void closeQuietly(CsvReader<CsvRecord> reader, Exception primary) {
    try {
      reader.close();
    } catch (IOException closeFailure) {
      primary.addSuppressed(closeFailure);
    }
  }

  private final class Stream implements RecordStream<T> {
    private final CsvReader<CsvRecord> reader;
    private final Iterator<CsvRecord> rows;
    private final EbirdColumns columns;
    private final ArrayDeque<T> buffer = new ArrayDeque<>();
    private boolean exhausted;
    private long read;
    private long admitted;
    private long filtered;
    private long skipped;
    private long chunks;

    private Stream(CsvReader<CsvRecord> reader, Iterator<CsvRecord> rows, EbirdColumns columns) {
      this.reader = reader;
      this.rows = rows;
      this.columns = columns;
    }

    @Override
    public T next() throws SourceReadException {
      while (buffer.isEmpty() && !exhausted) {
        fill();
      }
      return buffer.poll();
    }

    private void fill() throws SourceReadException {
      int inChunk = 0;
      try {
        while (inChunk < chunkSize && rows.hasNext()) {
          CsvRecord row = rows.next();
          inChunk++;
          read++;
          metrics.increment("guide." + label + ".rows.read");
          T record;
          try {
            record = mapper.map(columns, row);
          } catch (RowParseException | IllegalArgumentException ex) {
            skipped++;
            metrics.increment("guide." + label + ".rows.skipped");
            if (log.isDebugEnabled()) {
              log.debug("Skipping {} line {}: {} [{}]", name(), row.getStartingLineNumber(), ex.getMessage(),
                  Logs.row(row.getFields(), MAX_LOGGED_ROW_BYTES));
            }
            continue;
          }
          if (admission.test(record)) {
            admitted++;
            buffer.add(record);
          } else {
            filtered++;
            metrics.increment("guide." + label + ".rows.filtered");
          }
        }
      } catch (UncheckedIOException | CsvParseException ex) {
        throw new SourceReadException(
            "Failed reading " + file + " after " + read + " rows: " + ex.getMessage(), ex);
      }
      if (inChunk < chunkSize) {
        exhausted = true;
      }
      if (inChunk > 0) {
        chunks++;
        metrics.observe("guide." + label + ".chunk.rows", inChunk);
        log.debug("Read chunk {} of {}: {} rows, {} admitted so far", chunks, name(), inChunk, admitted);
      }
    }

    @Override
    public SourceStats stats() {
      return new SourceStats(name(), read, admitted, filtered, skipped, chunks);
    }

    @Override
    public void close() throws IOException {
      buffer.clear();
      reader.close();
    }
  }
}
