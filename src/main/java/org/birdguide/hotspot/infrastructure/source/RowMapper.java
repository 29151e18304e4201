package org.birdguide.hotspot.infrastructure.source;

import de.siegmar.fastcsv.reader.CsvRecord;
import java.util.List;

/**
 * Converts one eBird data row into a typed record.
 *
 * @param <T> record type
 * @since 0.1.0
 */
public interface RowMapper<T> {
  /**
   * Columns that must be present in the header.
   *
   * @return column names
   */
  List<String> requiredColumns();

  /**
   * Maps a data row.
   *
   * @param columns header index
   * @param record data row
   * @return typed record
   * @throws RowParseException if a required field is missing or malformed
   */
  T map(EbirdColumns columns, CsvRecord record) throws RowParseException;
}
