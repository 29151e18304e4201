package org.birdguide.hotspot.infrastructure.source;

import static org.birdguide.hotspot.infrastructure.source.EbirdColumns.ALL_SPECIES_REPORTED;
import static org.birdguide.hotspot.infrastructure.source.EbirdColumns.LATITUDE;
import static org.birdguide.hotspot.infrastructure.source.EbirdColumns.LOCALITY;
import static org.birdguide.hotspot.infrastructure.source.EbirdColumns.LOCALITY_ID;
import static org.birdguide.hotspot.infrastructure.source.EbirdColumns.LOCALITY_TYPE;
import static org.birdguide.hotspot.infrastructure.source.EbirdColumns.LONGITUDE;
import static org.birdguide.hotspot.infrastructure.source.EbirdColumns.OBSERVATION_DATE;
import static org.birdguide.hotspot.infrastructure.source.EbirdColumns.SAMPLING_EVENT_IDENTIFIER;

import de.siegmar.fastcsv.reader.CsvRecord;
import java.util.List;
import org.birdguide.hotspot.domain.ChecklistRecord;

/** Maps sampling-event rows to {@link ChecklistRecord}s. */
public final class ChecklistRowMapper implements RowMapper<ChecklistRecord> {
  private static final List<String> REQUIRED = List.of(
      SAMPLING_EVENT_IDENTIFIER, LOCALITY_ID, LOCALITY, LOCALITY_TYPE, LATITUDE, LONGITUDE, OBSERVATION_DATE,
      ALL_SPECIES_REPORTED);

  @Override
  public List<String> requiredColumns() {
    return REQUIRED;
  }

  @Override
  public ChecklistRecord map(EbirdColumns columns, CsvRecord record) throws RowParseException {
    return new ChecklistRecord(
        columns.required(record, SAMPLING_EVENT_IDENTIFIER),
        columns.required(record, LOCALITY_ID),
        columns.optional(record, LOCALITY),
        EbirdFields.coordinate(LATITUDE, columns.required(record, LATITUDE), 90.0),
        EbirdFields.coordinate(LONGITUDE, columns.required(record, LONGITUDE), 180.0),
        EbirdFields.localityType(columns.required(record, LOCALITY_TYPE)),
        EbirdFields.complete(columns.required(record, ALL_SPECIES_REPORTED)),
        EbirdFields.month(columns.required(record, OBSERVATION_DATE)));
  }
}
