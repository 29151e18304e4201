package org.birdguide.hotspot.infrastructure.source;

import static org.birdguide.hotspot.infrastructure.source.EbirdColumns.ALL_SPECIES_REPORTED;
import static org.birdguide.hotspot.infrastructure.source.EbirdColumns.CATEGORY;
import static org.birdguide.hotspot.infrastructure.source.EbirdColumns.COMMON_NAME;
import static org.birdguide.hotspot.infrastructure.source.EbirdColumns.LATITUDE;
import static org.birdguide.hotspot.infrastructure.source.EbirdColumns.LOCALITY;
import static org.birdguide.hotspot.infrastructure.source.EbirdColumns.LOCALITY_ID;
import static org.birdguide.hotspot.infrastructure.source.EbirdColumns.LOCALITY_TYPE;
import static org.birdguide.hotspot.infrastructure.source.EbirdColumns.LONGITUDE;
import static org.birdguide.hotspot.infrastructure.source.EbirdColumns.OBSERVATION_COUNT;
import static org.birdguide.hotspot.infrastructure.source.EbirdColumns.OBSERVATION_DATE;
import static org.birdguide.hotspot.infrastructure.source.EbirdColumns.SAMPLING_EVENT_IDENTIFIER;
import static org.birdguide.hotspot.infrastructure.source.EbirdColumns.SCIENTIFIC_NAME;

import de.siegmar.fastcsv.reader.CsvRecord;
import java.util.List;
import org.birdguide.hotspot.domain.ObservationRecord;
import org.birdguide.hotspot.domain.SpeciesKey;
import org.birdguide.hotspot.domain.TaxonCategory;

/** Maps observation rows to {@link ObservationRecord}s. */
public final class ObservationRowMapper implements RowMapper<ObservationRecord> {
  private static final List<String> REQUIRED = List.of(
      COMMON_NAME, SCIENTIFIC_NAME, CATEGORY, OBSERVATION_COUNT, LOCALITY_ID, LOCALITY, LOCALITY_TYPE,
      LATITUDE, LONGITUDE, SAMPLING_EVENT_IDENTIFIER, ALL_SPECIES_REPORTED, OBSERVATION_DATE);

  @Override
  public List<String> requiredColumns() {
    return REQUIRED;
  }

  @Override
  public ObservationRecord map(EbirdColumns columns, CsvRecord record) throws RowParseException {
    return new ObservationRecord(
        columns.required(record, SAMPLING_EVENT_IDENTIFIER),
        columns.required(record, LOCALITY_ID),
        columns.optional(record, LOCALITY),
        EbirdFields.coordinate(LATITUDE, columns.required(record, LATITUDE), 90.0),
        EbirdFields.coordinate(LONGITUDE, columns.required(record, LONGITUDE), 180.0),
        EbirdFields.localityType(columns.required(record, LOCALITY_TYPE)),
        EbirdFields.complete(columns.required(record, ALL_SPECIES_REPORTED)),
        TaxonCategory.fromCode(columns.required(record, CATEGORY)),
        new SpeciesKey(columns.required(record, COMMON_NAME), columns.optional(record, SCIENTIFIC_NAME)),
        EbirdFields.month(columns.required(record, OBSERVATION_DATE)),
        EbirdFields.individuals(columns.optional(record, OBSERVATION_COUNT)));
  }
}
