package org.flightopt.io;

import com.csvreader.CsvReader;
import org.flightopt.routing.graph.LegRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads leg records from a flight table in CSV form.
 * <p>
 * Expected header (column order is free):
 * <pre>
 *   source,dest,cost,time_minutes,co2_kg,source_lat,source_lon,dest_lat,dest_lon
 * </pre>
 * Blank or unparsable numeric cells are passed on as missing values, so the graph loader
 * reports them as invalid records with their row index.
 */
public final class CsvLegSource {
    private static final Logger LOG = LoggerFactory.getLogger(CsvLegSource.class);

    public static final char CSV_DELIMITER = ',';

    static final String COL_SOURCE = "source";
    static final String COL_DEST = "dest";
    static final String COL_COST = "cost";
    static final String COL_TIME = "time_minutes";
    static final String COL_CO2 = "co2_kg";
    static final String COL_SOURCE_LAT = "source_lat";
    static final String COL_SOURCE_LON = "source_lon";
    static final String COL_DEST_LAT = "dest_lat";
    static final String COL_DEST_LON = "dest_lon";

    private static final String[] REQUIRED_COLUMNS = {
            COL_SOURCE, COL_DEST, COL_COST, COL_TIME, COL_CO2,
            COL_SOURCE_LAT, COL_SOURCE_LON, COL_DEST_LAT, COL_DEST_LON
    };

    /**
     * Reads every row of a UTF-8 CSV file.
     */
    public List<LegRecord> read(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            List<LegRecord> records = read(reader);
            LOG.info("Read {} leg rows from {}", records.size(), file);
            return records;
        }
    }

    /**
     * Reads every row from an open reader and closes it.
     *
     * @throws IOException on read failure or when a required column is absent.
     */
    public List<LegRecord> read(Reader input) throws IOException {
        CsvReader csvReader = new CsvReader(input, CSV_DELIMITER);
        try {
            if (!csvReader.readHeaders()) {
                throw new IOException("CSV input has no header row");
            }
            for (String column : REQUIRED_COLUMNS) {
                if (csvReader.getIndex(column) < 0) {
                    throw new IOException("CSV header is missing column '" + column + "'");
                }
            }

            List<LegRecord> records = new ArrayList<>();
            while (csvReader.readRecord()) {
                records.add(LegRecord.builder()
                        .origin(trimToNull(csvReader.get(COL_SOURCE)))
                        .destination(trimToNull(csvReader.get(COL_DEST)))
                        .cost(parse(csvReader.get(COL_COST)))
                        .timeMinutes(parse(csvReader.get(COL_TIME)))
                        .co2Kg(parse(csvReader.get(COL_CO2)))
                        .originLatitude(parse(csvReader.get(COL_SOURCE_LAT)))
                        .originLongitude(parse(csvReader.get(COL_SOURCE_LON)))
                        .destinationLatitude(parse(csvReader.get(COL_DEST_LAT)))
                        .destinationLongitude(parse(csvReader.get(COL_DEST_LON)))
                        .build());
            }
            return records;
        } finally {
            csvReader.close();
        }
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static Double parse(String value) {
        String trimmed = trimToNull(value);
        if (trimmed == null) {
            return null;
        }
        try {
            return Double.valueOf(trimmed);
        } catch (NumberFormatException ex) {
            LOG.debug("Unparsable numeric cell '{}'", trimmed);
            return null;
        }
    }
}
