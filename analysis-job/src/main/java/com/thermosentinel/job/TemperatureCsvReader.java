package com.thermosentinel.job;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.thermosentinel.core.model.TemperatureRecord;
import com.thermosentinel.core.store.IngestionException;
import com.thermosentinel.core.store.TemperatureStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PushbackReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Reads the historical temperature CSV into a {@link TemperatureStore}.
 *
 * <p>
 * The file must start with a header row naming at least the columns
 * {@code timestamp}, {@code city}, {@code temperature} and {@code season}, in
 * any order. Other columns are ignored. Any malformed row aborts the read
 * with an {@link IngestionException} that names the offending line.
 * </p>
 *
 * <h3>Timestamps</h3>
 * <p>
 * Accepted forms are ISO-8601 instants and offset date-times, the same with a
 * space instead of {@code T} ({@code 2020-01-01 00:00:00+00:00}), local
 * date-times ({@code 2020-01-01T00:00:00} or {@code 2020-01-01 00:00:00}) and
 * plain dates ({@code 2020-01-01}). Values without an offset are read as UTC.
 * A leading UTF-8 byte-order mark is ignored.
 * </p>
 *
 * @since 1.0.0
 */
public class TemperatureCsvReader {

    private static final Logger LOG = LoggerFactory.getLogger(TemperatureCsvReader.class);

    static final String COL_TIMESTAMP = "timestamp";
    static final String COL_CITY = "city";
    static final String COL_TEMPERATURE = "temperature";
    static final String COL_SEASON = "season";

    static final List<String> REQUIRED_COLUMNS =
            List.of(COL_TIMESTAMP, COL_CITY, COL_TEMPERATURE, COL_SEASON);

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    /** {@code 2020-01-01 06:00[:00[.fraction]]}, as written by spreadsheet and dataframe exports. */
    private static final DateTimeFormatter SPACE_SEPARATED = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral(' ')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .toFormatter();

    /** Same as {@link #SPACE_SEPARATED} followed by an offset such as {@code +00:00} or {@code Z}. */
    private static final DateTimeFormatter SPACE_SEPARATED_OFFSET = new DateTimeFormatterBuilder()
            .append(SPACE_SEPARATED)
            .appendOffsetId()
            .toFormatter();

    /** Tried in order; the first that parses wins. */
    private static final List<Function<String, Instant>> TIMESTAMP_PARSERS = List.of(
            v -> OffsetDateTime.parse(v).toInstant(),
            v -> OffsetDateTime.parse(v, SPACE_SEPARATED_OFFSET).toInstant(),
            v -> LocalDateTime.parse(v).toInstant(ZoneOffset.UTC),
            v -> LocalDateTime.parse(v, SPACE_SEPARATED).toInstant(ZoneOffset.UTC),
            v -> LocalDate.parse(v).atStartOfDay(ZoneOffset.UTC).toInstant());

    private final CsvMapper mapper;

    public TemperatureCsvReader() {
        this.mapper = CsvMapper.builder()
                .enable(CsvParser.Feature.TRIM_SPACES)
                .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
                .build();
    }

    /**
     * Read a CSV file.
     *
     * @param path the file; must not be {@code null}
     * @return a store holding every row in file order
     * @throws IngestionException if the file is missing, unreadable or
     *                            malformed
     */
    public TemperatureStore read(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        LOG.info("Reading temperature data from {}", path);
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.toString());
        } catch (NoSuchFileException e) {
            throw new IngestionException("Input file not found: " + path, e);
        } catch (IOException e) {
            throw new IngestionException("Failed to read input file: " + path, e);
        }
    }

    /**
     * Read CSV content from a reader. The reader is not closed.
     *
     * @param reader the CSV content
     * @param source name used in error messages
     * @return a store holding every row in input order
     * @throws IngestionException if the content is malformed or has no rows
     */
    public TemperatureStore read(Reader reader, String source) {
        Objects.requireNonNull(reader, "reader must not be null");
        CsvSchema schema = CsvSchema.emptySchema().withHeader();

        List<TemperatureRecord> records = new ArrayList<>();
        int line = 1;
        try {
            MappingIterator<Map<String, String>> rows = mapper
                    .readerForMapOf(String.class)
                    .with(schema)
                    .readValues(skipByteOrderMark(reader));
            requireColumns((CsvSchema) rows.getParserSchema(), source);
            while (rows.hasNextValue()) {
                Map<String, String> row = rows.nextValue();
                line++;
                records.add(toRecord(row, line, source));
            }
        } catch (IOException e) {
            throw new IngestionException(source + ": malformed CSV at line " + (line + 1)
                    + ": " + e.getMessage(), e);
        }

        if (records.isEmpty()) {
            throw new IngestionException(source + ": no data rows");
        }
        LOG.info("Read {} record(s) from {}", records.size(), source);
        return TemperatureStore.of(records);
    }

    // ---------------------------------------------------------------
    // Row mapping
    // ---------------------------------------------------------------

    /** A UTF-8 byte-order mark would otherwise stick to the first header name. */
    private static Reader skipByteOrderMark(Reader reader) throws IOException {
        PushbackReader pushback = new PushbackReader(reader, 1);
        int first = pushback.read();
        if (first != -1 && first != BYTE_ORDER_MARK) {
            pushback.unread(first);
        }
        return pushback;
    }

    private static void requireColumns(CsvSchema header, String source) {
        List<String> missing = REQUIRED_COLUMNS.stream()
                .filter(column -> header == null || header.column(column) == null)
                .toList();
        if (!missing.isEmpty()) {
            throw new IngestionException(source + ": missing required column(s) " + missing);
        }
    }

    private static TemperatureRecord toRecord(Map<String, String> row, int line, String source) {
        String rawTemperature = required(row, COL_TEMPERATURE, line, source);
        double temperature;
        try {
            temperature = Double.parseDouble(rawTemperature);
        } catch (NumberFormatException e) {
            throw new IngestionException(source + ":" + line + ": temperature '"
                    + rawTemperature + "' is not a number", e);
        }

        return TemperatureRecord.builder()
                .timestamp(parseTimestamp(required(row, COL_TIMESTAMP, line, source), line, source))
                .city(required(row, COL_CITY, line, source))
                .season(required(row, COL_SEASON, line, source))
                .rawTemperature(temperature)
                .build();
    }

    private static String required(Map<String, String> row, String column, int line, String source) {
        String value = row.get(column);
        if (value == null || value.isBlank()) {
            throw new IngestionException(source + ":" + line + ": missing value for '" + column + "'");
        }
        return value.trim();
    }

    static Instant parseTimestamp(String value, int line, String source) {
        DateTimeParseException lastFailure = null;
        for (Function<String, Instant> parser : TIMESTAMP_PARSERS) {
            try {
                return parser.apply(value);
            } catch (DateTimeParseException e) {
                lastFailure = e;
            }
        }
        throw new IngestionException(source + ":" + line + ": unparseable timestamp '"
                + value + "'", lastFailure);
    }
}
