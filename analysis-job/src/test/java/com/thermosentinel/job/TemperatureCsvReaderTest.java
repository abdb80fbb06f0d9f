package com.thermosentinel.job;

import com.thermosentinel.core.model.TemperatureRecord;
import com.thermosentinel.core.store.IngestionException;
import com.thermosentinel.core.store.TemperatureStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TemperatureCsvReader}.
 */
class TemperatureCsvReaderTest {

    @TempDir
    Path tempDir;

    private final TemperatureCsvReader reader = new TemperatureCsvReader();

    @Test
    @DisplayName("Should read a well-formed file in row order")
    void shouldReadFile() throws IOException {
        Path file = tempDir.resolve("temperatures.csv");
        Files.writeString(file, String.join("\n",
                "timestamp,city,temperature,season",
                "2020-01-01T00:00:00Z,Oslo,-3.5,winter",
                "2020-01-02T00:00:00Z,Oslo,-4.0,winter",
                "2020-01-01T00:00:00Z,Rome,9.25,winter",
                ""));

        TemperatureStore store = reader.read(file);

        assertThat(store.size()).isEqualTo(3);
        assertThat(store.cities()).containsExactly("Oslo", "Rome");
        TemperatureRecord first = store.records().get(0);
        assertThat(first.getCity()).isEqualTo("Oslo");
        assertThat(first.getSeason()).isEqualTo("winter");
        assertThat(first.getRawTemperature()).isEqualTo(-3.5);
        assertThat(first.getTimestamp()).isEqualTo(Instant.parse("2020-01-01T00:00:00Z"));
        assertThat(first.hasSmoothedTemperature()).isFalse();
    }

    @Test
    @DisplayName("Columns may come in any order and extra columns are ignored")
    void shouldMapColumnsByHeader() {
        String csv = "season,humidity,city,temperature,timestamp\n"
                + "summer,40,Lima,21.0,2020-07-01\n";

        TemperatureStore store = reader.read(new StringReader(csv), "inline");

        TemperatureRecord record = store.records().get(0);
        assertThat(record.getCity()).isEqualTo("Lima");
        assertThat(record.getSeason()).isEqualTo("summer");
        assertThat(record.getRawTemperature()).isEqualTo(21.0);
        assertThat(record.getTimestamp()).isEqualTo(Instant.parse("2020-07-01T00:00:00Z"));
    }

    @Test
    @DisplayName("Should accept the supported timestamp forms")
    void shouldParseTimestampForms() {
        assertThat(TemperatureCsvReader.parseTimestamp("2020-01-01T06:00:00Z", 2, "t"))
                .isEqualTo(Instant.parse("2020-01-01T06:00:00Z"));
        assertThat(TemperatureCsvReader.parseTimestamp("2020-01-01T06:00:00+02:00", 2, "t"))
                .isEqualTo(Instant.parse("2020-01-01T04:00:00Z"));
        assertThat(TemperatureCsvReader.parseTimestamp("2020-01-01T06:00:00", 2, "t"))
                .isEqualTo(Instant.parse("2020-01-01T06:00:00Z"));
        assertThat(TemperatureCsvReader.parseTimestamp("2020-01-01 06:00:00", 2, "t"))
                .isEqualTo(Instant.parse("2020-01-01T06:00:00Z"));
        assertThat(TemperatureCsvReader.parseTimestamp("2020-01-01 06:00", 2, "t"))
                .isEqualTo(Instant.parse("2020-01-01T06:00:00Z"));
        assertThat(TemperatureCsvReader.parseTimestamp("2020-01-01", 2, "t"))
                .isEqualTo(Instant.parse("2020-01-01T00:00:00Z"));
        assertThat(TemperatureCsvReader.parseTimestamp("2020-01-01 06:00:00+00:00", 2, "t"))
                .isEqualTo(Instant.parse("2020-01-01T06:00:00Z"));
        assertThat(TemperatureCsvReader.parseTimestamp("2020-01-01 06:00:00.250+01:00", 2, "t"))
                .isEqualTo(Instant.parse("2020-01-01T05:00:00.250Z"));
        assertThat(TemperatureCsvReader.parseTimestamp("2020-01-01 06:00:00.123456", 2, "t"))
                .isEqualTo(Instant.parse("2020-01-01T06:00:00.123456Z"));
    }

    @Test
    @DisplayName("Space-separated timestamps with an offset should be read from a file")
    void shouldReadDataframeExportTimestamps() {
        String csv = "timestamp,city,temperature,season\n"
                + "2020-01-01 00:00:00+00:00,Oslo,1,winter\n"
                + "2020-01-02 00:00:00+00:00,Oslo,2,winter\n";

        TemperatureStore store = reader.read(new StringReader(csv), "export.csv");

        assertThat(store.records()).extracting(TemperatureRecord::getTimestamp)
                .containsExactly(Instant.parse("2020-01-01T00:00:00Z"), Instant.parse("2020-01-02T00:00:00Z"));
    }

    @Test
    @DisplayName("A leading byte-order mark should not hide the first column")
    void shouldSkipByteOrderMark() throws IOException {
        TemperatureStore inline = reader.read(new StringReader(
                "\uFEFFtimestamp,city,temperature,season\n2020-01-01,Oslo,1.0,winter\n"), "bom.csv");

        Path file = tempDir.resolve("bom.csv");
        Files.write(file, ("\uFEFFtimestamp,city,temperature,season\n2020-01-01,Rome,9.0,winter\n")
                .getBytes(StandardCharsets.UTF_8));
        TemperatureStore fromFile = reader.read(file);

        assertThat(inline.records().get(0).getTimestamp()).isEqualTo(Instant.parse("2020-01-01T00:00:00Z"));
        assertThat(fromFile.cities()).containsExactly("Rome");
    }

    @Test
    @DisplayName("A short first row should be reported as a missing value, not a missing column")
    void shouldCheckColumnsAgainstHeader() {
        String csv = "timestamp,city,temperature,season\n"
                + "2020-01-01,Oslo,1.0\n";

        assertThatThrownBy(() -> reader.read(new StringReader(csv), "data.csv"))
                .isInstanceOf(IngestionException.class)
                .hasMessageContaining("data.csv:2: missing value for 'season'")
                .hasMessageNotContaining("missing required column");
    }

    @Test
    @DisplayName("Should reject an unparseable timestamp with its line number")
    void shouldRejectBadTimestamp() {
        String csv = "timestamp,city,temperature,season\n"
                + "2020-01-01,Oslo,1.0,winter\n"
                + "yesterday,Oslo,1.0,winter\n";

        assertThatThrownBy(() -> reader.read(new StringReader(csv), "data.csv"))
                .isInstanceOf(IngestionException.class)
                .hasMessageContaining("data.csv:3")
                .hasMessageContaining("unparseable timestamp 'yesterday'");
    }

    @Test
    @DisplayName("Should reject a non-numeric temperature")
    void shouldRejectBadTemperature() {
        String csv = "timestamp,city,temperature,season\n"
                + "2020-01-01,Oslo,warm,winter\n";

        assertThatThrownBy(() -> reader.read(new StringReader(csv), "data.csv"))
                .isInstanceOf(IngestionException.class)
                .hasMessageContaining("data.csv:2")
                .hasMessageContaining("'warm' is not a number");
    }

    @Test
    @DisplayName("Should reject a blank value")
    void shouldRejectBlankValue() {
        String csv = "timestamp,city,temperature,season\n"
                + "2020-01-01,,1.0,winter\n";

        assertThatThrownBy(() -> reader.read(new StringReader(csv), "data.csv"))
                .isInstanceOf(IngestionException.class)
                .hasMessageContaining("missing value for 'city'");
    }

    @Test
    @DisplayName("Should name the missing columns")
    void shouldRejectMissingColumns() {
        String csv = "timestamp,city,temp\n"
                + "2020-01-01,Oslo,1.0\n";

        assertThatThrownBy(() -> reader.read(new StringReader(csv), "data.csv"))
                .isInstanceOf(IngestionException.class)
                .hasMessageContaining("missing required column(s) [temperature, season]");
    }

    @Test
    @DisplayName("A header without rows is an empty dataset")
    void shouldRejectHeaderOnly() {
        assertThatThrownBy(() -> reader.read(
                new StringReader("timestamp,city,temperature,season\n"), "data.csv"))
                .isInstanceOf(IngestionException.class)
                .hasMessageContaining("no data rows");
    }

    @Test
    @DisplayName("A missing file should be reported as an ingestion failure")
    void shouldRejectMissingFile() {
        Path missing = tempDir.resolve("missing.csv");

        assertThatThrownBy(() -> reader.read(missing))
                .isInstanceOf(IngestionException.class)
                .hasMessageContaining("Input file not found");
    }
}
