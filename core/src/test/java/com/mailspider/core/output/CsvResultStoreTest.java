package com.mailspider.core.output;

import com.mailspider.core.model.ExtractionResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsvResultStoreTest {

    @TempDir Path dir;

    private final CsvResultStore store = new CsvResultStore();

    @Test
    void write_createsParentDirs_andWritesHeaderThenRows() throws IOException {
        Path out = dir.resolve("nested/deeper/emails.csv");

        store.write(List.of(
                new ExtractionResult("info@ex.com", "https://ex.com/"),
                new ExtractionResult("jane@ex.com", "https://ex.com/team")), out, false);

        assertThat(Files.readAllLines(out, StandardCharsets.UTF_8)).containsExactly(
                "email,sourceURL",
                "info@ex.com,https://ex.com/",
                "jane@ex.com,https://ex.com/team");
    }

    @Test
    void write_withNoRows_stillWritesHeader() throws IOException {
        Path out = dir.resolve("empty.csv");
        store.write(List.of(), out, false);
        assertThat(Files.readString(out)).isEqualTo("email,sourceURL\n");
    }

    @Test
    void write_overwritesWhenNotAppending() throws IOException {
        Path out = dir.resolve("emails.csv");
        Files.writeString(out, "email,sourceURL\nold@ex.com,https://ex.com/\n");

        store.write(List.of(new ExtractionResult("new@ex.com", "https://ex.com/")), out, false);

        assertThat(Files.readAllLines(out)).containsExactly("email,sourceURL", "new@ex.com,https://ex.com/");
    }

    @Test
    void append_addsRowsWithoutSecondHeader_evenWithoutTrailingNewline() throws IOException {
        Path out = dir.resolve("emails.csv");
        Files.writeString(out, "email,sourceURL\nold@ex.com,https://ex.com/");

        store.write(List.of(new ExtractionResult("new@ex.com", "https://ex.com/b")), out, true);

        assertThat(Files.readAllLines(out)).containsExactly(
                "email,sourceURL",
                "old@ex.com,https://ex.com/",
                "new@ex.com,https://ex.com/b");
    }

    @Test
    void append_withNoRows_leavesFileUntouched() throws IOException {
        Path out = dir.resolve("emails.csv");
        String before = "email,sourceURL\nold@ex.com,https://ex.com/\n";
        Files.writeString(out, before);

        store.write(List.of(), out, true);

        assertThat(Files.readString(out)).isEqualTo(before);
    }

    @Test
    void append_toMissingFile_writesHeader() throws IOException {
        Path out = dir.resolve("fresh.csv");
        store.write(List.of(new ExtractionResult("a@ex.com", "https://ex.com/")), out, true);
        assertThat(Files.readAllLines(out)).first().isEqualTo("email,sourceURL");
    }

    @Test
    void read_roundTripsQuotedValues() {
        Path out = dir.resolve("emails.csv");
        List<ExtractionResult> rows = List.of(
                new ExtractionResult("first+tag@ex.com", "https://ex.com/search?q=a,b"),
                new ExtractionResult("x@ex.com", "https://ex.com/\"quoted\""));

        store.write(rows, out, false);

        assertThat(store.read(out)).containsExactlyElementsOf(rows);
    }

    @Test
    void read_missingBlankOrHeaderOnly_isEmpty() throws IOException {
        assertThat(store.read(dir.resolve("missing.csv"))).isEmpty();

        Path blank = dir.resolve("blank.csv");
        Files.writeString(blank, "  \n");
        assertThat(store.read(blank)).isEmpty();

        Path headerOnly = dir.resolve("header.csv");
        Files.writeString(headerOnly, "email,sourceURL\n");
        assertThat(store.read(headerOnly)).isEmpty();
    }

    @Test
    void read_ignoresUnknownColumnsAndBlankEmails() throws IOException {
        Path f = dir.resolve("extra.csv");
        Files.writeString(f, "email,sourceURL,note\na@ex.com,https://ex.com/,hi\n,https://ex.com/x,skip\n");

        assertThat(store.read(f)).containsExactly(new ExtractionResult("a@ex.com", "https://ex.com/"));
    }

    @Test
    void ioFailures_becomeResultStoreException() throws IOException {
        Path blocker = dir.resolve("blocker");
        Files.writeString(blocker, "not a dir");
        Path out = blocker.resolve("emails.csv");

        assertThatThrownBy(() -> store.write(List.of(), out, false))
                .isInstanceOf(ResultStoreException.class)
                .satisfies(e -> assertThat(((ResultStoreException) e).getFile()).isEqualTo(out));

        Path directory = Files.createDirectories(dir.resolve("a-directory.csv"));
        assertThatThrownBy(() -> store.read(directory)).isInstanceOf(ResultStoreException.class);
    }
}
