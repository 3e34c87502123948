package com.mailspider.core.output;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.mailspider.core.model.ExtractionResult;

import java.io.IOException;
import java.io.Writer;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.ArrayList;
import java.util.List;

/**
 * CSV 결과 저장소. 컬럼: email,sourceURL (헤더 포함)
 * - write(append=true, 파일 존재): 헤더 없이 행만 이어쓰기
 * - write(그 외): 새로 만들거나 덮어쓰고 헤더부터 기록, 상위 디렉터리 자동 생성
 * - read: 파일 없음/공백뿐 → 빈 목록, 모르는 컬럼은 무시
 */
public final class CsvResultStore implements ResultStore {

    static final String COL_EMAIL = "email";
    static final String COL_SOURCE = "sourceURL";

    private static final CsvSchema SCHEMA = CsvSchema.builder()
            .addColumn(COL_EMAIL)
            .addColumn(COL_SOURCE)
            .build();

    private final CsvMapper mapper = CsvMapper.builder()
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .enable(CsvParser.Feature.TRIM_SPACES)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    @Override
    public void write(List<ExtractionResult> results, Path file, boolean append) {
        List<Row> rows = new ArrayList<>();
        if (results != null) {
            for (ExtractionResult r : results) rows.add(new Row(r.getEmail(), r.getSourceUrl()));
        }

        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);

            boolean appendMode = append && Files.exists(file);
            if (appendMode && rows.isEmpty()) return;

            CsvSchema schema = appendMode ? SCHEMA.withoutHeader() : SCHEMA.withHeader();
            OpenOption[] opts = appendMode
                    ? new OpenOption[]{StandardOpenOption.CREATE, StandardOpenOption.APPEND}
                    : new OpenOption[]{StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE};
            boolean needsNewline = appendMode && !endsWithNewline(file);

            try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8, opts)) {
                if (needsNewline) w.write('\n');
                if (rows.isEmpty()) {
                    // 행이 없으면 CsvGenerator 가 헤더를 안 쓰므로 직접 기록
                    w.write(COL_EMAIL + "," + COL_SOURCE + "\n");
                    return;
                }
                try (SequenceWriter sw = mapper.writer(schema).writeValues(w)) {
                    sw.writeAll(rows);
                }
            }
        } catch (IOException e) {
            throw new ResultStoreException("Failed to write CSV file", file, e);
        }
    }

    @Override
    public List<ExtractionResult> read(Path file) {
        if (!Files.exists(file)) return List.of();
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            if (content.isBlank()) return List.of();

            List<ExtractionResult> out = new ArrayList<>();
            try (MappingIterator<Row> it = mapper.readerFor(Row.class)
                    .with(CsvSchema.emptySchema().withHeader())
                    .readValues(content)) {
                while (it.hasNextValue()) {
                    Row row = it.nextValue();
                    if (row.email == null || row.email.isBlank()) continue;
                    out.add(new ExtractionResult(row.email, row.sourceUrl == null ? "" : row.sourceUrl));
                }
            }
            return out;
        } catch (IOException e) {
            throw new ResultStoreException("Failed to read CSV file", file, e);
        }
    }

    private static boolean endsWithNewline(Path file) throws IOException {
        try (SeekableByteChannel ch = Files.newByteChannel(file, StandardOpenOption.READ)) {
            long size = ch.size();
            if (size == 0) return true;
            ch.position(size - 1);
            ByteBuffer b = ByteBuffer.allocate(1);
            ch.read(b);
            return b.get(0) == '\n';
        }
    }

    /** CSV 한 행(직렬화 전용) */
    @JsonPropertyOrder({COL_EMAIL, COL_SOURCE})
    static final class Row {
        @JsonProperty(COL_EMAIL) public String email;
        @JsonProperty(COL_SOURCE) public String sourceUrl;

        Row() {}
        Row(String email, String sourceUrl) { this.email = email; this.sourceUrl = sourceUrl; }
    }
}
