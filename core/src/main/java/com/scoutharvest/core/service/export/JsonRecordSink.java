package com.scoutharvest.core.service.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.scoutharvest.core.api.RecordSink;
import com.scoutharvest.core.model.ListingRecord;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 레코드를 들여쓴 JSON 배열로 스트리밍. null 필드는 생략(@JsonInclude NON_NULL).
 * 레코드가 0건이어도 close 시 "[ ]" 로 닫힌다.
 */
public final class JsonRecordSink implements RecordSink {

    static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Writer out;
    private final SequenceWriter seq;
    private int count;

    public JsonRecordSink(Path file) throws IOException {
        this(open(file));
    }

    public JsonRecordSink(Writer out) throws IOException {
        this.out = out;
        this.seq = MAPPER.writer().writeValuesAsArray(out);
    }

    @Override
    public void emit(ListingRecord record) throws IOException {
        seq.write(record);
        count++;
    }

    public int count() { return count; }

    @Override
    public void close() throws IOException {
        try {
            seq.close();
        } finally {
            out.close();
        }
    }

    static Writer open(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        return Files.newBufferedWriter(file, StandardCharsets.UTF_8);
    }
}
