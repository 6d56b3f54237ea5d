package com.scoutharvest.core.service.export;

import com.scoutharvest.core.api.RecordSink;
import com.scoutharvest.core.model.ListingRecord;
import com.scoutharvest.core.model.ScrapeConfig;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/** 출력 설정 → RecordSink */
public final class RecordSinks {
    private RecordSinks(){}

    public static RecordSink open(ScrapeConfig.OutputCfg out) throws IOException {
        Path path = out.resolvePath();
        return switch (out.getFormat()) {
            case JSON -> new JsonRecordSink(path);
            case CSV -> new CsvRecordSink(path);
        };
    }

    /** 여러 sink 에 같은 레코드를 순서대로 전달. close 는 모두 시도 후 첫 예외를 던진다. */
    public static RecordSink tee(RecordSink... sinks) {
        List<RecordSink> all = List.of(sinks);
        return new RecordSink() {
            @Override public void emit(ListingRecord record) throws IOException {
                for (RecordSink s : all) s.emit(record);
            }

            @Override public void close() throws IOException {
                IOException first = null;
                for (RecordSink s : all) {
                    try {
                        s.close();
                    } catch (IOException e) {
                        if (first == null) first = e; else first.addSuppressed(e);
                    }
                }
                if (first != null) throw first;
            }
        };
    }
}
