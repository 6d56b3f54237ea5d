package com.scoutharvest.core.service.export;

import com.opencsv.CSVWriter;
import com.scoutharvest.core.api.RecordSink;
import com.scoutharvest.core.model.ListingRecord;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Function;

/**
 * 고정 컬럼 순서 CSV. 목록 필드는 "|" 로 이어 붙이고, 값 없는 칸은 빈 문자열.
 */
public final class CsvRecordSink implements RecordSink {

    static final String LIST_JOIN = "|";

    private record Column(String header, Function<ListingRecord, Object> value) {}

    private static final List<Column> COLUMNS = List.of(
            new Column("id", ListingRecord::getId),
            new Column("title", ListingRecord::getTitle),
            new Column("url", ListingRecord::getUrl),
            new Column("mark", ListingRecord::getMark),
            new Column("model", ListingRecord::getModel),
            new Column("modelVersion", ListingRecord::getModelVersion),
            new Column("location", ListingRecord::getLocation),
            new Column("dealerName", r -> r.getDealer() == null ? null : r.getDealer().name()),
            new Column("dealerRatings", r -> r.getDealer() == null ? null : r.getDealer().ratingDisplay()),
            new Column("dealerRatingCount", r -> r.getDealer() == null ? null : r.getDealer().ratingCount()),
            new Column("price", r -> r.getPrice() == null ? null : r.getPrice().display()),
            new Column("priceAmount", r -> r.getPrice() == null ? null : r.getPrice().amount()),
            new Column("currency", r -> r.getPrice() == null ? null : r.getPrice().currency()),
            new Column("mileage", r -> r.getMileage() == null ? null : r.getMileage().display()),
            new Column("mileageValue", r -> r.getMileage() == null ? null : r.getMileage().value()),
            new Column("mileageUnit", r -> r.getMileage() == null ? null : r.getMileage().unit()),
            new Column("gearbox", ListingRecord::getGearbox),
            new Column("firstRegistration", r -> r.getFirstRegistration() == null ? null : r.getFirstRegistration().display()),
            new Column("fuelType", ListingRecord::getFuelType),
            new Column("power", r -> r.getPower() == null ? null : r.getPower().display()),
            new Column("powerKw", r -> r.getPower() == null ? null : r.getPower().kw()),
            new Column("powerHp", r -> r.getPower() == null ? null : r.getPower().hp()),
            new Column("seller", ListingRecord::getSeller),
            new Column("contactName", r -> r.getContact() == null ? null : r.getContact().name()),
            new Column("contactPhone", r -> r.getContact() == null ? null : r.getContact().phone()),
            new Column("bodyType", ListingRecord::getBodyType),
            new Column("drivetrain", ListingRecord::getDrivetrain),
            new Column("seats", ListingRecord::getSeats),
            new Column("engineSize", ListingRecord::getEngineSize),
            new Column("engineSizeCc", ListingRecord::getEngineSizeCc),
            new Column("gears", ListingRecord::getGears),
            new Column("emissionClass", ListingRecord::getEmissionClass),
            new Column("comfort", ListingRecord::getComfort),
            new Column("media", ListingRecord::getMedia),
            new Column("safety", ListingRecord::getSafety),
            new Column("extras", ListingRecord::getExtras),
            new Column("colour", ListingRecord::getColour),
            new Column("manufacturerColour", ListingRecord::getManufacturerColour),
            new Column("productionDate", r -> r.getProductionDate() == null ? null : r.getProductionDate().display()),
            new Column("images", ListingRecord::getImages));

    private final CSVWriter writer;
    private int count;

    public CsvRecordSink(Path file) throws IOException {
        this(JsonRecordSink.open(file));
    }

    public CsvRecordSink(Writer out) {
        this.writer = new CSVWriter(out,
                CSVWriter.DEFAULT_SEPARATOR,
                CSVWriter.DEFAULT_QUOTE_CHARACTER,
                CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                CSVWriter.DEFAULT_LINE_END);
        writer.writeNext(COLUMNS.stream().map(Column::header).toArray(String[]::new));
    }

    static String[] headers() {
        return COLUMNS.stream().map(Column::header).toArray(String[]::new);
    }

    @Override
    public void emit(ListingRecord record) throws IOException {
        writer.writeNext(toRow(record));
        if (writer.checkError()) throw new IOException("CSV write failed for " + record.getId());
        count++;
    }

    public int count() { return count; }

    @Override
    public void close() throws IOException {
        writer.close();
    }

    private static String[] toRow(ListingRecord r) {
        String[] row = new String[COLUMNS.size()];
        for (int i = 0; i < row.length; i++) row[i] = str(COLUMNS.get(i).value().apply(r));
        return row;
    }

    private static String str(Object val) {
        if (val == null) return "";
        if (val instanceof List<?> list) {
            StringBuilder sb = new StringBuilder();
            for (Object o : list) {
                if (sb.length() > 0) sb.append(LIST_JOIN);
                sb.append(o);
            }
            return sb.toString();
        }
        return val.toString();
    }
}
