package com.scoutharvest.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * 출력 단위(매물 1건). 불변.
 * - id 는 매물 URL 마지막 경로 세그먼트에서 파생, 생성 후 변경 불가
 * - 숫자 필드는 파싱 실패 시 null(0 아님)
 * - 기능 목록/이미지는 순서 유지 + 중복 없음, 없으면 빈 리스트
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "title", "url", "mark", "model", "modelVersion", "location"})
public final class ListingRecord {
    private final String id;
    private final String title;
    private final String url;
    private final String mark;
    private final String model;
    private final String modelVersion;
    private final String location;
    private final DealerInfo dealer;
    private final Price price;
    private final Mileage mileage;
    private final String gearbox;
    private final MonthYear firstRegistration;
    private final String fuelType;
    private final Power power;
    private final String seller;
    private final Contact contact;
    private final String bodyType;
    private final String drivetrain;
    private final Integer seats;
    private final String engineSize;
    private final Integer engineSizeCc;
    private final Integer gears;
    private final String emissionClass;
    private final List<String> comfort;
    private final List<String> media;
    private final List<String> safety;
    private final List<String> extras;
    private final String colour;
    private final String manufacturerColour;
    private final MonthYear productionDate;
    private final List<String> images;

    private ListingRecord(Builder b) {
        this.id = b.id;
        this.title = b.title;
        this.url = b.url;
        this.mark = b.mark;
        this.model = b.model;
        this.modelVersion = b.modelVersion;
        this.location = b.location;
        this.dealer = b.dealer;
        this.price = b.price;
        this.mileage = b.mileage;
        this.gearbox = b.gearbox;
        this.firstRegistration = b.firstRegistration;
        this.fuelType = b.fuelType;
        this.power = b.power;
        this.seller = b.seller;
        this.contact = b.contact;
        this.bodyType = b.bodyType;
        this.drivetrain = b.drivetrain;
        this.seats = b.seats;
        this.engineSize = b.engineSize;
        this.engineSizeCc = b.engineSizeCc;
        this.gears = b.gears;
        this.emissionClass = b.emissionClass;
        this.comfort = listOrEmpty(b.comfort);
        this.media = listOrEmpty(b.media);
        this.safety = listOrEmpty(b.safety);
        this.extras = listOrEmpty(b.extras);
        this.colour = b.colour;
        this.manufacturerColour = b.manufacturerColour;
        this.productionDate = b.productionDate;
        this.images = listOrEmpty(b.images);
    }

    private static List<String> listOrEmpty(List<String> in) {
        return in == null ? List.of() : List.copyOf(in);
    }

    public String getId() { return id; }
    public String getTitle() { return title; }
    public String getUrl() { return url; }
    public String getMark() { return mark; }
    public String getModel() { return model; }
    public String getModelVersion() { return modelVersion; }
    public String getLocation() { return location; }
    public DealerInfo getDealer() { return dealer; }
    public Price getPrice() { return price; }
    public Mileage getMileage() { return mileage; }
    public String getGearbox() { return gearbox; }
    public MonthYear getFirstRegistration() { return firstRegistration; }
    public String getFuelType() { return fuelType; }
    public Power getPower() { return power; }
    public String getSeller() { return seller; }
    public Contact getContact() { return contact; }
    public String getBodyType() { return bodyType; }
    public String getDrivetrain() { return drivetrain; }
    public Integer getSeats() { return seats; }
    public String getEngineSize() { return engineSize; }
    public Integer getEngineSizeCc() { return engineSizeCc; }
    public Integer getGears() { return gears; }
    public String getEmissionClass() { return emissionClass; }
    public List<String> getComfort() { return comfort; }
    public List<String> getMedia() { return media; }
    public List<String> getSafety() { return safety; }
    public List<String> getExtras() { return extras; }
    public String getColour() { return colour; }
    public String getManufacturerColour() { return manufacturerColour; }
    public MonthYear getProductionDate() { return productionDate; }
    public List<String> getImages() { return images; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ListingRecord r)) return false;
        return Objects.equals(id, r.id)
                && Objects.equals(title, r.title)
                && Objects.equals(url, r.url)
                && Objects.equals(mark, r.mark)
                && Objects.equals(model, r.model)
                && Objects.equals(modelVersion, r.modelVersion)
                && Objects.equals(location, r.location)
                && Objects.equals(dealer, r.dealer)
                && Objects.equals(price, r.price)
                && Objects.equals(mileage, r.mileage)
                && Objects.equals(gearbox, r.gearbox)
                && Objects.equals(firstRegistration, r.firstRegistration)
                && Objects.equals(fuelType, r.fuelType)
                && Objects.equals(power, r.power)
                && Objects.equals(seller, r.seller)
                && Objects.equals(contact, r.contact)
                && Objects.equals(bodyType, r.bodyType)
                && Objects.equals(drivetrain, r.drivetrain)
                && Objects.equals(seats, r.seats)
                && Objects.equals(engineSize, r.engineSize)
                && Objects.equals(engineSizeCc, r.engineSizeCc)
                && Objects.equals(gears, r.gears)
                && Objects.equals(emissionClass, r.emissionClass)
                && comfort.equals(r.comfort)
                && media.equals(r.media)
                && safety.equals(r.safety)
                && extras.equals(r.extras)
                && Objects.equals(colour, r.colour)
                && Objects.equals(manufacturerColour, r.manufacturerColour)
                && Objects.equals(productionDate, r.productionDate)
                && images.equals(r.images);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, title, url, mark, model, modelVersion, location, dealer, price, mileage,
                gearbox, firstRegistration, fuelType, power, seller, contact, bodyType, drivetrain, seats,
                engineSize, engineSizeCc, gears, emissionClass, comfort, media, safety, extras, colour,
                manufacturerColour, productionDate, images);
    }

    @Override
    public String toString() {
        return "ListingRecord{id=" + id + ", title=" + title + ", price=" + price + "}";
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String id;
        private String title;
        private String url;
        private String mark;
        private String model;
        private String modelVersion;
        private String location;
        private DealerInfo dealer;
        private Price price;
        private Mileage mileage;
        private String gearbox;
        private MonthYear firstRegistration;
        private String fuelType;
        private Power power;
        private String seller;
        private Contact contact;
        private String bodyType;
        private String drivetrain;
        private Integer seats;
        private String engineSize;
        private Integer engineSizeCc;
        private Integer gears;
        private String emissionClass;
        private List<String> comfort;
        private List<String> media;
        private List<String> safety;
        private List<String> extras;
        private String colour;
        private String manufacturerColour;
        private MonthYear productionDate;
        private List<String> images;

        public Builder id(String v) { this.id = v; return this; }
        public Builder title(String v) { this.title = v; return this; }
        public Builder url(String v) { this.url = v; return this; }
        public Builder mark(String v) { this.mark = v; return this; }
        public Builder model(String v) { this.model = v; return this; }
        public Builder modelVersion(String v) { this.modelVersion = v; return this; }
        public Builder location(String v) { this.location = v; return this; }
        public Builder dealer(DealerInfo v) { this.dealer = v; return this; }
        public Builder price(Price v) { this.price = v; return this; }
        public Builder mileage(Mileage v) { this.mileage = v; return this; }
        public Builder gearbox(String v) { this.gearbox = v; return this; }
        public Builder firstRegistration(MonthYear v) { this.firstRegistration = v; return this; }
        public Builder fuelType(String v) { this.fuelType = v; return this; }
        public Builder power(Power v) { this.power = v; return this; }
        public Builder seller(String v) { this.seller = v; return this; }
        public Builder contact(Contact v) { this.contact = v; return this; }
        public Builder bodyType(String v) { this.bodyType = v; return this; }
        public Builder drivetrain(String v) { this.drivetrain = v; return this; }
        public Builder seats(Integer v) { this.seats = v; return this; }
        public Builder engineSize(String v) { this.engineSize = v; return this; }
        public Builder engineSizeCc(Integer v) { this.engineSizeCc = v; return this; }
        public Builder gears(Integer v) { this.gears = v; return this; }
        public Builder emissionClass(String v) { this.emissionClass = v; return this; }
        public Builder comfort(List<String> v) { this.comfort = v; return this; }
        public Builder media(List<String> v) { this.media = v; return this; }
        public Builder safety(List<String> v) { this.safety = v; return this; }
        public Builder extras(List<String> v) { this.extras = v; return this; }
        public Builder colour(String v) { this.colour = v; return this; }
        public Builder manufacturerColour(String v) { this.manufacturerColour = v; return this; }
        public Builder productionDate(MonthYear v) { this.productionDate = v; return this; }
        public Builder images(List<String> v) { this.images = v; return this; }

        public ListingRecord build() {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(title, "title");
            return new ListingRecord(this);
        }
    }
}
