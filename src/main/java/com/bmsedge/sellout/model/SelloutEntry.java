package com.bmsedge.sellout.model;

import com.bmsedge.sellout.dto.CanonicalEntry;
import com.bmsedge.sellout.util.NumericValueUtil;
import com.bmsedge.sellout.util.WireRecordConverter;
import jakarta.persistence.*;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A persisted sales observation. Append-only: corrections arrive as new uploads.
 */
@Getter
@Entity
@Immutable
@Table(name = "sellout_entries",
        indexes = {
                @Index(name = "idx_sellout_upload", columnList = "upload_id"),
                @Index(name = "idx_sellout_period", columnList = "year, month"),
                @Index(name = "idx_sellout_ean", columnList = "product_ean")
        })
public class SelloutEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotBlank
    @Column(name = "upload_id", nullable = false, length = 64)
    private String uploadId;

    @NotBlank
    @Size(max = 100)
    @Column(name = "reseller", nullable = false)
    private String reseller;

    @Size(max = 20)
    @Column(name = "product_ean")
    private String productEan;

    @NotNull
    @Min(1)
    @Max(12)
    @Column(name = "month", nullable = false)
    private Integer month;

    @NotNull
    @Min(2000)
    @Column(name = "year", nullable = false)
    private Integer year;

    @NotNull
    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "sales_lc", length = 50)
    private String salesLc;

    @Column(name = "sales_eur", precision = 14, scale = 2)
    private BigDecimal salesEur;

    @NotBlank
    @Size(min = 3, max = 3)
    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Column(name = "functional_name")
    private String functionalName;

    @Column(name = "created_at")
    private Instant createdAt;

    protected SelloutEntry() {}

    /**
     * Builds an entity from a wire-safe record as produced by {@link WireRecordConverter}.
     */
    public static SelloutEntry fromWireRecord(Map<String, Object> record) {
        Instant createdAt = WireRecordConverter.createdAt(record);
        return fromCanonicalEntry(WireRecordConverter.fromWireRecord(record), createdAt == null ? Instant.now() : createdAt);
    }

    public static SelloutEntry fromCanonicalEntry(CanonicalEntry source, Instant createdAt) {
        SelloutEntry entry = new SelloutEntry();
        entry.uploadId = source.getUploadId();
        entry.reseller = source.getReseller();
        entry.productEan = source.getProductEan();
        entry.month = source.getMonth();
        entry.year = source.getYear();
        entry.quantity = source.getQuantity();
        entry.salesLc = source.getSalesLc();
        entry.salesEur = source.getSalesEur();
        entry.currency = source.getCurrency();
        entry.functionalName = source.getFunctionalName();
        entry.createdAt = createdAt;
        return entry;
    }

    /**
     * The stored values as a canonical entry; sales_eur comes back at its shortest scale.
     */
    public CanonicalEntry toCanonicalEntry() {
        return CanonicalEntry.builder()
                .uploadId(uploadId)
                .reseller(reseller)
                .productEan(productEan)
                .month(month)
                .year(year)
                .quantity(quantity)
                .salesLc(salesLc)
                .salesEur(NumericValueUtil.normalizeScale(salesEur))
                .currency(currency)
                .functionalName(functionalName)
                .build();
    }
}
