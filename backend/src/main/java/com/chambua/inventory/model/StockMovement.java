package com.chambua.inventory.model;

import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Audit record of a stock level change. Imports write one movement per item whose
 * stock they set.
 */
@Entity
@Table(name = "stock_movements", indexes = {
        @Index(name = "idx_movement_item", columnList = "item_id")
})
public class StockMovement {

    public static final String TYPE_COUNT = "count";
    public static final String REFERENCE_IMPORT = "import";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "item_id", nullable = false, foreignKey = @ForeignKey(name = "fk_movement_item"))
    private InventoryItem item;

    @Column(name = "movement_type", nullable = false, length = 20)
    private String movementType;

    @Column(nullable = false, precision = 10, scale = 3)
    private BigDecimal quantity;

    @Column(name = "stock_before", nullable = false, precision = 10, scale = 3)
    private BigDecimal stockBefore;

    @Column(name = "stock_after", nullable = false, precision = 10, scale = 3)
    private BigDecimal stockAfter;

    @Column(name = "reference_type", length = 50)
    private String referenceType;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "performed_by", length = 50)
    private String performedBy;

    @Column(name = "created_at")
    private Instant createdAt;

    public StockMovement() {}

    public static StockMovement importCount(InventoryItem item, BigDecimal before, BigDecimal after, String performedBy) {
        StockMovement m = new StockMovement();
        m.item = item;
        m.movementType = TYPE_COUNT;
        m.quantity = after.subtract(before);
        m.stockBefore = before;
        m.stockAfter = after;
        m.referenceType = REFERENCE_IMPORT;
        m.notes = "Stock set by CSV import";
        m.performedBy = performedBy;
        m.createdAt = Instant.now();
        return m;
    }

    public Long getId() { return id; }
    public InventoryItem getItem() { return item; }
    public String getMovementType() { return movementType; }
    public BigDecimal getQuantity() { return quantity; }
    public BigDecimal getStockBefore() { return stockBefore; }
    public BigDecimal getStockAfter() { return stockAfter; }
    public String getReferenceType() { return referenceType; }
    public String getNotes() { return notes; }
    public String getPerformedBy() { return performedBy; }
    public Instant getCreatedAt() { return createdAt; }
}
