package com.opsdata.reconciliation.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

@Entity
@Table(
    name = "shipping_records",
    uniqueConstraints = @UniqueConstraint(name = "uk_shipping_lot", columnNames = "lot_id")
)
public class ShippingRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "lot_id", nullable = false)
    private LotEntity lot;

    @Column(name = "ship_date", nullable = false)
    private LocalDate shipDate;

    @Column(name = "destination", nullable = false, length = 50)
    private String destination;

    @Column(name = "carrier", nullable = false, length = 50)
    private String carrier;

    @Column(name = "qty_shipped", nullable = false)
    private int qtyShipped;

    @Column(name = "shipment_status", nullable = false, length = 30)
    private String shipmentStatus;

    @Column(name = "source_updated_at", nullable = false)
    private Instant sourceUpdatedAt;

    public static ShippingRecordEntity fromRecord(LotEntity lot, ShippingRecord record, Instant sourceUpdatedAt) {
        ShippingRecordEntity entity = new ShippingRecordEntity();
        entity.lot = lot;
        entity.shipDate = record.shipDate();
        entity.destination = record.destination();
        entity.carrier = record.carrier();
        entity.qtyShipped = record.qtyShipped();
        entity.shipmentStatus = record.shipmentStatus();
        entity.sourceUpdatedAt = sourceUpdatedAt;
        return entity;
    }

    public boolean matches(ShippingRecord record) {
        return Objects.equals(shipDate, record.shipDate())
            && Objects.equals(destination, record.destination())
            && Objects.equals(carrier, record.carrier())
            && qtyShipped == record.qtyShipped()
            && Objects.equals(shipmentStatus, record.shipmentStatus());
    }

    public ShippingRecord toRecord() {
        return new ShippingRecord(shipDate, destination, carrier, qtyShipped, shipmentStatus);
    }

    public Long getId() {
        return id;
    }

    public LotEntity getLot() {
        return lot;
    }

    public LocalDate getShipDate() {
        return shipDate;
    }

    public String getDestination() {
        return destination;
    }

    public String getCarrier() {
        return carrier;
    }

    public int getQtyShipped() {
        return qtyShipped;
    }

    public String getShipmentStatus() {
        return shipmentStatus;
    }

    public Instant getSourceUpdatedAt() {
        return sourceUpdatedAt;
    }
}
