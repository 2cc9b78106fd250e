package com.nana.equip.domain;

/**
 * SupplierMatch: outcome of resolving a free-text supplier name.
 *
 * <p>Either an existing supplier matched with {@code confidence} at or above
 * the caller's threshold, or a new supplier was created ({@code created}).
 */
public final class SupplierMatch {

    private final String  supplierId;
    private final String  supplierName;
    private final double  confidence;
    private final boolean created;

    public SupplierMatch(String supplierId, String supplierName,
                         double confidence, boolean created) {
        this.supplierId   = supplierId;
        this.supplierName = supplierName;
        this.confidence   = confidence;
        this.created      = created;
    }

    public String getSupplierId()   { return supplierId; }
    public String getSupplierName() { return supplierName; }
    public double getConfidence()   { return confidence; }
    public boolean isCreated()      { return created; }

    @Override
    public String toString() {
        return "SupplierMatch{id='" + supplierId + "', name='" + supplierName
               + "', confidence=" + String.format("%.2f", confidence)
               + ", created=" + created + '}';
    }
}
