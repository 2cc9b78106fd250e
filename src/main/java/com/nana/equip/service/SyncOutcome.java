package com.nana.equip.service;

import java.util.List;

/**
 * What {@link CatalogSyncService} managed to do. Failures are collected
 * per unique part number or supplier name, never thrown.
 */
public final class SyncOutcome {

    private final int          catalogPartsResolved;
    private final int          suppliersResolved;
    private final int          suppliersCreated;
    private final List<String> catalogFailures;
    private final List<String> supplierFailures;

    public SyncOutcome(int catalogPartsResolved,
                       int suppliersResolved,
                       int suppliersCreated,
                       List<String> catalogFailures,
                       List<String> supplierFailures) {
        this.catalogPartsResolved = catalogPartsResolved;
        this.suppliersResolved    = suppliersResolved;
        this.suppliersCreated     = suppliersCreated;
        this.catalogFailures      = List.copyOf(catalogFailures);
        this.supplierFailures     = List.copyOf(supplierFailures);
    }

    public static SyncOutcome empty() {
        return new SyncOutcome(0, 0, 0, List.of(), List.of());
    }

    public int getCatalogPartsResolved()       { return catalogPartsResolved; }
    public int getSuppliersResolved()          { return suppliersResolved; }
    public int getSuppliersCreated()           { return suppliersCreated; }
    public List<String> getCatalogFailures()   { return catalogFailures; }
    public List<String> getSupplierFailures()  { return supplierFailures; }

    public boolean hasFailures() {
        return !catalogFailures.isEmpty() || !supplierFailures.isEmpty();
    }

    @Override
    public String toString() {
        return "SyncOutcome{parts=" + catalogPartsResolved
               + ", suppliers=" + suppliersResolved
               + ", created=" + suppliersCreated
               + ", failures=" + (catalogFailures.size() + supplierFailures.size()) + '}';
    }
}
