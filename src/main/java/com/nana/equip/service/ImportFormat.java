package com.nana.equip.service;

/**
 * The record-building strategies a spreadsheet can be imported with.
 */
public enum ImportFormat {

    /** Generic proposal export: item type, area, quantity, brand, model. */
    STANDARD("standard"),

    /** Shade and automation vendor catalog export: technology, product, mount. */
    VENDOR_CATALOG("vendor-catalog");

    private final String label;

    ImportFormat(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
