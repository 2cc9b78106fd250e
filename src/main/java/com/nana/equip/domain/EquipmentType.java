package com.nana.equip.domain;

/**
 * EquipmentType: classification of a project equipment line.
 *
 * <p>Mirrors the {@code project_equipment.equipment_type} CHECK constraint.
 * Spreadsheet item-type text is mapped with {@link #fromItemType(String)}.
 */
public enum EquipmentType {

    PART("part"),
    LABOR("labor"),
    SERVICE("service"),
    FEE("fee");

    private final String dbValue;

    EquipmentType(String dbValue) {
        this.dbValue = dbValue;
    }

    /** @return the value persisted in {@code equipment_type} */
    public String getDbValue() {
        return dbValue;
    }

    /**
     * Maps free-text item type ("Part", "Fee", "service", ...) to a type.
     * Anything that is not exactly fee, service or labor is a {@code PART}.
     *
     * @param itemType spreadsheet item type, may be null
     * @return the classification, never null
     */
    public static EquipmentType fromItemType(String itemType) {
        if (itemType == null) {
            return PART;
        }
        return switch (itemType.trim().toLowerCase()) {
            case "fee"     -> FEE;
            case "service" -> SERVICE;
            case "labor"   -> LABOR;
            default        -> PART;
        };
    }

    /**
     * Parses a stored value; unknown values fall back to {@code PART}.
     *
     * @param value stored text
     * @return the matching type
     */
    public static EquipmentType fromString(String value) {
        return fromItemType(value);
    }

    @Override
    public String toString() {
        return dbValue;
    }
}
