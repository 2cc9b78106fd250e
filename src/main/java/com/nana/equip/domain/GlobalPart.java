package com.nana.equip.domain;

/**
 * Project-independent catalog entry. The trimmed part number is the natural
 * key and is compared case-insensitively.
 */
public class GlobalPart {

    private String id;
    private String partNumber;
    private String name;
    private String description;
    private String manufacturer;
    private String model;
    private String category;
    private String unitOfMeasure;

    public GlobalPart() {
    }

    /**
     * Builds the catalog payload for an equipment row.
     *
     * @param equipment the row whose catalog fields are copied
     * @return a new, unsaved GlobalPart
     */
    public static GlobalPart fromEquipment(ProjectEquipment equipment) {
        GlobalPart part = new GlobalPart();
        part.partNumber    = equipment.getPartNumber() == null ? null : equipment.getPartNumber().trim();
        part.name          = equipment.getName();
        part.description   = equipment.getDescription();
        part.manufacturer  = equipment.getManufacturer();
        part.model         = equipment.getModel();
        part.category      = equipment.getEquipmentType() == null
                ? null : equipment.getEquipmentType().getDbValue();
        part.unitOfMeasure = equipment.getUnitOfMeasure();
        return part;
    }

    public String getId()                        { return id; }
    public void setId(String id)                 { this.id = id; }

    public String getPartNumber()                { return partNumber; }
    public void setPartNumber(String partNumber) { this.partNumber = partNumber; }

    public String getName()                      { return name; }
    public void setName(String name)             { this.name = name; }

    public String getDescription()               { return description; }
    public void setDescription(String d)         { this.description = d; }

    public String getManufacturer()              { return manufacturer; }
    public void setManufacturer(String m)        { this.manufacturer = m; }

    public String getModel()                     { return model; }
    public void setModel(String model)           { this.model = model; }

    public String getCategory()                  { return category; }
    public void setCategory(String category)     { this.category = category; }

    public String getUnitOfMeasure()             { return unitOfMeasure; }
    public void setUnitOfMeasure(String unit)    { this.unitOfMeasure = unit; }

    @Override
    public String toString() {
        return "GlobalPart{id='" + id + "', partNumber='" + partNumber + "'}";
    }
}
