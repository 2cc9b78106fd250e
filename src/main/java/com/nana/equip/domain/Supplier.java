package com.nana.equip.domain;

public class Supplier {

    private String  id;
    private String  name;
    private String  shortCode;
    private boolean active = true;

    public Supplier() {
    }

    public Supplier(String name, String shortCode) {
        this.name      = name;
        this.shortCode = shortCode;
    }

    public String getId()                      { return id; }
    public void setId(String id)               { this.id = id; }

    public String getName()                    { return name; }
    public void setName(String name)           { this.name = name; }

    public String getShortCode()               { return shortCode; }
    public void setShortCode(String shortCode) { this.shortCode = shortCode; }

    public boolean isActive()                  { return active; }
    public void setActive(boolean active)      { this.active = active; }

    @Override
    public String toString() {
        return "Supplier{id='" + id + "', name='" + name + "', code='" + shortCode + "'}";
    }
}
