package com.nana.equip.domain;

/**
 * RoomAlias: an alternative spelling of a room name seen in an import.
 *
 * <p>{@code (projectId, normalizedAlias)} is the natural key; the store keeps
 * one row per key and the last upsert decides which room it points at.
 */
public class RoomAlias {

    private String id;
    private String projectId;
    private String roomId;
    private String alias;
    private String normalizedAlias;

    public RoomAlias() {
    }

    public RoomAlias(String projectId, String roomId, String alias, String normalizedAlias) {
        this.projectId       = projectId;
        this.roomId          = roomId;
        this.alias           = alias;
        this.normalizedAlias = normalizedAlias;
    }

    public String getId()                       { return id; }
    public void setId(String id)                { this.id = id; }

    public String getProjectId()                { return projectId; }
    public void setProjectId(String projectId)  { this.projectId = projectId; }

    public String getRoomId()                   { return roomId; }
    public void setRoomId(String roomId)        { this.roomId = roomId; }

    public String getAlias()                    { return alias; }
    public void setAlias(String alias)          { this.alias = alias; }

    public String getNormalizedAlias()          { return normalizedAlias; }
    public void setNormalizedAlias(String n)    { this.normalizedAlias = n; }

    @Override
    public String toString() {
        return "RoomAlias{alias='" + alias + "', normalized='" + normalizedAlias
               + "', room='" + roomId + "'}";
    }
}
