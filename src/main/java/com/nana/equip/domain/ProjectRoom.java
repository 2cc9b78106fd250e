package com.nana.equip.domain;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * ProjectRoom: canonical room (area) of a project.
 *
 * <p>Rooms are created lazily by the import the first time a new normalized
 * name is seen and are never deleted by it. {@code isHeadend} is derived from
 * keywords in the name when the room is first created.
 */
public class ProjectRoom {

    /**
     * Case-insensitive substrings that mark a room as the head end
     * (rack / network / equipment room).
     */
    public static final List<String> HEADEND_KEYWORDS = List.of(
            "network", "head", "equipment", "rack", "structured", "mda", "server");

    private static final Pattern NON_ALNUM  = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private String  id;
    private String  projectId;
    private String  name;
    private boolean headend;
    private String  notes;
    private String  createdBy;

    public ProjectRoom() {
    }

    public ProjectRoom(String projectId, String name, boolean headend, String createdBy) {
        this.projectId = projectId;
        this.name      = name;
        this.headend   = headend;
        this.createdBy = createdBy;
    }

    /**
     * Creates an unsaved room for a raw spreadsheet area name, deriving the
     * head-end flag from {@link #HEADEND_KEYWORDS}.
     *
     * @param projectId owning project
     * @param rawName   trimmed area name as it appeared in the file
     * @param createdBy acting user, may be null
     * @return a new room without an id
     */
    public static ProjectRoom newFromImport(String projectId, String rawName, String createdBy) {
        return new ProjectRoom(projectId, rawName, detectHeadend(rawName), createdBy);
    }

    /**
     * @param roomName raw room name, may be null
     * @return true if the name contains any head-end keyword
     */
    public static boolean detectHeadend(String roomName) {
        if (roomName == null || roomName.isBlank()) {
            return false;
        }
        String lower = roomName.toLowerCase(Locale.ROOT);
        for (String keyword : HEADEND_KEYWORDS) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Canonical comparison form of a room name: lower case, each run of
     * characters that are not letters or digits collapsed to one space, trimmed.
     * "Living-Room " and "living room" both become {@code "living room"}.
     *
     * @param roomName raw room name, may be null
     * @return the normalized name, empty for null or punctuation-only input
     */
    public static String normalizeName(String roomName) {
        if (roomName == null) {
            return "";
        }
        return NON_ALNUM.matcher(roomName.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    /**
     * Comparison form used for alias rows. Keeps punctuation so that
     * "Living-Room" is recorded as a distinct spelling of "Living Room".
     *
     * @param alias raw alias text, may be null
     * @return lower-cased, whitespace-collapsed, trimmed text
     */
    public static String normalizeAlias(String alias) {
        if (alias == null) {
            return "";
        }
        return WHITESPACE.matcher(alias.toLowerCase(Locale.ROOT).trim()).replaceAll(" ");
    }

    /** @return {@link #normalizeName(String)} of this room's display name */
    public String getNormalizedName() {
        return normalizeName(name);
    }

    public String getId()                      { return id; }
    public void setId(String id)               { this.id = id; }

    public String getProjectId()               { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }

    public String getName()                    { return name; }
    public void setName(String name)           { this.name = name; }

    public boolean isHeadend()                 { return headend; }
    public void setHeadend(boolean headend)    { this.headend = headend; }

    public String getNotes()                   { return notes; }
    public void setNotes(String notes)         { this.notes = notes; }

    public String getCreatedBy()               { return createdBy; }
    public void setCreatedBy(String createdBy) { this.createdBy = createdBy; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProjectRoom other)) return false;
        return id != null && Objects.equals(id, other.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "ProjectRoom{id='" + id + "', name='" + name + "', headend=" + headend + '}';
    }
}
