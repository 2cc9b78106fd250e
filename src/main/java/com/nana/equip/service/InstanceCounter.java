package com.nana.equip.service;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Hands out instance numbers per (room, part) group. One counter belongs to
 * one build call; numbers start at 1 and increase across every row of that
 * build that shares the group.
 */
public final class InstanceCounter {

    private final Map<String, Integer> lastIssued = new HashMap<>();

    /**
     * @param roomKey normalized room key
     * @param partKey part number, or name when there is none
     * @return the next instance number for the group
     */
    public int next(String roomKey, String partKey) {
        String group = roomKey + '\u0000' + (partKey == null ? "" : partKey.trim().toLowerCase(Locale.ROOT));
        return lastIssued.merge(group, 1, Integer::sum);
    }

    /** @return the number of distinct groups seen so far */
    public int groupCount() {
        return lastIssued.size();
    }
}
