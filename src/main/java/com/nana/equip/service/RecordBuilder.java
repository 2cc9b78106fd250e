package com.nana.equip.service;

import java.util.List;

/**
 * Turns normalized rows into equipment instances and labor lines.
 *
 * <p>Every source row with quantity N becomes N equipment records with
 * {@code plannedQuantity = 1}, sequential instance numbers within their
 * (room, part) group and one shared parent import group id.
 */
public interface RecordBuilder {

    ImportFormat format();

    /**
     * @param row a data row
     * @return the raw room text this builder reads from the row, or null
     */
    String roomNameOf(SpreadsheetRow row);

    /**
     * Builds records with a counter of its own.
     *
     * @param rows      rows in file order
     * @param rooms     resolved rooms
     * @param projectId owning project
     * @param batchId   import batch stamped on every record
     * @param userId    creator, may be null
     * @return equipment and labor records, not yet persisted
     */
    default BuildResult build(List<SpreadsheetRow> rows, RoomResolution rooms,
                              String projectId, String batchId, String userId) {
        return build(rows, rooms, projectId, batchId, userId, new InstanceCounter());
    }

    BuildResult build(List<SpreadsheetRow> rows, RoomResolution rooms,
                      String projectId, String batchId, String userId,
                      InstanceCounter counter);
}
