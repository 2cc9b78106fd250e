package com.nana.equip.service;

import com.nana.equip.domain.EquipmentType;
import com.nana.equip.domain.InstallSide;
import com.nana.equip.domain.LaborBudgetLine;
import com.nana.equip.domain.ProjectEquipment;
import com.nana.equip.domain.ProjectRoom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * StandardRecordBuilder: builds records from a generic proposal export.
 *
 * <p>ROW RULES:
 * <ul>
 *   <li>Rows without an item type or room, or with a quantity that is not
 *       positive, are skipped.</li>
 *   <li>{@code labor} rows aggregate into one labor line per
 *       (room, labor type, description); their quantity is added to the
 *       planned hours and the first supplier seen is kept.</li>
 *   <li>Every other row expands into one equipment instance per unit of
 *       quantity. Install side follows the resolved room's head-end flag.
 *       A row above {@link #MAX_INSTANCES_PER_ROW} units is skipped.</li>
 * </ul>
 */
public class StandardRecordBuilder extends AbstractRecordBuilder {

    private static final Logger log = LoggerFactory.getLogger(StandardRecordBuilder.class);

    // -----------------------------------------------------------------------
    // COLUMN NAMES (matched case-insensitively, first non-blank wins)
    // -----------------------------------------------------------------------

    static final String[] ITEM_TYPE   = {"ItemType", "Item Type"};
    static final String[] ROOM        = {"Area", "Room"};
    static final String[] QUANTITY    = {"AreaQty", "Area Qty", "Quantity", "Qty"};
    static final String[] BRAND       = {"Brand", "Manufacturer"};
    static final String[] MODEL       = {"Model or Labor/Fee Name", "Model"};
    static final String[] PART_NUMBER = {"PartNumber", "Part Number", "part_number", "Part_Number"};
    static final String[] DESCRIPTION = {"ShortDescription", "Short Description", "Description"};
    static final String[] SUPPLIER    = {"Supplier"};
    static final String[] COST        = {"Cost"};
    static final String[] SELL_PRICE  = {"SellPrice", "Sell Price"};

    private static final String DEFAULT_LABOR = "Labor";

    @Override
    public ImportFormat format() {
        return ImportFormat.STANDARD;
    }

    @Override
    public String roomNameOf(SpreadsheetRow row) {
        return row.text(ROOM);
    }

    @Override
    public BuildResult build(List<SpreadsheetRow> rows, RoomResolution rooms,
                             String projectId, String batchId, String userId,
                             InstanceCounter counter) {
        List<ProjectEquipment> equipment = new ArrayList<>();
        Map<String, LaborBudgetLine> labor = new LinkedHashMap<>();
        int skipped = 0;

        for (SpreadsheetRow row : rows) {
            String itemType = row.text(ITEM_TYPE);
            double quantity = row.number(QUANTITY);
            String roomName = roomNameOf(row);

            if (itemType == null || quantity <= 0 || roomName == null) {
                log.debug("Skipping row {}: type={}, quantity={}, room={}.",
                        row.getRowNumber(), itemType, quantity, roomName);
                skipped++;
                continue;
            }

            ProjectRoom room     = rooms.roomFor(roomName);
            String roomKey       = RowNormalizer.roomKey(roomName);
            String manufacturer  = row.text(BRAND);
            String model         = row.text(MODEL);
            String partNumber    = row.text(PART_NUMBER);
            String description   = row.text(DESCRIPTION);
            String supplier      = row.text(SUPPLIER);
            if (partNumber == null) {
                partNumber = model;
            }

            if (EquipmentType.fromItemType(itemType) == EquipmentType.LABOR) {
                addLabor(labor, roomKey, room, model, description, supplier, quantity,
                        row.number(SELL_PRICE), projectId, batchId, userId);
                continue;
            }
            if (exceedsInstanceLimit(quantity)) {
                log.warn("Skipping row {}: quantity {} exceeds {} instances per row.",
                        row.getRowNumber(), quantity, MAX_INSTANCES_PER_ROW);
                skipped++;
                continue;
            }

            String name = firstNonNull(model, description, manufacturer, UNNAMED_EQUIPMENT);

            ProjectEquipment template = new ProjectEquipment();
            template.setProjectId(projectId);
            template.setRoomId(room == null ? null : room.getId());
            template.setCsvBatchId(batchId);
            template.setName(name);
            template.setDescription(description);
            template.setManufacturer(manufacturer);
            template.setModel(model);
            template.setPartNumber(partNumber);
            template.setInstallSide(InstallSide.forRoom(room));
            template.setEquipmentType(EquipmentType.fromItemType(itemType));
            template.setUnitOfMeasure("ea");
            template.setUnitCost(row.number(COST));
            template.setUnitPrice(row.number(SELL_PRICE));
            template.setSupplier(supplier);
            template.setCreatedBy(userId);

            String roomDisplay = room == null ? roomName : room.getName();
            String partLabel   = partNumber == null ? name : partNumber;
            equipment.addAll(expand(template, instanceCount(quantity),
                    roomDisplay, roomKey, partLabel, counter));
        }

        log.info("Standard build: {} equipment instance(s), {} labor line(s), {} row(s) skipped.",
                equipment.size(), labor.size(), skipped);
        return new BuildResult(equipment, new ArrayList<>(labor.values()), skipped);
    }

    private void addLabor(Map<String, LaborBudgetLine> labor, String roomKey, ProjectRoom room,
                          String model, String description, String supplier, double hours,
                          double hourlyRate, String projectId, String batchId, String userId) {
        String key = roomKey
                + "|" + (model == null ? "general" : model.toLowerCase(Locale.ROOT))
                + "|" + (description == null ? "" : description.toLowerCase(Locale.ROOT));

        LaborBudgetLine line = labor.computeIfAbsent(key, k -> {
            LaborBudgetLine created = new LaborBudgetLine();
            created.setProjectId(projectId);
            created.setRoomId(room == null ? null : room.getId());
            created.setLaborType(model == null ? DEFAULT_LABOR : model);
            created.setDescription(firstNonNull(description, model, DEFAULT_LABOR));
            created.setHourlyRate(hourlyRate);
            created.setCsvBatchId(batchId);
            created.setCreatedBy(userId);
            return created;
        });
        line.addPlannedHours(hours);
        if (line.getSupplier() == null && supplier != null) {
            line.setSupplier(supplier);
        }
    }

    private static String firstNonNull(String... values) {
        for (String value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
