package com.nana.equip.service;

import com.nana.equip.domain.EquipmentType;
import com.nana.equip.domain.InstallSide;
import com.nana.equip.domain.ProjectEquipment;
import com.nana.equip.domain.ProjectRoom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * VendorCatalogRecordBuilder: builds records from a shade/automation vendor
 * catalog export.
 *
 * <p>The part number is synthesized as {@code "{Technology} {Product}"} and
 * the model prefers the {@code Product Details} column. Catalog-specific
 * attributes (fabric, mount, dimensions, battery power, sub-type) go into the
 * metadata bag. Equipment type is always {@code part}; the catalog's own
 * product type is kept only in metadata. This format produces no labor lines.
 */
public class VendorCatalogRecordBuilder extends AbstractRecordBuilder {

    private static final Logger log = LoggerFactory.getLogger(VendorCatalogRecordBuilder.class);

    static final String   SOURCE            = "vendor-catalog";
    static final String   DEFAULT_MAKER     = "Lutron";

    static final String[] ROOM            = {"Area", "Room", "Location"};
    static final String[] NAME            = {"Name"};
    static final String[] QUANTITY        = {"Quantity", "Qty"};
    static final String[] TECHNOLOGY      = {"Technology"};
    static final String[] PRODUCT         = {"Product"};
    static final String[] PRODUCT_TYPE    = {"Product Type"};
    static final String[] PRODUCT_DETAILS = {"Product Details"};
    static final String[] MOUNT           = {"System Mount"};
    static final String[] FABRIC          = {"Fabric"};
    static final String[] WIDTH           = {"Width"};
    static final String[] HEIGHT          = {"Height"};
    static final String[] BATTERY         = {"Battery Power"};
    static final String[] LIST_PRICE      = {"List Price"};
    static final String[] COST            = {"Cost"};
    static final String[] MANUFACTURER    = {"Manufacturer", "Brand"};
    static final String[] DESCRIPTION     = {"Description"};
    static final String[] SUPPLIER        = {"Supplier"};

    @Override
    public ImportFormat format() {
        return ImportFormat.VENDOR_CATALOG;
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
        int skipped = 0;

        for (SpreadsheetRow row : rows) {
            String roomName  = roomNameOf(row);
            String qtyText   = row.text(QUANTITY);
            double quantity  = qtyText == null ? 1 : RowNormalizer.number(qtyText);

            if (roomName == null || quantity <= 0) {
                log.debug("Skipping catalog row {}: quantity={}, room={}.",
                        row.getRowNumber(), quantity, roomName);
                skipped++;
                continue;
            }
            if (exceedsInstanceLimit(quantity)) {
                log.warn("Skipping catalog row {}: quantity {} exceeds {} instances per row.",
                        row.getRowNumber(), quantity, MAX_INSTANCES_PER_ROW);
                skipped++;
                continue;
            }

            ProjectRoom room      = rooms.roomFor(roomName);
            String roomKey        = RowNormalizer.roomKey(roomName);
            String technology     = row.text(TECHNOLOGY);
            String product        = row.text(PRODUCT);
            String productType    = row.text(PRODUCT_TYPE);
            String shadeName      = row.text(NAME);
            String partNumber     = partNumberOf(technology, product);
            String model          = row.text(PRODUCT_DETAILS);
            if (model == null) {
                model = product;
            }
            String name = shadeName != null ? shadeName
                    : partNumber != null ? partNumber
                    : UNNAMED_EQUIPMENT;
            String manufacturer = row.text(MANUFACTURER);

            ProjectEquipment template = new ProjectEquipment();
            template.setProjectId(projectId);
            template.setRoomId(room == null ? null : room.getId());
            template.setCsvBatchId(batchId);
            template.setName(name);
            template.setDescription(row.text(DESCRIPTION) != null ? row.text(DESCRIPTION) : productType);
            template.setManufacturer(manufacturer == null ? DEFAULT_MAKER : manufacturer);
            template.setModel(model);
            template.setPartNumber(partNumber);
            template.setInstallSide(InstallSide.forRoom(room));
            template.setEquipmentType(EquipmentType.PART);
            template.setUnitOfMeasure("ea");
            template.setUnitCost(row.number(COST));
            template.setUnitPrice(row.number(LIST_PRICE));
            template.setSupplier(row.text(SUPPLIER));
            template.setCreatedBy(userId);
            template.setMetadata(metadataOf(row, shadeName, productType, technology, product));

            String roomDisplay = room == null ? roomName : room.getName();
            String partLabel   = partNumber == null ? name : partNumber;
            equipment.addAll(expand(template, instanceCount(quantity),
                    roomDisplay, roomKey, partLabel, counter));
        }

        log.info("Vendor catalog build: {} equipment instance(s), {} row(s) skipped.",
                equipment.size(), skipped);
        return new BuildResult(equipment, new ArrayList<>(), skipped);
    }

    static String partNumberOf(String technology, String product) {
        String joined = ((technology == null ? "" : technology) + " "
                         + (product == null ? "" : product)).trim();
        return joined.isEmpty() ? null : joined;
    }

    private Map<String, Object> metadataOf(SpreadsheetRow row, String shadeName, String productType,
                                           String technology, String product) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("source", SOURCE);
        putIfPresent(metadata, "shade_name", shadeName);
        putIfPresent(metadata, "product_type", productType);
        putIfPresent(metadata, "technology", technology);
        putIfPresent(metadata, "product", product);
        putIfPresent(metadata, "mount_type", row.text(MOUNT));
        putIfPresent(metadata, "fabric", row.text(FABRIC));
        putIfPresent(metadata, "width", row.text(WIDTH));
        putIfPresent(metadata, "height", row.text(HEIGHT));
        putIfPresent(metadata, "battery_power", row.text(BATTERY));
        return metadata;
    }

    private static void putIfPresent(Map<String, Object> metadata, String key, String value) {
        if (value != null) {
            metadata.put(key, value);
        }
    }
}
