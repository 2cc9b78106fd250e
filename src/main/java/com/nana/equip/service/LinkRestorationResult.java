package com.nana.equip.service;

import com.nana.equip.domain.LinkSnapshot;
import com.nana.equip.domain.WireDropLink;

import java.util.List;

/**
 * Outcome of re-attaching captured wire drop links after a Replace import.
 * Every captured link is either restored or listed as a failure. When
 * restoration was skipped the captured snapshots are returned untouched so
 * the caller can restore them later.
 */
public final class LinkRestorationResult {

    public static final String REASON_NOT_IN_PROPOSAL = "no longer in proposal";
    public static final String REASON_DUPLICATE       = "duplicate link to same instance";

    private final boolean            attempted;
    private final List<WireDropLink> restoredLinks;
    private final List<LinkFailure>  failures;
    private final List<LinkSnapshot> pendingSnapshots;

    private LinkRestorationResult(boolean attempted,
                                  List<WireDropLink> restoredLinks,
                                  List<LinkFailure> failures,
                                  List<LinkSnapshot> pendingSnapshots) {
        this.attempted        = attempted;
        this.restoredLinks    = List.copyOf(restoredLinks);
        this.failures         = List.copyOf(failures);
        this.pendingSnapshots = List.copyOf(pendingSnapshots);
    }

    public static LinkRestorationResult completed(List<WireDropLink> restored,
                                                  List<LinkFailure> failures) {
        return new LinkRestorationResult(true, restored, failures, List.of());
    }

    public static LinkRestorationResult notAttempted(List<LinkSnapshot> snapshots) {
        return new LinkRestorationResult(false, List.of(), List.of(), snapshots);
    }

    public boolean wasAttempted()                    { return attempted; }
    public int getRestored()                         { return restoredLinks.size(); }
    public int getFailed()                           { return failures.size(); }
    public List<WireDropLink> getRestoredLinks()     { return restoredLinks; }
    public List<LinkFailure> getFailures()           { return failures; }
    public List<LinkSnapshot> getPendingSnapshots()  { return pendingSnapshots; }

    @Override
    public String toString() {
        return attempted
                ? "LinkRestorationResult{restored=" + getRestored() + ", failed=" + getFailed() + '}'
                : "LinkRestorationResult{skipped, pending=" + pendingSnapshots.size() + '}';
    }

    // -----------------------------------------------------------------------
    // INNER CLASS: LinkFailure
    // -----------------------------------------------------------------------

    /**
     * A captured link that could not be re-created, with enough of the old
     * equipment's identity for an operator to relink it by hand.
     */
    public static final class LinkFailure {

        private final String wireDropId;
        private final String oldEquipmentId;
        private final String oldName;
        private final String oldPartNumber;
        private final String oldRoomId;
        private final String linkSide;
        private final String reason;

        public LinkFailure(LinkSnapshot snapshot, String reason) {
            this.wireDropId     = snapshot.getWireDropId();
            this.oldEquipmentId = snapshot.getOldEquipmentId();
            this.oldName        = snapshot.getOldName();
            this.oldPartNumber  = snapshot.getOldPartNumber();
            this.oldRoomId      = snapshot.getOldRoomId();
            this.linkSide       = snapshot.getLink().getLinkSide();
            this.reason         = reason;
        }

        public String getWireDropId()     { return wireDropId; }
        public String getOldEquipmentId() { return oldEquipmentId; }
        public String getOldName()        { return oldName; }
        public String getOldPartNumber()  { return oldPartNumber; }
        public String getOldRoomId()      { return oldRoomId; }
        public String getLinkSide()       { return linkSide; }
        public String getReason()         { return reason; }

        @Override
        public String toString() {
            return "LinkFailure{wireDrop='" + wireDropId + "', part='" + oldPartNumber
                   + "', name='" + oldName + "', reason='" + reason + "'}";
        }
    }
}
