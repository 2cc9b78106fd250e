package com.nana.equip.service;

import com.nana.equip.domain.EquipmentKey;
import com.nana.equip.domain.LinkSnapshot;
import com.nana.equip.domain.ProjectEquipment;
import com.nana.equip.domain.WireDropLink;
import com.nana.equip.repository.RepositoryException;
import com.nana.equip.repository.WireDropLinkRepository;
import com.nana.equip.service.LinkRestorationResult.LinkFailure;
import com.nana.equip.util.AppLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * LinkPreservationService: keeps wire drop links alive across a Replace.
 *
 * <p>PROTOCOL:
 * <ol>
 *   <li>{@link #capture} before any deletion: snapshot every link of the
 *       project with the identity fields of its equipment.</li>
 *   <li>The Replace strategy deletes and re-inserts equipment.</li>
 *   <li>{@link #restore} matches each snapshot to new equipment by
 *       {@link EquipmentKey}. A hit is re-created against the key's
 *       representative instance (instance 1, else the lowest number); a miss
 *       becomes a {@link LinkFailure}.</li>
 * </ol>
 *
 * <p>Matched links are inserted in one all-or-nothing batch. If that insert
 * fails every matched link is reported as failed. {@code restore} never throws
 * for store failures.
 */
public class LinkPreservationService {

    private static final Logger log = LoggerFactory.getLogger(LinkPreservationService.class);

    private final WireDropLinkRepository linkRepository;

    public LinkPreservationService(WireDropLinkRepository linkRepository) {
        this.linkRepository = linkRepository;
    }

    /**
     * @param projectId the project about to be replaced
     * @return snapshots of every link on the project's equipment
     * @throws RepositoryException if the links cannot be read; the Replace must not proceed
     */
    public List<LinkSnapshot> capture(String projectId) {
        List<LinkSnapshot> snapshots = linkRepository.captureForProject(projectId);
        AppLogger.logEvent("WIRE_DROP_LINKS_CAPTURED",
                "project=" + projectId + " links=" + snapshots.size());
        return snapshots;
    }

    /**
     * @param snapshots    links captured before deletion
     * @param newEquipment the freshly inserted equipment, ids set
     * @return restored links and itemized failures
     */
    public LinkRestorationResult restore(List<LinkSnapshot> snapshots,
                                         List<ProjectEquipment> newEquipment) {
        if (snapshots.isEmpty()) {
            return LinkRestorationResult.completed(List.of(), List.of());
        }

        Map<EquipmentKey, ProjectEquipment> representatives = representativesByKey(newEquipment);
        List<WireDropLink> matched = new ArrayList<>();
        List<LinkSnapshot> matchedFrom = new ArrayList<>();
        List<LinkFailure> failures = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (LinkSnapshot snapshot : snapshots) {
            ProjectEquipment target = representatives.get(snapshot.oldKey());
            if (target == null) {
                failures.add(new LinkFailure(snapshot, LinkRestorationResult.REASON_NOT_IN_PROPOSAL));
                continue;
            }
            WireDropLink link = snapshot.getLink().retarget(target.getId());
            String identity = link.getWireDropId() + '|' + link.getEquipmentId() + '|' + link.getLinkSide();
            if (!seen.add(identity)) {
                failures.add(new LinkFailure(snapshot, LinkRestorationResult.REASON_DUPLICATE));
                continue;
            }
            matched.add(link);
            matchedFrom.add(snapshot);
        }

        try {
            linkRepository.insertAll(matched);
        } catch (RepositoryException ex) {
            AppLogger.logErrorEvent("WIRE_DROP_RELINK_FAILED",
                    "links=" + matched.size() + " error=" + ex.getMessage(), ex);
            for (LinkSnapshot snapshot : matchedFrom) {
                failures.add(new LinkFailure(snapshot, "link insert failed: " + ex.getMessage()));
            }
            return LinkRestorationResult.completed(List.of(), failures);
        }

        if (!failures.isEmpty()) {
            AppLogger.logWarningEvent("WIRE_DROP_LINKS_UNRESTORED",
                    "restored=" + matched.size() + " failed=" + failures.size());
        }
        log.info("Restored {} of {} wire drop link(s).", matched.size(), snapshots.size());
        return LinkRestorationResult.completed(matched, failures);
    }

    /** Returns the captured snapshots without touching the store. */
    public LinkRestorationResult skip(List<LinkSnapshot> snapshots) {
        log.info("Link restoration skipped; {} captured link(s) returned to caller.", snapshots.size());
        return LinkRestorationResult.notAttempted(snapshots);
    }

    private static Map<EquipmentKey, ProjectEquipment> representativesByKey(List<ProjectEquipment> equipment) {
        Map<EquipmentKey, ProjectEquipment> byKey = new HashMap<>();
        for (ProjectEquipment item : equipment) {
            byKey.merge(item.naturalKey(), item,
                    (current, candidate) -> candidate.getInstanceNumber() < current.getInstanceNumber()
                            ? candidate : current);
        }
        return byKey;
    }
}
