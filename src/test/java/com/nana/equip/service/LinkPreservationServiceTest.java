package com.nana.equip.service;

import com.nana.equip.domain.InstallSide;
import com.nana.equip.domain.LinkSnapshot;
import com.nana.equip.domain.ProjectEquipment;
import com.nana.equip.domain.WireDropLink;
import com.nana.equip.repository.RepositoryException;
import com.nana.equip.repository.WireDropLinkRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LinkPreservationServiceTest {

    @Mock
    private WireDropLinkRepository linkRepository;

    private LinkPreservationService service;

    @BeforeEach
    void setUp() {
        service = new LinkPreservationService(linkRepository);
    }

    private static LinkSnapshot snapshot(String wireDrop, String oldEquipmentId, String partNumber,
                                         String name, String side) {
        WireDropLink link = new WireDropLink(wireDrop, oldEquipmentId);
        link.setId("link-" + wireDrop + "-" + oldEquipmentId);
        link.setLinkSide(side);
        return new LinkSnapshot(link, oldEquipmentId, name, partNumber, "room-1", InstallSide.ROOM_END, 1);
    }

    private static ProjectEquipment instance(String id, String partNumber, String name, int number) {
        ProjectEquipment e = new ProjectEquipment();
        e.setId(id);
        e.setRoomId("room-1");
        e.setPartNumber(partNumber);
        e.setName(name);
        e.setInstallSide(InstallSide.ROOM_END);
        e.setInstanceNumber(number);
        return e;
    }

    @Test
    @DisplayName("capture delegates to the store and propagates its failure")
    void capturePropagates() {
        when(linkRepository.captureForProject("p")).thenThrow(new RepositoryException("read failed"));
        assertThrows(RepositoryException.class, () -> service.capture("p"));
    }

    @Test
    @DisplayName("A link whose equipment survives is moved to the first new instance")
    void restoresMatchedLink() {
        List<ProjectEquipment> fresh = List.of(
                instance("new-2", "SPK-X", "Speaker X", 2),
                instance("new-1", "SPK-X", "Speaker X", 1));

        LinkRestorationResult result = service.restore(
                List.of(snapshot("WD-1", "old-1", "SPK-X", "Speaker X", "room_end")), fresh);

        assertTrue(result.wasAttempted());
        assertEquals(1, result.getRestored());
        assertEquals(0, result.getFailed());
        WireDropLink restored = result.getRestoredLinks().get(0);
        assertEquals("new-1", restored.getEquipmentId());
        assertEquals("WD-1", restored.getWireDropId());
        assertEquals("room_end", restored.getLinkSide());
        verify(linkRepository).insertAll(List.of(restored));
    }

    @Test
    @DisplayName("A link whose equipment left the proposal is reported, not restored")
    void unmatchedLinkFails() {
        LinkRestorationResult result = service.restore(
                List.of(snapshot("WD-1", "old-1", "SPK-X", "Speaker X", "room_end"),
                        snapshot("WD-2", "old-2", "OLD-AMP", "Old Amp", "head_end")),
                List.of(instance("new-1", "SPK-X", "Speaker X", 1)));

        assertEquals(1, result.getRestored());
        assertEquals(1, result.getFailed());
        LinkRestorationResult.LinkFailure failure = result.getFailures().get(0);
        assertEquals("WD-2", failure.getWireDropId());
        assertEquals("old-2", failure.getOldEquipmentId());
        assertEquals("OLD-AMP", failure.getOldPartNumber());
        assertEquals(LinkRestorationResult.REASON_NOT_IN_PROPOSAL, failure.getReason());
    }

    @Test
    @DisplayName("Two old links collapsing onto the same instance and side keep only the first")
    void duplicateTripleFails() {
        LinkRestorationResult result = service.restore(
                List.of(snapshot("WD-1", "old-1", "SPK-X", "Speaker X", "room_end"),
                        snapshot("WD-1", "old-2", "SPK-X", "Speaker X", "room_end")),
                List.of(instance("new-1", "SPK-X", "Speaker X", 1)));

        assertEquals(1, result.getRestored());
        assertEquals(1, result.getFailed());
        assertEquals(LinkRestorationResult.REASON_DUPLICATE, result.getFailures().get(0).getReason());
    }

    @Test
    @DisplayName("When the batch insert fails every matched link is reported and none is restored")
    void insertFailureDegrades() {
        doThrow(new RepositoryException("FK violation")).when(linkRepository).insertAll(anyList());

        LinkRestorationResult result = service.restore(
                List.of(snapshot("WD-1", "old-1", "SPK-X", "Speaker X", "room_end"),
                        snapshot("WD-2", "old-2", "GONE", "Gone", "room_end")),
                List.of(instance("new-1", "SPK-X", "Speaker X", 1)));

        assertEquals(0, result.getRestored());
        assertEquals(2, result.getFailed());
        assertTrue(result.getFailures().stream()
                .anyMatch(f -> f.getReason().startsWith("link insert failed")));
    }

    @Test
    @DisplayName("Restored links never point at the deleted equipment ids")
    void noStaleIds() {
        service.restore(List.of(snapshot("WD-1", "old-1", "SPK-X", "Speaker X", "room_end")),
                List.of(instance("new-1", "SPK-X", "Speaker X", 1)));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<WireDropLink>> captor = ArgumentCaptor.forClass(List.class);
        verify(linkRepository).insertAll(captor.capture());
        assertTrue(captor.getValue().stream().noneMatch(l -> "old-1".equals(l.getEquipmentId())));
        assertTrue(captor.getValue().stream().allMatch(l -> l.getId() == null));
    }

    @Test
    @DisplayName("No snapshots means nothing is written")
    void emptySnapshots() {
        LinkRestorationResult result = service.restore(List.of(), List.of(instance("new-1", "A", "A", 1)));
        assertEquals(0, result.getRestored());
        verifyNoInteractions(linkRepository);
    }

    @Test
    @DisplayName("skip hands the captured snapshots back without writing")
    void skipReturnsSnapshots() {
        List<LinkSnapshot> snapshots = List.of(snapshot("WD-1", "old-1", "SPK-X", "Speaker X", "room_end"));

        LinkRestorationResult result = service.skip(snapshots);

        assertFalse(result.wasAttempted());
        assertEquals(snapshots, result.getPendingSnapshots());
        verifyNoInteractions(linkRepository);
    }
}
