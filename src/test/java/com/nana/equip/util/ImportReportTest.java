package com.nana.equip.util;

import com.nana.equip.domain.ImportMode;
import com.nana.equip.domain.InstallSide;
import com.nana.equip.domain.LinkSnapshot;
import com.nana.equip.domain.WireDropLink;
import com.nana.equip.service.ImportFormat;
import com.nana.equip.service.LinkRestorationResult;
import com.nana.equip.service.SyncOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ImportReportTest {

    private static LinkSnapshot snapshot(String wireDrop) {
        return new LinkSnapshot(new WireDropLink(wireDrop, "old-1"), "old-1", "Old Amp", "AMP-1",
                "room-1", InstallSide.HEAD_END, 1);
    }

    @Test
    @DisplayName("Processed rows add equipment and labor inserts and updates")
    void processedRows() {
        ImportReport report = new ImportReport.Builder("p", "b")
                .equipmentInserted(3).equipmentUpdated(2).laborInserted(1).laborUpdated(4)
                .build();
        assertEquals(10, report.getProcessedRows());
        assertFalse(report.hasWarnings());
        assertNull(report.getLinkRestoration());
    }

    @Test
    @DisplayName("Report text lists every unrestored wire drop link")
    void reportTextListsFailures() {
        LinkRestorationResult links = LinkRestorationResult.completed(
                List.of(new WireDropLink("WD-1", "new-1")),
                List.of(new LinkRestorationResult.LinkFailure(snapshot("WD-7"),
                        LinkRestorationResult.REASON_NOT_IN_PROPOSAL)));

        ImportReport report = new ImportReport.Builder("p", "batch-42")
                .filename("proposal.csv")
                .importedAt(LocalDateTime.of(2024, 5, 1, 9, 30))
                .format(ImportFormat.STANDARD)
                .mode(ImportMode.REPLACE)
                .equipmentInserted(2)
                .linkRestoration(links)
                .build();

        String text = report.toReportText();
        assertTrue(text.contains("batch-42"));
        assertTrue(text.contains("2024-05-01 09:30:00"));
        assertTrue(text.contains("Wire drop links restored: 1, failed: 1"));
        assertTrue(text.contains("WD-7 | AMP-1 / Old Amp | no longer in proposal"));
        assertTrue(report.hasWarnings());
        assertTrue(report.getSummary().contains("Links restored: 1, failed: 1."));
    }

    @Test
    @DisplayName("Sync and alias failures are warnings")
    void syncWarnings() {
        ImportReport report = new ImportReport.Builder("p", "b")
                .aliasFailures(List.of("alias upsert failed"))
                .syncOutcome(new SyncOutcome(0, 0, 0, List.of("SPK: locked"), List.of()))
                .build();

        assertTrue(report.hasWarnings());
        String text = report.toReportText();
        assertTrue(text.contains("room alias: alias upsert failed"));
        assertTrue(text.contains("catalog: SPK: locked"));
    }

    @Test
    @DisplayName("Skipped relinking reports how many links were captured")
    void skippedRelink() {
        ImportReport report = new ImportReport.Builder("p", "b")
                .linkRestoration(LinkRestorationResult.notAttempted(List.of(snapshot("WD-1"), snapshot("WD-2"))))
                .build();

        assertFalse(report.hasWarnings());
        assertTrue(report.toReportText().contains("skipped; 2 link(s) captured"));
    }
}
