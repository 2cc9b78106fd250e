package com.nana.equip;

import com.nana.equip.domain.ImportMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class EquipmentImportCliTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        return EquipmentImportCli.run(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String dbUrl() {
        return "jdbc:sqlite:" + tempDir.resolve("cli.db").toAbsolutePath();
    }

    @Test
    @DisplayName("Options are parsed in any order")
    void parsesOptions() {
        EquipmentImportCli.Arguments args = EquipmentImportCli.Arguments.parse(new String[] {
                "--mode", "merge", "proj-1", "--skip-relink", "file.csv", "--user", "pm"});

        assertEquals("proj-1", args.projectId);
        assertEquals(Path.of("file.csv"), args.file);
        assertEquals(ImportMode.MERGE, args.mode);
        assertTrue(args.skipRelink);
        assertEquals("pm", args.userId);
    }

    @Test
    @DisplayName("Missing arguments and unknown modes are usage errors")
    void usageErrors() {
        assertEquals(EquipmentImportCli.EXIT_USAGE, run("proj-1"));
        assertEquals(EquipmentImportCli.EXIT_USAGE, run("proj-1", "f.csv", "--mode", "upsert"));
        assertEquals(EquipmentImportCli.EXIT_USAGE, run("proj-1", "f.csv", "--mode"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Usage:"));
    }

    @Test
    @DisplayName("A successful import prints the report")
    void successfulImport() throws IOException {
        Path file = tempDir.resolve("proposal.csv");
        Files.writeString(file, "Area,ItemType,AreaQty,Model\nDen,Part,1,TV\n", StandardCharsets.UTF_8);

        int code = run("proj-1", file.toString(), "--db", dbUrl());

        assertEquals(EquipmentImportCli.EXIT_OK, code);
        String report = out.toString(StandardCharsets.UTF_8);
        assertTrue(report.contains("Equipment Import Report"));
        assertTrue(report.contains("proposal.csv"));
    }

    @Test
    @DisplayName("An empty file exits with the failure code")
    void emptyFile() throws IOException {
        Path file = tempDir.resolve("empty.csv");
        Files.writeString(file, "Area,ItemType\n", StandardCharsets.UTF_8);

        assertEquals(EquipmentImportCli.EXIT_FAILED, run("proj-1", file.toString(), "--db", dbUrl()));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("EMPTY_FILE"));
    }
}
