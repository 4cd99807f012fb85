package org.normharvest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class SaverTest {
    private final ObjectMapper json = new ObjectMapper();

    @TempDir
    Path tempDir;

    static DocumentRecord document(String title, int year, String url) {
        return DocumentRecord.markdown(title, year, "Resolução", "Não consta", "ementa", "# " + title, url,
                Map.of("id", "42"));
    }

    private static List<Path> jsonFiles(Path dir) throws IOException {
        if (!Files.exists(dir)) return List.of();
        try (Stream<Path> files = Files.walk(dir)) {
            return files.filter(p -> p.toString().endsWith(".json")).sorted().collect(Collectors.toList());
        }
    }

    @Test
    void checkpointIsNewestYearMinusOne() throws IOException {
        assertNull(Saver.scanCheckpoint(tempDir.resolve("missing")));
        assertNull(Saver.scanCheckpoint(tempDir));
        Files.createDirectories(tempDir.resolve("1990"));
        Files.createDirectories(tempDir.resolve("2005"));
        Files.createDirectories(tempDir.resolve("errors"));
        Files.createFile(tempDir.resolve("2030"));
        assertEquals(2004, Saver.scanCheckpoint(tempDir));
    }

    @Test
    void writesRecordsIntoYearTypeSituationTree() throws Exception {
        Path saveDir = tempDir.resolve("out");
        Path errorDir = tempDir.resolve("err");
        var saver = new Saver(saveDir, errorDir, 245);
        saver.start();
        saver.enqueueSuccess(document("Resolução CONAMA Nº 1/2020", 2020, "https://host/download?id=1"));
        saver.enqueueError(new ErrorRecord("Moção 2/2020", 2020, "Moção", "Não consta", "https://host/list",
                "https://host/doc2.pdf", "No text", Map.of()));
        saver.close();

        assertFalse(saver.isAlive());
        assertEquals(1, saver.savedCount());
        assertEquals(1, saver.errorsSavedCount());

        List<Path> saved = jsonFiles(saveDir);
        assertEquals(1, saved.size());
        assertEquals(saveDir.resolve("2020").resolve("Resolução").resolve("Não consta"), saved.get(0).getParent());
        JsonNode record = json.readTree(saved.get(0).toFile());
        assertEquals("Resolução CONAMA Nº 1/2020", record.get("title").asText());
        assertEquals(2020, record.get("year").asInt());
        assertEquals("# Resolução CONAMA Nº 1/2020", record.get("text_markdown").asText());
        assertEquals("42", record.get("id").asText());
        assertFalse(record.has("html_string"));

        List<Path> errors = jsonFiles(errorDir);
        assertEquals(1, errors.size());
        assertEquals("Mocao_22020_doc2.json", errors.get(0).getFileName().toString());
        assertEquals("No text", json.readTree(errors.get(0).toFile()).get("error").asText());
    }

    @Test
    void drainsQueueOnClose() throws Exception {
        var saver = new Saver(tempDir.resolve("out"), tempDir.resolve("err"), 245);
        saver.start();
        for (int i = 0; i < 50; i++) {
            saver.enqueueSuccess(document("Lei " + i, 2001, "https://host/lei_" + i + ".pdf"));
        }
        saver.close();
        assertEquals(0, saver.pending());
        assertEquals(50, jsonFiles(tempDir.resolve("out")).size());
    }

    @Test
    void closeWithoutStartStillWritesQueuedRecords() throws Exception {
        var saver = new Saver(tempDir.resolve("out"), tempDir.resolve("err"), 245);
        saver.enqueueSuccess(document("Lei 1", 2001, "https://host/lei_1.pdf"));
        saver.close();
        saver.close();
        assertEquals(1, jsonFiles(tempDir.resolve("out")).size());
    }

    @Test
    void failedWriteIsReroutedToErrorTree() throws Exception {
        Path saveDir = tempDir.resolve("out");
        DocumentRecord record = document("Lei 7", 2010, "https://host/lei_7.pdf");
        // a directory where the record's file should go makes the write fail
        Files.createDirectories(saveDir.resolve("2010").resolve("Resolução").resolve("Não consta")
                .resolve("Lei_7_lei_7.json"));
        var saver = new Saver(saveDir, tempDir.resolve("err"), 245);
        saver.start();
        saver.enqueueSuccess(record);
        saver.close();

        assertEquals(0, saver.savedCount());
        assertEquals(1, saver.failedWriteCount());
        assertEquals(1, saver.errorsSavedCount());
        List<Path> errors = jsonFiles(tempDir.resolve("err"));
        assertEquals(1, errors.size());
        JsonNode error = json.readTree(errors.get(0).toFile());
        assertTrue(error.get("error").asText().startsWith("Failed to save document"));
        assertEquals("https://host/lei_7.pdf", error.get("document_url").asText());
    }

    @Test
    void recordsEnqueuedAfterWriterExitedAreWritten() throws Exception {
        var saver = new Saver(tempDir.resolve("out"), tempDir.resolve("err"), 245);
        saver.start();
        saver.close();
        assertFalse(saver.isAlive());

        saver.enqueueSuccess(document("Lei 9", 2003, "https://host/lei_9.pdf"));
        saver.enqueueError(new ErrorRecord("Lei 10", 2003, "Lei", "Revogada", "https://host/list",
                "https://host/lei_10.pdf", "No text", Map.of()));
        assertEquals(0, saver.pending());
        assertEquals(1, saver.savedCount());
        assertEquals(1, jsonFiles(tempDir.resolve("out")).size());
        assertEquals(1, jsonFiles(tempDir.resolve("err")).size());
    }

    @Test
    void saveDirectoryTooLongIsReroutedToErrorTree() throws Exception {
        Path saveDir = tempDir.resolve("x".repeat(100));
        int max = tempDir.toAbsolutePath().toString().length() + 70;
        var saver = new Saver(saveDir, tempDir.resolve("err"), max);
        saver.start();
        saver.enqueueSuccess(document("Lei 11", 2012, "https://host/lei_11.pdf"));
        saver.close();

        assertEquals(0, saver.savedCount());
        assertEquals(1, saver.failedWriteCount());
        assertEquals(List.of(), jsonFiles(saveDir));
        List<Path> errors = jsonFiles(tempDir.resolve("err"));
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).toAbsolutePath().toString().length() <= max);
        assertTrue(json.readTree(errors.get(0).toFile()).get("error").asText().contains("too long"));
    }

    @Test
    void cannotStartTwice() throws Exception {
        var saver = new Saver(tempDir.resolve("out"), tempDir.resolve("err"), 245);
        saver.start();
        try {
            assertThrows(IllegalStateException.class, saver::start);
        } finally {
            saver.close();
        }
    }
}
