package pl.marcinmilkowski.ldsi.audit;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import pl.marcinmilkowski.ldsi.exception.InvalidInputException;
import pl.marcinmilkowski.ldsi.scoring.LdsiScorer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AuditLoggerTest {

    @TempDir
    Path tempDir;

    private static AuditEntry entry(String responseB) {
        String responseA = "Le chat dort sur le canape du salon.";
        return AuditEntry.create("model-x", "prompt", "prompt", responseA, responseB,
            LdsiScorer.score(responseA, responseB), 3);
    }

    @Test
    @DisplayName("Flushed array should load back in order")
    void testFlushAndLoad() throws IOException {
        Path file = tempDir.resolve("reports/audit.json");
        AuditLogger auditLogger = new AuditLogger(file);
        auditLogger.log(entry("Un felin somnole paisiblement."));
        auditLogger.log(entry("Le chat dort."));
        auditLogger.flush();
        assertEquals(file, auditLogger.getFilePath());

        assertTrue(Files.readString(file).trim().startsWith("["));
        List<AuditEntry> loaded = AuditLogger.loadEntries(file);
        assertEquals(2, loaded.size());
        assertEquals("Le chat dort.", loaded.get(1).responseB());
        assertEquals(auditLogger.getEntries().get(0).testId(), loaded.get(0).testId());
    }

    @Test
    @DisplayName("Appended lines should accumulate")
    void testAppendSingle() throws IOException {
        Path file = tempDir.resolve("audit.jsonl");
        for (int i = 0; i < 3; i++) {
            AuditLogger.appendSingle(entry("Reponse numero " + i), file);
        }

        assertEquals(3, Files.readAllLines(file).size());
        List<AuditEntry> loaded = AuditLogger.loadEntries(file);
        assertEquals(3, loaded.size());
        assertEquals("Reponse numero 2", loaded.get(2).responseB());
        assertTrue(loaded.stream().allMatch(AuditEntry::verifyIntegrity));
    }

    @Test
    @DisplayName("An empty file should load as no entries")
    void testEmptyFile() throws IOException {
        Path file = tempDir.resolve("empty.json");
        Files.writeString(file, "  \n");
        assertTrue(AuditLogger.loadEntries(file).isEmpty());
    }

    @Test
    @DisplayName("Broken or missing files should fail loudly")
    void testBadFiles() throws IOException {
        Path broken = tempDir.resolve("broken.json");
        Files.writeString(broken, "[{\"timestamp\": ");
        assertThrows(InvalidInputException.class, () -> AuditLogger.loadEntries(broken));
        assertThrows(IOException.class, () -> AuditLogger.loadEntries(tempDir.resolve("absent.json")));
    }

    @Test
    @DisplayName("Buffered entries should be a snapshot")
    void testEntriesSnapshot() {
        AuditLogger auditLogger = new AuditLogger(tempDir.resolve("audit.json"));
        auditLogger.log(entry("Le chat dort."));
        List<AuditEntry> snapshot = auditLogger.getEntries();
        auditLogger.log(entry("Le chat ronfle."));
        assertEquals(1, snapshot.size());
        assertEquals(2, auditLogger.getEntries().size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(null));
    }
}
