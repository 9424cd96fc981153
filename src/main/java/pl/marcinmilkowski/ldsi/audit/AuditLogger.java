package pl.marcinmilkowski.ldsi.audit;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.ldsi.exception.InvalidInputException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Audit trail of scored tests.
 *
 * Two on-disk formats are produced:
 * - {@link #flush()} rewrites the whole file as a pretty-printed JSON array
 *   of every buffered entry;
 * - {@link #appendSingle(AuditEntry, Path)} appends one entry as a single
 *   JSON line, so long-running jobs never rewrite the file.
 * {@link #loadEntries(Path)} reads either format.
 */
public class AuditLogger {
    private static final Logger logger = LoggerFactory.getLogger(AuditLogger.class);

    private final Path filePath;
    private final List<AuditEntry> entries = Collections.synchronizedList(new ArrayList<>());

    public AuditLogger(Path filePath) {
        if (filePath == null) {
            throw InvalidInputException.missing("audit file path");
        }
        this.filePath = filePath;
    }

    public Path getFilePath() {
        return filePath;
    }

    /** Buffers an entry until the next {@link #flush()}. */
    public void log(AuditEntry entry) {
        if (entry == null) {
            throw InvalidInputException.missing("audit entry");
        }
        entries.add(entry);
    }

    public List<AuditEntry> getEntries() {
        synchronized (entries) {
            return List.copyOf(entries);
        }
    }

    /**
     * Writes every buffered entry as a JSON array, replacing the file.
     * The buffer is kept, so repeated flushes rewrite a growing array.
     */
    public void flush() throws IOException {
        JSONArray array = new JSONArray();
        for (AuditEntry entry : getEntries()) {
            array.add(entry.toJson());
        }
        createParent(filePath);
        Files.writeString(filePath, JSON.toJSONString(array, JSONWriter.Feature.PrettyFormat),
            StandardCharsets.UTF_8);
        logger.info("Wrote {} audit entries to {}", array.size(), filePath);
    }

    /** Appends one entry as a single JSON line, creating the file if needed. */
    public static void appendSingle(AuditEntry entry, Path path) throws IOException {
        if (entry == null) {
            throw InvalidInputException.missing("audit entry");
        }
        createParent(path);
        String line = entry.toJson().toJSONString() + System.lineSeparator();
        Files.writeString(path, line, StandardCharsets.UTF_8,
            StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        logger.debug("Appended audit entry {} to {}", entry.testId(), path);
    }

    /**
     * Reads an audit file written by either {@link #flush()} or
     * {@link #appendSingle(AuditEntry, Path)}.
     *
     * @throws InvalidInputException if the content is not audit JSON
     */
    public static List<AuditEntry> loadEntries(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Audit file not found: " + path);
        }
        String content = Files.readString(path, StandardCharsets.UTF_8).trim();
        List<AuditEntry> loaded = new ArrayList<>();
        if (content.isEmpty()) {
            return loaded;
        }

        try {
            if (content.startsWith("[")) {
                JSONArray array = JSON.parseArray(content);
                for (int i = 0; i < array.size(); i++) {
                    loaded.add(AuditEntry.fromJson(array.getJSONObject(i)));
                }
            } else {
                for (String line : content.split("\\R")) {
                    if (line.isBlank()) {
                        continue;
                    }
                    JSONObject obj = JSON.parseObject(line);
                    loaded.add(AuditEntry.fromJson(obj));
                }
            }
        } catch (JSONException e) {
            throw new InvalidInputException("Malformed audit file " + path + ": " + e.getMessage(), e);
        }
        logger.debug("Loaded {} audit entries from {}", loaded.size(), path);
        return loaded;
    }

    private static void createParent(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
