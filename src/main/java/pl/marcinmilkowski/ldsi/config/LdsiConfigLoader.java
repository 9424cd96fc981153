package pl.marcinmilkowski.ldsi.config;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.ldsi.exception.InvalidInputException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads scoring configuration overrides from JSON.
 *
 * Expected JSON structure (every section optional):
 * {
 *   "version": "1.0",
 *   "coefficients": { "alpha": 0.5, "beta": 0.3, "gamma": 0.2 },
 *   "thresholds": { "zombie": 0.3, "rebel": 0.7, "architect": 1.2 },
 *   "structural_scoring": "ABSOLUTE_QUALITY"
 * }
 *
 * Missing fields keep the values of {@link LdsiConfig#DEFAULT}.
 */
public class LdsiConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(LdsiConfigLoader.class);

    private final LdsiConfig config;
    private final String version;
    private final Path configPath;

    /**
     * Load configuration from the specified path.
     *
     * @param configPath Path to the configuration file
     * @throws IOException if the file cannot be read
     * @throws InvalidInputException if the file is not valid configuration
     */
    public LdsiConfigLoader(Path configPath) throws IOException {
        this.configPath = configPath;

        if (!Files.exists(configPath)) {
            throw new IOException("LDSI config file not found: " + configPath);
        }

        String content = Files.readString(configPath);
        JSONObject root;
        try {
            root = JSON.parseObject(content);
        } catch (JSONException e) {
            throw new InvalidInputException("Malformed LDSI config " + configPath + ": " + e.getMessage(), e);
        }
        if (root == null) {
            throw new InvalidInputException("Empty LDSI config: " + configPath);
        }

        String parsedVersion = root.getString("version");
        this.version = parsedVersion == null || parsedVersion.isBlank() ? "unversioned" : parsedVersion;
        this.config = LdsiConfig.fromJson(root, LdsiConfig.DEFAULT);

        logger.info("Loaded LDSI config version {} from {}: {}, thresholds {}/{}/{}, scoring {}",
            version, configPath, config.coefficients(),
            config.thresholds().zombie(), config.thresholds().rebel(), config.thresholds().architect(),
            config.structuralScoring());
    }

    /**
     * Load {@code configPath} if given, otherwise use the defaults.
     */
    public static LdsiConfig loadOrDefault(String configPath) throws IOException {
        if (configPath == null || configPath.isBlank()) {
            return LdsiConfig.DEFAULT;
        }
        return new LdsiConfigLoader(Path.of(configPath)).getConfig();
    }

    public LdsiConfig getConfig() {
        return config;
    }

    public String getVersion() {
        return version;
    }

    public Path getConfigPath() {
        return configPath;
    }

    /**
     * Export the loaded config for API responses.
     */
    public JSONObject toJson() {
        JSONObject root = config.toJson();
        root.put("version", version);
        root.put("config_path", configPath.toString());
        return root;
    }
}
