package io.github.yok.cdflib.config;

import com.google.common.base.Splitter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Reads application settings from an {@code .ini} file.
 *
 * <pre>
 * ; comment
 * [database]
 * hostname = localhost
 * password = "secret"
 * </pre>
 *
 * <p>
 * The file is parsed on first access. Keys before the first section header are ignored, as are
 * lines without {@code =}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public final class ConfigurationSettings {

    private static final Splitter KEY_VALUE = Splitter.on('=').limit(2).trimResults();

    private Path configFile;
    // section name -> key -> value; null until parsed
    private Map<String, Map<String, String>> parsed;

    /**
     * Selects the file to read. Discards anything parsed from a previous file.
     *
     * @param file path of the {@code .ini} file
     * @throws IllegalArgumentException if the file does not exist
     */
    public void setConfigFile(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new IllegalArgumentException("Configuration file not found: " + file);
        }
        this.configFile = file;
        this.parsed = null;
    }

    /**
     * Returns every key of a section.
     *
     * @param name section name
     * @return key to value, or {@code null} if there is no such section
     * @throws IllegalStateException if no file is set or it cannot be read
     */
    public Map<String, String> getSection(String name) {
        Map<String, String> section = parse().get(name);
        return section == null ? null : Collections.unmodifiableMap(section);
    }

    /**
     * Returns one value.
     *
     * @param section section name
     * @param key key within the section
     * @return value, or {@code null} if the section or key is missing
     * @throws IllegalStateException if no file is set or it cannot be read
     */
    public String getValue(String section, String key) {
        Map<String, String> s = getSection(section);
        return s == null ? null : s.get(key);
    }

    private Map<String, Map<String, String>> parse() {
        if (parsed != null) {
            return parsed;
        }
        if (configFile == null) {
            throw new IllegalStateException("Configuration file not set");
        }
        List<String> lines;
        try {
            lines = FileUtils.readLines(configFile.toFile(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Configuration file could not be loaded: "
                    + configFile, e);
        }
        Map<String, Map<String, String>> sections = new LinkedHashMap<>();
        Map<String, String> current = null;
        for (String raw : lines) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith(";") || line.startsWith("#")) {
                continue;
            }
            if (line.startsWith("[") && line.endsWith("]")) {
                current = sections.computeIfAbsent(line.substring(1, line.length() - 1).trim(),
                        k -> new LinkedHashMap<>());
                continue;
            }
            if (current == null || line.indexOf('=') < 0) {
                continue;
            }
            List<String> kv = KEY_VALUE.splitToList(line);
            current.put(kv.get(0), unquote(kv.get(1)));
        }
        log.info("Configuration loaded. file={}, sections={}", configFile, sections.keySet());
        parsed = sections;
        return parsed;
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1);
        }
        return StringUtils.defaultString(value);
    }
}
