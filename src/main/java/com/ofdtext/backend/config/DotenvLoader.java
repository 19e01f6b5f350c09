package com.ofdtext.backend.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a local ".env" file (BASIC_AUTH_USERNAME=..., APP_PORT=..., ...) into System properties
 * so that placeholders in application.properties resolve during local runs.
 *
 * Real environment variables and already defined System properties always win; a missing file is not an error.
 */
public final class DotenvLoader {

    private static final Logger log = LoggerFactory.getLogger(DotenvLoader.class);

    private static final String EXPORT_PREFIX = "export ";

    private DotenvLoader() {
    }

    public static void loadFromWorkingDirectoryIfPresent() {
        Path envPath = Path.of(".env");
        if (!Files.isRegularFile(envPath)) {
            return;
        }

        try {
            int loaded = load(Files.readAllLines(envPath, StandardCharsets.UTF_8));
            if (loaded > 0) {
                log.info("[DotenvLoader] {} keys loaded from {} (values hidden)", loaded, envPath.toAbsolutePath());
            }
        } catch (IOException e) {
            log.warn("[DotenvLoader] Could not read {}, skipping: {}", envPath.toAbsolutePath(), e.getMessage());
        }
    }

    /**
     * Applies "KEY=value" lines to System properties.
     *
     * @return how many keys were actually set
     */
    static int load(List<String> lines) {
        int loaded = 0;
        for (String raw : lines) {
            String line = raw == null ? "" : raw.strip();
            if (line.isEmpty() || line.startsWith("#")) continue;
            if (line.startsWith(EXPORT_PREFIX)) {
                line = line.substring(EXPORT_PREFIX.length()).strip();
            }

            int eq = line.indexOf('=');
            if (eq <= 0) continue;

            String key = line.substring(0, eq).strip();
            String value = unquote(line.substring(eq + 1).strip());
            if (key.isEmpty() || value.isEmpty()) continue;

            if (isDefined(System.getenv(key)) || isDefined(System.getProperty(key))) {
                continue;
            }

            System.setProperty(key, value);
            loaded++;
        }
        return loaded;
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }

    private static boolean isDefined(String value) {
        return value != null && !value.isBlank();
    }
}
