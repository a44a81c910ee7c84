package net.spookly.hostpilot.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Resolves indirect scalar values in a parsed YAML tree so credentials never sit in the file.
 *
 * <ul>
 *     <li>{@code env:NAME} reads an environment variable, {@code env:NAME:-fallback} uses the
 *     fallback when it is unset.</li>
 *     <li>{@code path:file} reads a file relative to the config directory, trimmed.</li>
 * </ul>
 * Every file read this way is remembered for the permission check in {@link ConfigWarnings}.
 */
final class EnvExpander {
    static final String ENV_PREFIX = "env:";
    static final String PATH_PREFIX = "path:";
    private static final String FALLBACK_SEPARATOR = ":-";

    private final Path baseDir;
    private final Function<String, String> env;
    private final List<Path> secretFiles = new ArrayList<>();

    EnvExpander(Path baseDir) {
        this(baseDir, System::getenv);
    }

    EnvExpander(Path baseDir, Function<String, String> env) {
        this.baseDir = baseDir;
        this.env = env;
    }

    Object expand(Object node) {
        if (node instanceof Map) {
            Map<Object, Object> resolved = new LinkedHashMap<>();
            ((Map<?, ?>) node).forEach((key, value) -> resolved.put(key, expand(value)));
            return resolved;
        }
        if (node instanceof List) {
            List<Object> resolved = new ArrayList<>();
            for (Object item : (List<?>) node) {
                resolved.add(expand(item));
            }
            return resolved;
        }
        if (node instanceof String) {
            return expandScalar((String) node);
        }
        return node;
    }

    List<Path> secretFiles() {
        return Collections.unmodifiableList(secretFiles);
    }

    private String expandScalar(String value) {
        if (value.startsWith(ENV_PREFIX)) {
            return readEnv(value.substring(ENV_PREFIX.length()));
        }
        if (value.startsWith(PATH_PREFIX)) {
            return readSecretFile(value.substring(PATH_PREFIX.length()));
        }
        return value;
    }

    private String readEnv(String reference) {
        int separator = reference.indexOf(FALLBACK_SEPARATOR);
        String name = separator < 0 ? reference : reference.substring(0, separator);
        String resolved = env.apply(name);
        if (resolved != null) {
            return resolved;
        }
        if (separator >= 0) {
            return reference.substring(separator + FALLBACK_SEPARATOR.length());
        }
        throw new ConfigException("Missing required environment variable: " + name);
    }

    private String readSecretFile(String location) {
        if (location.isBlank()) {
            throw new ConfigException("Path value is empty");
        }
        Path file = resolve(location);
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new ConfigException("Failed to read config path: " + file, e);
        }
        if (content.isEmpty()) {
            throw new ConfigException("Path value is empty: " + file);
        }
        secretFiles.add(file);
        return content;
    }

    private Path resolve(String location) {
        Path path;
        try {
            path = Path.of(location);
        } catch (InvalidPathException e) {
            throw new ConfigException("Invalid path value: " + location, e);
        }
        return baseDir == null || path.isAbsolute() ? path : baseDir.resolve(path).normalize();
    }
}
