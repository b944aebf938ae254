package ai.aiengineer.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Engine settings. Layered, later wins: the bundled {@code aiengineer.properties}, then
 * {@code .aiengineer/engine.properties} under the repository root, then {@code aiengineer.*} system properties.
 */
public record EngineConfig(String filePattern, String pythonExecutable, Duration executionTimeout) {
    private static final Logger logger = LogManager.getLogger(EngineConfig.class);

    public static final String DEFAULTS_RESOURCE = "aiengineer.properties";
    public static final Path PROJECT_PROPERTIES = Path.of(".aiengineer", "engine.properties");
    public static final String SYSTEM_PREFIX = "aiengineer.";

    public static final String FILE_PATTERN_KEY = "file.pattern";
    public static final String PYTHON_EXECUTABLE_KEY = "python.executable";
    public static final String EXECUTION_TIMEOUT_KEY = "execution.timeout.seconds";

    public static final EngineConfig DEFAULT = new EngineConfig("*.py", "python3", Duration.ofSeconds(120));

    public EngineConfig {
        if (filePattern == null || filePattern.isBlank()) {
            throw new IllegalArgumentException(FILE_PATTERN_KEY + " must not be blank");
        }
        if (pythonExecutable == null || pythonExecutable.isBlank()) {
            throw new IllegalArgumentException(PYTHON_EXECUTABLE_KEY + " must not be blank");
        }
        if (executionTimeout == null || executionTimeout.isNegative() || executionTimeout.isZero()) {
            throw new IllegalArgumentException(EXECUTION_TIMEOUT_KEY + " must be positive, got " + executionTimeout);
        }
    }

    /** Bundled defaults plus system properties, without any repository overrides. */
    public static EngineConfig load() {
        var props = loadDefaults();
        applySystemOverrides(props);
        return fromProperties(props);
    }

    /** Bundled defaults, then the repository's own properties file if it has one, then system properties. */
    public static EngineConfig load(Path repoRoot) {
        var props = loadDefaults();
        var projectFile = repoRoot.resolve(PROJECT_PROPERTIES);
        if (Files.exists(projectFile)) {
            try (var reader = Files.newBufferedReader(projectFile, StandardCharsets.UTF_8)) {
                props.load(reader);
                logger.debug("Loaded engine properties from {}", projectFile);
            } catch (IOException e) {
                throw new UncheckedIOException("Unable to read " + projectFile, e);
            }
        }
        applySystemOverrides(props);
        return fromProperties(props);
    }

    static EngineConfig fromProperties(Properties props) {
        var timeoutText = props.getProperty(EXECUTION_TIMEOUT_KEY, String.valueOf(DEFAULT.executionTimeout().toSeconds()))
                .strip();
        long timeoutSeconds;
        try {
            timeoutSeconds = Long.parseLong(timeoutText);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "%s must be a whole number of seconds, got '%s'".formatted(EXECUTION_TIMEOUT_KEY, timeoutText), e);
        }
        return new EngineConfig(
                props.getProperty(FILE_PATTERN_KEY, DEFAULT.filePattern()).strip(),
                props.getProperty(PYTHON_EXECUTABLE_KEY, DEFAULT.pythonExecutable()).strip(),
                Duration.ofSeconds(timeoutSeconds));
    }

    private static Properties loadDefaults() {
        var props = new Properties();
        try (InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                logger.debug("{} not on classpath, using built-in defaults", DEFAULTS_RESOURCE);
                return props;
            }
            props.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + DEFAULTS_RESOURCE, e);
        }
        return props;
    }

    private static void applySystemOverrides(Properties props) {
        for (var key : System.getProperties().stringPropertyNames()) {
            if (key.startsWith(SYSTEM_PREFIX)) {
                props.setProperty(key.substring(SYSTEM_PREFIX.length()), System.getProperty(key));
            }
        }
    }
}
