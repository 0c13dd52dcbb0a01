package dumb.metamath;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import dumb.metamath.FormulaTemplate.CollisionPolicy;
import dumb.metamath.util.Json;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

import static java.util.Objects.requireNonNull;

/**
 * Checker settings. {@code maxSteps} of 0 means unlimited; {@code verifyOnLoad} replays every theorem
 * while a system is constructed; {@code collisions} resolves same-kind parameter names in template composition.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Config(int maxSteps, boolean verifyOnLoad, CollisionPolicy collisions, boolean logSteps) {
    public static final String RESOURCE = "metamath.json";
    public static final int DEFAULT_MAX_STEPS = 0;
    public static final boolean DEFAULT_VERIFY_ON_LOAD = false;
    public static final CollisionPolicy DEFAULT_COLLISIONS = CollisionPolicy.UNIFY;
    public static final boolean DEFAULT_LOG_STEPS = false;

    private static final Logger logger = LoggerFactory.getLogger(Config.class);

    public Config {
        if (maxSteps < 0) throw new IllegalArgumentException("maxSteps must be >= 0: " + maxSteps);
        requireNonNull(collisions);
    }

    public Config() {
        this(DEFAULT_MAX_STEPS, DEFAULT_VERIFY_ON_LOAD, DEFAULT_COLLISIONS, DEFAULT_LOG_STEPS);
    }

    @JsonCreator
    public static Config json(@JsonProperty("maxSteps") @Nullable Integer maxSteps,
                       @JsonProperty("verifyOnLoad") @Nullable Boolean verifyOnLoad,
                       @JsonProperty("collisions") @Nullable CollisionPolicy collisions,
                       @JsonProperty("logSteps") @Nullable Boolean logSteps) {
        return new Config(
                maxSteps != null ? maxSteps : DEFAULT_MAX_STEPS,
                verifyOnLoad != null ? verifyOnLoad : DEFAULT_VERIFY_ON_LOAD,
                collisions != null ? collisions : DEFAULT_COLLISIONS,
                logSteps != null ? logSteps : DEFAULT_LOG_STEPS);
    }

    /** {@value #RESOURCE} from the classpath, or defaults when absent. */
    public static Config load() {
        try (var in = Config.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                logger.debug("No {} on classpath, using defaults", RESOURCE);
                return new Config();
            }
            var c = Json.obj(in, Config.class);
            logger.info("Loaded {}: {}", RESOURCE, c);
            return c;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
    }

    public static Config load(Path file) throws IOException {
        return Json.obj(file, Config.class);
    }

    public static Config parse(String json) throws JsonProcessingException {
        return Json.obj(json, Config.class);
    }

    public Config withMaxSteps(int maxSteps) {
        return new Config(maxSteps, verifyOnLoad, collisions, logSteps);
    }

    public Config withVerifyOnLoad(boolean verifyOnLoad) {
        return new Config(maxSteps, verifyOnLoad, collisions, logSteps);
    }

    public Config withCollisions(CollisionPolicy collisions) {
        return new Config(maxSteps, verifyOnLoad, collisions, logSteps);
    }

    public Config withLogSteps(boolean logSteps) {
        return new Config(maxSteps, verifyOnLoad, collisions, logSteps);
    }
}
