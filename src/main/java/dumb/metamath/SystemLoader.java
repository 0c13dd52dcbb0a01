package dumb.metamath;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonMappingException;
import dumb.metamath.util.Json;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static dumb.metamath.MetamathException.Kind.MALFORMED;

/**
 * Reads and writes formal systems as JSON:
 * {@code {"constants": [...], "axioms": {label: assertion}, "theorems": {label: assertion}}}.
 */
public final class SystemLoader {

    private SystemLoader() {
    }

    public static FormalSystem load(String json) throws IOException {
        try {
            return build(Json.obj(json, SystemData.class), Config.load());
        } catch (JsonMappingException e) {
            throw malformed(e);
        }
    }

    public static FormalSystem load(Path file) throws IOException {
        try {
            return build(Json.obj(file, SystemData.class), Config.load());
        } catch (JsonMappingException e) {
            throw malformed(e);
        }
    }

    public static FormalSystem load(InputStream in, Config config) throws IOException {
        try {
            return build(Json.obj(in, SystemData.class), config);
        } catch (JsonMappingException e) {
            throw malformed(e);
        }
    }

    /** Well-formed JSON of the wrong shape: unknown or missing keys, wrong value types. */
    private static MetamathException malformed(JsonMappingException e) {
        for (var c = e.getCause(); c != null; c = c.getCause())
            if (c instanceof MetamathException m) return m;
        return new MetamathException(MALFORMED, "malformed system document: " + e.getOriginalMessage(), -1, e);
    }

    public static FormalSystem build(SystemData data, Config config) {
        return new FormalSystem(new Registry(), config, data.constants(), data.axioms(), data.theorems());
    }

    public static String dump(FormalSystem system) {
        return Json.str(new SystemData(system.constants(), system.specs(false), system.specs(true)));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SystemData(List<String> constants, Map<String, AssertionSpec> axioms, Map<String, AssertionSpec> theorems) {
        public SystemData {
            constants = constants == null ? List.of() : List.copyOf(constants);
            axioms = ordered(axioms);
            theorems = ordered(theorems);
        }

        private static Map<String, AssertionSpec> ordered(@Nullable Map<String, AssertionSpec> m) {
            return m == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(m));
        }
    }
}
