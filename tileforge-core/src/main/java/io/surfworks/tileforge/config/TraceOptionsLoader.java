package io.surfworks.tileforge.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads and saves {@link TraceOptions} as JSON.
 *
 * <p>Option sources (in order of precedence):
 * <ol>
 *   <li>System properties ({@code tileforge.*})</li>
 *   <li>Options file</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * <p>File format:
 * <pre>{@code
 * {
 *   "gridSymbolPrefix": "tile",
 *   "loopSymbolPrefix": "coord",
 *   "visualize": { "kernels": true, "loops": true, "steps": true },
 *   "generateGraph": true,
 *   "dumpDir": "build/trace",
 *   "guardThread": true
 * }
 * }</pre>
 */
public final class TraceOptionsLoader {

    private static final Logger LOG = Logger.getLogger(TraceOptionsLoader.class.getName());

    private static final ObjectMapper JSON = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private TraceOptionsLoader() {
    }

    /**
     * Loads options from a file, then applies system property overrides.
     *
     * <p>A missing file yields the defaults. An unreadable or malformed file is
     * logged and also yields the defaults.
     *
     * @param optionsFile path to the options file
     * @return the loaded options
     */
    public static TraceOptions load(Path optionsFile) {
        TraceOptions options = TraceOptions.defaults();

        if (Files.exists(optionsFile)) {
            options = loadFromFile(optionsFile, options);
        }

        return options.withSystemProperties();
    }

    /**
     * Saves options to a file, creating parent directories as needed.
     *
     * @param options     the options to save
     * @param optionsFile path to write
     * @throws IOException if writing fails
     */
    public static void save(TraceOptions options, Path optionsFile) throws IOException {
        Path parent = optionsFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        ObjectNode root = JSON.createObjectNode();
        root.put("gridSymbolPrefix", options.gridSymbolPrefix());
        root.put("loopSymbolPrefix", options.loopSymbolPrefix());

        ObjectNode visualize = root.putObject("visualize");
        visualize.put("kernels", options.visualizeKernels());
        visualize.put("loops", options.visualizeLoops());
        visualize.put("steps", options.visualizeSteps());

        root.put("generateGraph", options.generateGraph());
        root.put("dumpDir", options.dumpDir().toString());
        root.put("guardThread", options.guardThread());

        JSON.writeValue(optionsFile.toFile(), root);
    }

    /**
     * Parses options from JSON text over the given base options.
     *
     * @throws IOException if the text is not valid JSON or not a JSON object
     * @throws IllegalArgumentException if the resulting options are invalid
     */
    public static TraceOptions parse(String json, TraceOptions base) throws IOException {
        JsonNode root = JSON.readTree(json);
        if (root == null || root.isMissingNode() || root.isNull()) {
            return base;
        }
        if (!root.isObject()) {
            throw new IOException("Trace options must be a JSON object, got " + root.getNodeType());
        }

        TraceOptions.Builder b = base.toBuilder()
                .gridSymbolPrefix(getString(root, "gridSymbolPrefix", base.gridSymbolPrefix()))
                .loopSymbolPrefix(getString(root, "loopSymbolPrefix", base.loopSymbolPrefix()))
                .generateGraph(getBoolean(root, "generateGraph", base.generateGraph()))
                .guardThread(getBoolean(root, "guardThread", base.guardThread()));

        JsonNode visualize = root.path("visualize");
        if (visualize.isObject()) {
            b.visualizeKernels(getBoolean(visualize, "kernels", base.visualizeKernels()))
                    .visualizeLoops(getBoolean(visualize, "loops", base.visualizeLoops()))
                    .visualizeSteps(getBoolean(visualize, "steps", base.visualizeSteps()));
        }

        if (root.hasNonNull("dumpDir")) {
            b.dumpDir(Path.of(root.get("dumpDir").asText()));
        }

        return b.build();
    }

    private static TraceOptions loadFromFile(Path optionsFile, TraceOptions base) {
        try {
            return parse(Files.readString(optionsFile), base);
        } catch (IOException | IllegalArgumentException e) {
            LOG.log(Level.WARNING, "Ignoring unreadable trace options file " + optionsFile, e);
            return base;
        }
    }

    private static String getString(JsonNode node, String field, String defaultValue) {
        return node.hasNonNull(field) ? node.get(field).asText() : defaultValue;
    }

    private static boolean getBoolean(JsonNode node, String field, boolean defaultValue) {
        return node.hasNonNull(field) ? node.get(field).asBoolean(defaultValue) : defaultValue;
    }
}
