package com.parametric.nodegraph.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.Data;
import lombok.extern.log4j.Log4j2;

/**
 * Tunables of the editor core.
 *
 * <p>
 * Values are read from the classpath resource {@value #RESOURCE} when present;
 * keys that are missing keep their defaults and unknown keys are ignored.
 */
@Data
@Log4j2
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EditorConfig {
    public static final String RESOURCE = "nodegraph-editor.json";

    /** Undo steps kept before the oldest is evicted. */
    private int maxHistorySize = 500;

    /** Space between a group's border and its members. */
    private double groupPadding = 25;
    private double groupPaddingBottom = 25;
    private double groupHeaderHeight = 45;

    /** Size assumed for a node whose type has no better estimate. */
    private double defaultNodeWidth = 280;
    private double defaultNodeHeight = 180;

    /** Horizontal space port sockets occupy outside a node's body. */
    private double portStickout = 24;

    /** Offset applied to duplicated nodes. */
    private double duplicateOffset = 50;

    public static EditorConfig defaults() {
        return new EditorConfig();
    }

    /** Loads {@value #RESOURCE} from the classpath, or returns defaults if absent. */
    public static EditorConfig load() throws IOException {
        try (InputStream in = EditorConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                log.debug("{} not on classpath, using defaults", RESOURCE);
                return defaults();
            }
            return validate(new ObjectMapper().readValue(in, EditorConfig.class));
        }
    }

    public static EditorConfig fromFile(Path path) throws IOException {
        return validate(new ObjectMapper().readValue(Files.readAllBytes(path), EditorConfig.class));
    }

    private static EditorConfig validate(EditorConfig config) {
        if (config.maxHistorySize < 1)
            throw new IllegalArgumentException("maxHistorySize must be positive: " + config.maxHistorySize);
        if (config.groupPadding < 0 || config.groupPaddingBottom < 0 || config.groupHeaderHeight < 0)
            throw new IllegalArgumentException("Group padding must not be negative");
        return config;
    }
}
