package com.codemap.dgml.dsl;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.Data;

/**
 * Tunables of a {@link GraphAssembler}. Can be read from JSON, e.g.
 *
 * <pre>{@code
 * { "danglingLinks": "DROP", "logSummary": false }
 * }</pre>
 *
 * Unknown keys are ignored.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AssemblyOptions {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private DanglingLinkPolicy danglingLinks = DanglingLinkPolicy.ALLOW;

    /** Log element counts at INFO after each assembly. */
    private boolean logSummary = true;

    public static AssemblyOptions defaults() {
        return new AssemblyOptions();
    }

    public static AssemblyOptions fromJson(String json) {
        try {
            return MAPPER.readValue(json, AssemblyOptions.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid assembly options: " + e.getOriginalMessage(), e);
        }
    }

    public static AssemblyOptions fromJson(Path path) {
        try {
            return fromJson(Files.readString(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read assembly options from " + path, e);
        }
    }
}
