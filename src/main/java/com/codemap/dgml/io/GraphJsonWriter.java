package com.codemap.dgml.io;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

import com.codemap.dgml.model.DirectedGraph;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * JSON snapshot of a {@link DirectedGraph}, for web front ends and tests.
 * Custom properties are flattened into their node or link object.
 */
public final class GraphJsonWriter {
    private final ObjectMapper mapper;

    public GraphJsonWriter() {
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(DirectedGraph graph) {
        try {
            return mapper.writeValueAsString(graph);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize graph", e);
        }
    }

    public void write(DirectedGraph graph, Path path) {
        try {
            mapper.writeValue(path.toFile(), graph);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write graph snapshot to " + path, e);
        }
    }
}
