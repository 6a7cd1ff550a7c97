package com.codemap.dgml.engine;

/**
 * Terminal failure of a graph assembly. No partial graph is ever returned
 * alongside it; {@link #getCause()} carries the original error where there
 * is one.
 */
public class GraphAssemblyException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public GraphAssemblyException(String message) {
        super(message);
    }

    public GraphAssemblyException(String message, Throwable cause) {
        super(message, cause);
    }
}
