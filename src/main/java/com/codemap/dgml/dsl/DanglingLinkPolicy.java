package com.codemap.dgml.dsl;

/**
 * What to do with links whose source or target names no node once all domain
 * objects are dispatched.
 */
public enum DanglingLinkPolicy {
    /** Keep them; endpoint integrity is the caller's concern. */
    ALLOW,
    /** Drop them silently before styles and analyses run. */
    DROP,
    /** Abort assembly with a {@link com.codemap.dgml.engine.GraphAssemblyException}. */
    REJECT
}
