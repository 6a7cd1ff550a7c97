package com.codemap.dgml.builder;

/**
 * How a rule's declared source type is compared with the runtime class of a
 * candidate input.
 */
public enum TypeMatch {
    /** Runtime class must be exactly the declared type. */
    EXACT {
        @Override
        public boolean matches(Class<?> declared, Class<?> actual) {
            return declared == actual;
        }
    },
    /** Runtime class may be the declared type or any subtype / implementor. */
    ASSIGNABLE {
        @Override
        public boolean matches(Class<?> declared, Class<?> actual) {
            return declared.isAssignableFrom(actual);
        }
    };

    public abstract boolean matches(Class<?> declared, Class<?> actual);
}
