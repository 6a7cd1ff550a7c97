package com.codemap.dgml.builder;

import java.util.Objects;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * A typed, predicate-guarded transformation rule from source objects of type
 * {@code T} to graph elements of type {@code R}.
 *
 * <p>
 * Matching is a two step check: the runtime class of the input must satisfy
 * the rule's {@link TypeMatch} against {@link #sourceType()}, then the
 * acceptance predicate must hold. Only then is the mapping function invoked.
 *
 * <p>
 * The set of concrete rules is closed: single-result rules
 * ({@link NodeBuilder}, {@link LinkBuilder}, {@link CategoryBuilder},
 * {@link StyleBuilder}) and multi-result rules ({@link NodesBuilder},
 * {@link LinksBuilder}, {@link CategoriesBuilder}).
 *
 * @param <T> accepted source type
 * @param <R> produced element type
 */
public abstract class ElementBuilder<T, R> {
    private final Class<T> sourceType;
    private final Predicate<? super T> acceptor;
    private final TypeMatch typeMatch;

    ElementBuilder(Class<T> sourceType, Predicate<? super T> acceptor, TypeMatch typeMatch) {
        if (sourceType == null)
            throw new IllegalArgumentException("Rule source type must not be null");
        this.sourceType = sourceType;
        this.acceptor = acceptor != null ? acceptor : x -> true;
        this.typeMatch = typeMatch != null ? typeMatch : TypeMatch.ASSIGNABLE;
    }

    public Class<T> sourceType() {
        return sourceType;
    }

    public TypeMatch typeMatch() {
        return typeMatch;
    }

    /**
     * @return true if {@code element} has a compatible runtime type and the
     *         acceptance predicate holds. Never true for null.
     */
    public final boolean accepts(Object element) {
        if (element == null || !typeMatch.matches(sourceType, element.getClass()))
            return false;
        return acceptor.test(sourceType.cast(element));
    }

    /**
     * Maps an accepted element. Null results, and null entries of a produced
     * sequence, are dropped.
     *
     * @param element an element for which {@link #accepts(Object)} is true.
     * @return the produced elements, lazily.
     */
    public final Stream<R> build(Object element) {
        Stream<R> produced = produce(sourceType.cast(element));
        return produced == null ? Stream.empty() : produced.filter(Objects::nonNull);
    }

    protected abstract Stream<R> produce(T source);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "<" + sourceType.getSimpleName()
                + (typeMatch == TypeMatch.EXACT ? ", exact" : "") + ">";
    }
}
