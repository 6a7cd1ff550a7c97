package com.codemap.dgml.builder;

import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;

import com.codemap.dgml.model.Link;

/** Maps a source object to zero or more {@link Link}s. */
public final class LinksBuilder<T> extends MultiElementBuilder<T, Link> {

    public LinksBuilder(Class<T> sourceType, Function<? super T, ? extends Stream<? extends Link>> mapper) {
        this(sourceType, mapper, null, TypeMatch.ASSIGNABLE);
    }

    public LinksBuilder(Class<T> sourceType, Function<? super T, ? extends Stream<? extends Link>> mapper,
            Predicate<? super T> acceptor) {
        this(sourceType, mapper, acceptor, TypeMatch.ASSIGNABLE);
    }

    public LinksBuilder(Class<T> sourceType, Function<? super T, ? extends Stream<? extends Link>> mapper,
            Predicate<? super T> acceptor, TypeMatch typeMatch) {
        super(sourceType, mapper, acceptor, typeMatch);
    }
}
