package com.codemap.dgml.builder;

import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;

/** Rule producing a finite, lazily evaluated sequence of elements per accepted input. */
abstract class MultiElementBuilder<T, R> extends ElementBuilder<T, R> {
    private final Function<? super T, ? extends Stream<? extends R>> mapper;

    MultiElementBuilder(Class<T> sourceType, Function<? super T, ? extends Stream<? extends R>> mapper,
            Predicate<? super T> acceptor, TypeMatch typeMatch) {
        super(sourceType, acceptor, typeMatch);
        if (mapper == null)
            throw new IllegalArgumentException("Rule mapping function must not be null");
        this.mapper = mapper;
    }

    @Override
    protected Stream<R> produce(T source) {
        Stream<? extends R> produced = mapper.apply(source);
        return produced == null ? null : produced.<R>map(r -> r);
    }
}
