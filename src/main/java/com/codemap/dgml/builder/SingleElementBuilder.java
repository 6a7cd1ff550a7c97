package com.codemap.dgml.builder;

import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;

/** Rule producing at most one element per accepted input. */
abstract class SingleElementBuilder<T, R> extends ElementBuilder<T, R> {
    private final Function<? super T, ? extends R> mapper;

    SingleElementBuilder(Class<T> sourceType, Function<? super T, ? extends R> mapper,
            Predicate<? super T> acceptor, TypeMatch typeMatch) {
        super(sourceType, acceptor, typeMatch);
        if (mapper == null)
            throw new IllegalArgumentException("Rule mapping function must not be null");
        this.mapper = mapper;
    }

    @Override
    protected Stream<R> produce(T source) {
        R result = mapper.apply(source);
        return result == null ? Stream.empty() : Stream.of(result);
    }
}
