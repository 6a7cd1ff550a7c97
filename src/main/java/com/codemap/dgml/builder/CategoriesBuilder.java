package com.codemap.dgml.builder;

import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;

import com.codemap.dgml.model.Category;

/** Maps a source object to zero or more {@link Category}s. */
public final class CategoriesBuilder<T> extends MultiElementBuilder<T, Category> {

    public CategoriesBuilder(Class<T> sourceType, Function<? super T, ? extends Stream<? extends Category>> mapper) {
        this(sourceType, mapper, null, TypeMatch.ASSIGNABLE);
    }

    public CategoriesBuilder(Class<T> sourceType, Function<? super T, ? extends Stream<? extends Category>> mapper,
            Predicate<? super T> acceptor) {
        this(sourceType, mapper, acceptor, TypeMatch.ASSIGNABLE);
    }

    public CategoriesBuilder(Class<T> sourceType, Function<? super T, ? extends Stream<? extends Category>> mapper,
            Predicate<? super T> acceptor, TypeMatch typeMatch) {
        super(sourceType, mapper, acceptor, typeMatch);
    }
}
