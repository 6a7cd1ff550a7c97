package com.codemap.dgml.builder;

import java.util.function.Function;
import java.util.function.Predicate;

import com.codemap.dgml.model.Category;

/** Maps a source object to at most one {@link Category}; a null result produces nothing. */
public final class CategoryBuilder<T> extends SingleElementBuilder<T, Category> {

    public CategoryBuilder(Class<T> sourceType, Function<? super T, ? extends Category> mapper) {
        this(sourceType, mapper, null, TypeMatch.ASSIGNABLE);
    }

    public CategoryBuilder(Class<T> sourceType, Function<? super T, ? extends Category> mapper,
            Predicate<? super T> acceptor) {
        this(sourceType, mapper, acceptor, TypeMatch.ASSIGNABLE);
    }

    public CategoryBuilder(Class<T> sourceType, Function<? super T, ? extends Category> mapper,
            Predicate<? super T> acceptor, TypeMatch typeMatch) {
        super(sourceType, mapper, acceptor, typeMatch);
    }
}
