package com.codemap.dgml.builder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.codemap.dgml.model.Category;
import com.codemap.dgml.model.Link;
import com.codemap.dgml.model.Node;

/**
 * Immutable, ordered set of builder rules for the four element kinds.
 *
 * <p>
 * Registration order is kept exactly as given and is the order in which
 * rules are tried. Because the first element produced for an id wins, rule
 * order is part of the observable result.
 *
 * <pre>{@code
 * BuilderRegistry rules = BuilderRegistry.builder()
 *         .node(new NodeBuilder<>(Service.class, s -> new Node(s.name(), s.name())))
 *         .links(new LinksBuilder<>(Service.class, s -> s.calls().stream().map(...)))
 *         .style(new StyleBuilder<>(Node.class, n -> ..., n -> n.hasCategory("External")))
 *         .build();
 * }</pre>
 */
public final class BuilderRegistry {
    private static final BuilderRegistry EMPTY = builder().build();

    private final List<ElementBuilder<?, Node>> nodeBuilders;
    private final List<ElementBuilder<?, Link>> linkBuilders;
    private final List<ElementBuilder<?, Category>> categoryBuilders;
    private final List<StyleBuilder<?>> styleBuilders;

    private BuilderRegistry(Builder b) {
        this.nodeBuilders = Collections.unmodifiableList(new ArrayList<>(b.nodeBuilders));
        this.linkBuilders = Collections.unmodifiableList(new ArrayList<>(b.linkBuilders));
        this.categoryBuilders = Collections.unmodifiableList(new ArrayList<>(b.categoryBuilders));
        this.styleBuilders = Collections.unmodifiableList(new ArrayList<>(b.styleBuilders));
    }

    public static Builder builder() {
        return new Builder();
    }

    /** A registry without rules; assembling with it always yields an empty graph. */
    public static BuilderRegistry empty() {
        return EMPTY;
    }

    public List<ElementBuilder<?, Node>> nodeBuilders() {
        return nodeBuilders;
    }

    public List<ElementBuilder<?, Link>> linkBuilders() {
        return linkBuilders;
    }

    public List<ElementBuilder<?, Category>> categoryBuilders() {
        return categoryBuilders;
    }

    public List<StyleBuilder<?>> styleBuilders() {
        return styleBuilders;
    }

    public int size() {
        return nodeBuilders.size() + linkBuilders.size() + categoryBuilders.size() + styleBuilders.size();
    }

    @Override
    public String toString() {
        return "BuilderRegistry[nodes=" + nodeBuilders.size() + ", links=" + linkBuilders.size()
                + ", categories=" + categoryBuilders.size() + ", styles=" + styleBuilders.size() + "]";
    }

    /** Accumulates rules in registration order. */
    public static final class Builder {
        private final List<ElementBuilder<?, Node>> nodeBuilders = new ArrayList<>();
        private final List<ElementBuilder<?, Link>> linkBuilders = new ArrayList<>();
        private final List<ElementBuilder<?, Category>> categoryBuilders = new ArrayList<>();
        private final List<StyleBuilder<?>> styleBuilders = new ArrayList<>();

        private Builder() {
        }

        public Builder node(NodeBuilder<?> rule) {
            nodeBuilders.add(checkNotNull(rule));
            return this;
        }

        public Builder nodes(NodesBuilder<?> rule) {
            nodeBuilders.add(checkNotNull(rule));
            return this;
        }

        public Builder link(LinkBuilder<?> rule) {
            linkBuilders.add(checkNotNull(rule));
            return this;
        }

        public Builder links(LinksBuilder<?> rule) {
            linkBuilders.add(checkNotNull(rule));
            return this;
        }

        public Builder category(CategoryBuilder<?> rule) {
            categoryBuilders.add(checkNotNull(rule));
            return this;
        }

        public Builder categories(CategoriesBuilder<?> rule) {
            categoryBuilders.add(checkNotNull(rule));
            return this;
        }

        public Builder style(StyleBuilder<?> rule) {
            styleBuilders.add(checkNotNull(rule));
            return this;
        }

        public BuilderRegistry build() {
            return new BuilderRegistry(this);
        }

        private static <B> B checkNotNull(B rule) {
            if (rule == null)
                throw new IllegalArgumentException("Builder rule must not be null");
            return rule;
        }
    }
}
