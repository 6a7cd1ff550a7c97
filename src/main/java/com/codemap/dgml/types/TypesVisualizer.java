package com.codemap.dgml.types;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.WildcardType;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import com.codemap.dgml.analysis.HubNodeAnalysis;
import com.codemap.dgml.builder.BuilderRegistry;
import com.codemap.dgml.builder.CategoryBuilder;
import com.codemap.dgml.builder.LinksBuilder;
import com.codemap.dgml.builder.NodeBuilder;
import com.codemap.dgml.builder.StyleBuilder;
import com.codemap.dgml.dsl.GraphAssembler;
import com.codemap.dgml.model.Category;
import com.codemap.dgml.model.DirectedGraph;
import com.codemap.dgml.model.Link;
import com.codemap.dgml.model.Node;
import com.codemap.dgml.model.Style;

/**
 * Class diagrams from a set of Java types.
 *
 * <p>
 * Interfaces are drawn as round nodes, classes as boxes and abstract classes
 * as dashed boxes. Inheritance links (dashed, green) go to the superclass
 * and implemented interfaces; association links (light blue) come from
 * fields, constructor parameters and generic type arguments of supertypes.
 * Only relations between types of the input set are drawn. Each package
 * becomes a category and hubs are highlighted.
 */
public final class TypesVisualizer {
    public static final String CLASS_TYPE = "Class";
    public static final String INTERFACE_TYPE = "Interface";
    public static final String ABSTRACT_CLASS_TYPE = "Abstract";
    public static final String ASSOCIATION_RELATION = "Association";
    public static final String INHERITANCE_RELATION = "Inheritance";

    private static final Class<Class<?>> TYPE = typeToken();

    private TypesVisualizer() {
    }

    /**
     * Builds the class diagram of {@code types}.
     *
     * @param types the types to draw; order decides node order.
     * @return the graph.
     */
    public static DirectedGraph typesToGraph(Collection<Class<?>> types) {
        Set<Class<?>> known = new LinkedHashSet<>(types);
        BuilderRegistry rules = BuilderRegistry.builder()
                .node(new NodeBuilder<>(TYPE, TypesVisualizer::classToNode, t -> !t.isInterface()))
                .node(new NodeBuilder<>(TYPE, TypesVisualizer::interfaceToNode, Class::isInterface))
                .links(new LinksBuilder<>(TYPE, t -> fieldLinks(t, known)))
                .links(new LinksBuilder<>(TYPE, t -> inheritanceLinks(t, known)))
                .links(new LinksBuilder<>(TYPE, t -> genericTypeLinks(t, known)))
                .links(new LinksBuilder<>(TYPE, t -> constructorInjectionLinks(t, known)))
                .category(new CategoryBuilder<>(TYPE, TypesVisualizer::packageCategory))
                .style(new StyleBuilder<>(Node.class, n -> interfaceStyle(), n -> n.hasCategory(INTERFACE_TYPE)))
                .style(new StyleBuilder<>(Node.class, n -> abstractStyle(), n -> n.hasCategory(ABSTRACT_CLASS_TYPE)))
                .style(new StyleBuilder<>(Link.class, TypesVisualizer::associationStyle,
                        l -> l.hasCategory(ASSOCIATION_RELATION)))
                .style(new StyleBuilder<>(Link.class, TypesVisualizer::inheritanceStyle,
                        l -> l.hasCategory(INHERITANCE_RELATION)))
                .build();

        return GraphAssembler.builder()
                .registry(rules)
                .analysis(new HubNodeAnalysis())
                .build()
                .assemble(List.of(new ArrayList<>(known)));
    }

    static String typeId(Class<?> type) {
        return type.getName();
    }

    private static String packageRef(Class<?> type) {
        return "p:" + type.getPackageName();
    }

    private static Node classToNode(Class<?> type) {
        Node node = new Node(typeId(type), type.getSimpleName(), CLASS_TYPE);
        node.addCategoryRef(packageRef(type));
        if (Modifier.isAbstract(type.getModifiers()))
            node.addCategoryRef(ABSTRACT_CLASS_TYPE);
        return node;
    }

    private static Node interfaceToNode(Class<?> type) {
        return new Node(typeId(type), type.getSimpleName(), INTERFACE_TYPE)
                .addCategoryRef(packageRef(type));
    }

    private static Category packageCategory(Class<?> type) {
        return new Category(packageRef(type), type.getPackageName());
    }

    private static Stream<Link> fieldLinks(Class<?> type, Set<Class<?>> known) {
        return Stream.of(type.getDeclaredFields())
                .filter(f -> !f.isSynthetic())
                .flatMap(f -> associations(type, f.getGenericType(), f.getName(), known));
    }

    private static Stream<Link> inheritanceLinks(Class<?> type, Set<Class<?>> known) {
        List<Link> links = new ArrayList<>();
        Class<?> base = type.getSuperclass();
        if (base != null && known.contains(base))
            links.add(new Link(typeId(type), typeId(base), INHERITANCE_RELATION));
        for (Class<?> i : type.getInterfaces()) {
            if (known.contains(i))
                links.add(new Link(typeId(type), typeId(i), INHERITANCE_RELATION));
        }
        return links.stream();
    }

    private static Stream<Link> genericTypeLinks(Class<?> type, Set<Class<?>> known) {
        List<Type> supertypes = new ArrayList<>();
        if (type.getGenericSuperclass() != null)
            supertypes.add(type.getGenericSuperclass());
        supertypes.addAll(List.of(type.getGenericInterfaces()));

        return supertypes.stream()
                .filter(ParameterizedType.class::isInstance)
                .map(ParameterizedType.class::cast)
                .filter(p -> known.contains((Class<?>) p.getRawType()))
                .flatMap(p -> Stream.of(p.getActualTypeArguments()))
                .flatMap(arg -> associations(type, arg, null, known));
    }

    private static Stream<Link> constructorInjectionLinks(Class<?> type, Set<Class<?>> known) {
        return Stream.of(type.getConstructors())
                .map(Constructor::getGenericParameterTypes)
                .flatMap(Stream::of)
                .flatMap(p -> associations(type, p, null, known));
    }

    private static Stream<Link> associations(Class<?> from, Type to, String name, Set<Class<?>> known) {
        List<Class<?>> targets = new ArrayList<>();
        collectClasses(to, targets);
        return targets.stream()
                .filter(known::contains)
                .map(target -> {
                    Link link = new Link(typeId(from), typeId(target), ASSOCIATION_RELATION);
                    link.setLabel(name);
                    return link;
                });
    }

    /** Collects the classes mentioned by a generic type: raw types, type arguments, array components. */
    static void collectClasses(Type type, List<Class<?>> out) {
        if (type instanceof Class<?> c) {
            if (c.isArray())
                collectClasses(c.getComponentType(), out);
            else
                out.add(c);
        } else if (type instanceof ParameterizedType p) {
            collectClasses(p.getRawType(), out);
            for (Type arg : p.getActualTypeArguments())
                collectClasses(arg, out);
        } else if (type instanceof GenericArrayType g) {
            collectClasses(g.getGenericComponentType(), out);
        } else if (type instanceof WildcardType w) {
            for (Type bound : w.getUpperBounds())
                collectClasses(bound, out);
        }
        // type variables carry no concrete class
    }

    private static Style interfaceStyle() {
        return new Style(null, INTERFACE_TYPE)
                .condition("HasCategory('" + INTERFACE_TYPE + "')")
                .setter("NodeRadius", "16");
    }

    private static Style abstractStyle() {
        return new Style(null, ABSTRACT_CLASS_TYPE)
                .condition("HasCategory('" + ABSTRACT_CLASS_TYPE + "')")
                .setter("StrokeDashArray", "2,2");
    }

    private static Style associationStyle(Link link) {
        return new Style(null, link.getCategory())
                .condition("HasCategory('" + ASSOCIATION_RELATION + "')")
                .setter("Stroke", "LightBlue");
    }

    private static Style inheritanceStyle(Link link) {
        return new Style(null, link.getCategory())
                .condition("HasCategory('" + INHERITANCE_RELATION + "')")
                .setter("StrokeDashArray", "2,2")
                .setter("Stroke", "Green");
    }

    @SuppressWarnings("unchecked")
    private static Class<Class<?>> typeToken() {
        return (Class<Class<?>>) (Class<?>) Class.class;
    }
}
