package ai.typerender.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Top-level bindings plus everything they reach. The graph is never modified
 * once built; renderers only read it.
 */
public final class TypeGraph {

    private final Map<String, Type> topLevels;

    public TypeGraph(Map<String, ? extends Type> topLevels) {
        Map<String, Type> copy = new LinkedHashMap<>();
        topLevels.forEach((label, type) -> copy.put(label, Objects.requireNonNull(type, label)));
        this.topLevels = Collections.unmodifiableMap(copy);
    }

    public static TypeGraph of(String label, Type type) {
        return new TypeGraph(Map.of(label, type));
    }

    public Map<String, Type> topLevels() {
        return topLevels;
    }

    /**
     * Every reachable named type, each once, in depth-first pre-order: a type
     * is listed before the types it refers to.
     */
    public List<NamedType> namedTypes() {
        List<NamedType> result = new ArrayList<>();
        Set<NamedType> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Type type : topLevels.values()) {
            collect(type, seen, result);
        }
        return result;
    }

    /**
     * Named types that {@code type} refers to directly, looking through
     * arrays, maps and any named type {@code declared} rejects.
     */
    public static List<NamedType> namedDependencies(Type type, Predicate<NamedType> declared) {
        List<NamedType> result = new ArrayList<>();
        Set<NamedType> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Type child : childrenOf(type)) {
            collectDependencies(child, declared, seen, result);
        }
        return result;
    }

    public static List<Type> childrenOf(Type type) {
        if (type instanceof ArrayType array) {
            return List.of(array.items());
        }
        if (type instanceof MapType map) {
            return List.of(map.values());
        }
        if (type instanceof UnionType union) {
            return union.members();
        }
        if (type instanceof ClassType classType) {
            List<Type> children = new ArrayList<>();
            for (ClassProperty property : classType.properties().values()) {
                children.add(property.type());
            }
            return children;
        }
        return List.of();
    }

    /**
     * The {@code T} of a union whose members are exactly {@code T} and null.
     */
    public static Optional<Type> nullableOf(UnionType union) {
        if (union.members().size() != 2 || !union.hasMember(PrimitiveType.NULL)) {
            return Optional.empty();
        }
        for (Type member : union.members()) {
            if (member != PrimitiveType.NULL) {
                return Optional.of(member);
            }
        }
        return Optional.empty();
    }

    public static boolean isNullable(Type type) {
        return type == PrimitiveType.NULL
            || type == PrimitiveType.ANY
            || (type instanceof UnionType union && union.hasMember(PrimitiveType.NULL));
    }

    private static void collect(Type type, Set<NamedType> seen, List<NamedType> result) {
        if (type instanceof NamedType named) {
            if (!seen.add(named)) {
                return;
            }
            result.add(named);
        }
        for (Type child : childrenOf(type)) {
            collect(child, seen, result);
        }
    }

    private static void collectDependencies(Type type, Predicate<NamedType> declared,
                                            Set<NamedType> seen, List<NamedType> result) {
        if (type instanceof NamedType named) {
            if (!seen.add(named)) {
                return;
            }
            if (declared.test(named)) {
                result.add(named);
                return;
            }
        }
        for (Type child : childrenOf(type)) {
            collectDependencies(child, declared, seen, result);
        }
    }
}
