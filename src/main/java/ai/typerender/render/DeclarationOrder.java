package ai.typerender.render;

import ai.typerender.model.NamedType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Order in which named types are declared. The canonical order lists a type
 * before the types it refers to.
 */
public enum DeclarationOrder {
    CANONICAL {
        @Override
        public List<NamedType> arrange(List<NamedType> canonical,
                                       Function<NamedType, List<NamedType>> dependencies) {
            return List.copyOf(canonical);
        }
    },
    REVERSED {
        @Override
        public List<NamedType> arrange(List<NamedType> canonical,
                                       Function<NamedType, List<NamedType>> dependencies) {
            List<NamedType> reversed = new ArrayList<>(canonical);
            Collections.reverse(reversed);
            return reversed;
        }
    },
    TOPOLOGICAL {
        @Override
        public List<NamedType> arrange(List<NamedType> canonical,
                                       Function<NamedType, List<NamedType>> dependencies) {
            Set<NamedType> members = identitySet();
            members.addAll(canonical);
            Set<NamedType> visited = identitySet();
            List<NamedType> result = new ArrayList<>();
            for (NamedType type : canonical) {
                visit(type, members, visited, dependencies, result);
            }
            return result;
        }

        // Post-order: a cycle is cut where it first comes back to a visited type.
        private void visit(NamedType type, Set<NamedType> members, Set<NamedType> visited,
                           Function<NamedType, List<NamedType>> dependencies, List<NamedType> result) {
            if (!visited.add(type)) {
                return;
            }
            for (NamedType dependency : dependencies.apply(type)) {
                if (members.contains(dependency)) {
                    visit(dependency, members, visited, dependencies, result);
                }
            }
            result.add(type);
        }
    };

    public abstract List<NamedType> arrange(List<NamedType> canonical,
                                            Function<NamedType, List<NamedType>> dependencies);

    private static Set<NamedType> identitySet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }
}
