package ai.typerender.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.stream.Collectors;

public final class UnionType implements NamedType {

    private final String name;
    private final List<Type> members;

    public UnionType(String name, Collection<? extends Type> members) {
        // named members compare by identity, everything else structurally
        List<Type> distinct = new ArrayList<>(new LinkedHashSet<>(members));
        if (distinct.size() < 2) {
            throw new IllegalArgumentException("Union needs at least two distinct members, got " + distinct);
        }
        this.members = List.copyOf(distinct);
        this.name = name != null && !name.isBlank() ? name : derivedName(this.members);
    }

    public UnionType(Collection<? extends Type> members) {
        this(null, members);
    }

    @Override
    public String name() {
        return name;
    }

    public List<Type> members() {
        return members;
    }

    public boolean hasMember(Type type) {
        return members.contains(type);
    }

    @Override
    public <R> R accept(TypeVisitor<R> visitor) {
        return visitor.visitUnion(this);
    }

    @Override
    public String kindName() {
        return "union";
    }

    @Override
    public String toString() {
        return "union " + name;
    }

    private static String derivedName(List<Type> members) {
        return members.stream()
            .map(m -> m instanceof NamedType named ? named.name() : m.kindName())
            .collect(Collectors.joining("_or_"));
    }
}
