package ai.typerender.model;

import java.util.List;
import java.util.Objects;

public final class EnumType implements NamedType {

    private final String name;
    private final List<String> cases;

    public EnumType(String name, List<String> cases) {
        this.name = Objects.requireNonNull(name, "name");
        this.cases = List.copyOf(cases);
    }

    @Override
    public String name() {
        return name;
    }

    public List<String> cases() {
        return cases;
    }

    @Override
    public <R> R accept(TypeVisitor<R> visitor) {
        return visitor.visitEnum(this);
    }

    @Override
    public String kindName() {
        return "enum";
    }

    @Override
    public String toString() {
        return "enum " + name;
    }
}
