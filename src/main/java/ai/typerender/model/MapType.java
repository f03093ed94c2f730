package ai.typerender.model;

import java.util.Objects;

public record MapType(Type values) implements Type {
    public MapType {
        Objects.requireNonNull(values, "values");
    }

    @Override
    public <R> R accept(TypeVisitor<R> visitor) {
        return visitor.visitMap(this);
    }

    @Override
    public String kindName() {
        return "map";
    }
}
