package ai.typerender.model;

import java.util.Objects;

public record ArrayType(Type items) implements Type {
    public ArrayType {
        Objects.requireNonNull(items, "items");
    }

    @Override
    public <R> R accept(TypeVisitor<R> visitor) {
        return visitor.visitArray(this);
    }

    @Override
    public String kindName() {
        return "array";
    }
}
