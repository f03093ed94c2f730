package ai.typerender.model;

import java.util.Objects;

public record ClassProperty(Type type, boolean optional) {
    public ClassProperty {
        Objects.requireNonNull(type, "type");
    }

    public static ClassProperty required(Type type) {
        return new ClassProperty(type, false);
    }

    public static ClassProperty optional(Type type) {
        return new ClassProperty(type, true);
    }
}
