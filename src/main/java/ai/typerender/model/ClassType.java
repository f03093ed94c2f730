package ai.typerender.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public final class ClassType implements NamedType {

    private final String name;
    private final Map<String, ClassProperty> properties = new LinkedHashMap<>();

    public ClassType(String name, Map<String, ClassProperty> properties) {
        this.name = Objects.requireNonNull(name, "name");
        this.properties.putAll(properties);
    }

    public ClassType(String name) {
        this(name, Map.of());
    }

    @Override
    public String name() {
        return name;
    }

    /**
     * Properties in the order they were supplied.
     */
    public Map<String, ClassProperty> properties() {
        return Collections.unmodifiableMap(properties);
    }

    // Lets the graph reader wire up classes that refer to each other.
    void putProperty(String propertyName, ClassProperty property) {
        properties.put(propertyName, property);
    }

    @Override
    public <R> R accept(TypeVisitor<R> visitor) {
        return visitor.visitClass(this);
    }

    @Override
    public String kindName() {
        return "class";
    }

    @Override
    public String toString() {
        return "class " + name;
    }
}
