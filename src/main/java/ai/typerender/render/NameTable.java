package ai.typerender.render;

import ai.typerender.model.ClassType;
import ai.typerender.model.EnumType;
import ai.typerender.model.NamedType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Names assigned during one render. Lookups for something that was never
 * named fail loudly.
 */
public final class NameTable {

    private final Map<NamedType, String> typeNames = new IdentityHashMap<>();
    private final List<NamedType> namingOrder = new ArrayList<>();
    private final Map<String, String> topLevelAliases = new LinkedHashMap<>();
    private final Map<ClassType, Map<String, String>> propertyNames = new IdentityHashMap<>();
    private final Map<EnumType, List<String>> caseNames = new IdentityHashMap<>();

    public String nameFor(NamedType type) {
        String name = typeNames.get(type);
        if (name == null) {
            throw new IllegalStateException("No name assigned to " + type);
        }
        return name;
    }

    public boolean hasName(NamedType type) {
        return typeNames.containsKey(type);
    }

    /**
     * Property label to assigned name, in property order.
     */
    public Map<String, String> propertyNames(ClassType type) {
        Map<String, String> names = propertyNames.get(type);
        if (names == null) {
            throw new IllegalStateException("No property names assigned for " + type);
        }
        return Collections.unmodifiableMap(names);
    }

    public List<String> caseNames(EnumType type) {
        List<String> names = caseNames.get(type);
        if (names == null) {
            throw new IllegalStateException("No case names assigned for " + type);
        }
        return Collections.unmodifiableList(names);
    }

    /**
     * Top-level label to alias name, for top levels that did not name a
     * declared type.
     */
    public Map<String, String> topLevelAliases() {
        return Collections.unmodifiableMap(topLevelAliases);
    }

    public Map<String, Object> report() {
        Map<String, Object> types = new LinkedHashMap<>();
        for (NamedType type : namingOrder) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("label", type.name());
            entry.put("kind", type.kindName());
            if (type instanceof ClassType classType) {
                entry.put("properties", propertyNames.get(classType));
            } else if (type instanceof EnumType enumType) {
                entry.put("cases", caseNames.get(enumType));
            }
            types.put(typeNames.get(type), entry);
        }
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("types", types);
        report.put("topLevelAliases", topLevelAliases);
        return report;
    }

    void putTypeName(NamedType type, String name) {
        if (typeNames.put(type, name) == null) {
            namingOrder.add(type);
        }
    }

    void putTopLevelAlias(String label, String name) {
        topLevelAliases.put(label, name);
    }

    void putPropertyNames(ClassType type, Map<String, String> names) {
        propertyNames.put(type, new LinkedHashMap<>(names));
    }

    void putCaseNames(EnumType type, List<String> names) {
        caseNames.put(type, new ArrayList<>(names));
    }
}
