package ai.typerender.render;

import ai.typerender.model.ArrayType;
import ai.typerender.model.ClassType;
import ai.typerender.model.EnumType;
import ai.typerender.model.MapType;
import ai.typerender.model.Type;
import ai.typerender.model.TypeGraph;
import ai.typerender.model.TypeVisitor;
import ai.typerender.model.UnionType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Python syntax for a type. Named types are always referred to by name,
 * except unions that are rendered inline.
 */
public final class TypeRenderer implements TypeVisitor<String> {

    private final NameTable names;
    private final RenderOptions options;
    private final PythonImports imports;

    TypeRenderer(NameTable names, RenderOptions options, PythonImports imports) {
        this.names = names;
        this.options = options;
        this.imports = imports;
    }

    public String sourceFor(Type type) {
        return type.accept(this);
    }

    @Override
    public String visitNone() {
        throw new IllegalStateException("None type should have been replaced before rendering");
    }

    @Override
    public String visitAny() {
        return typing("Any");
    }

    @Override
    public String visitNull() {
        return "None";
    }

    @Override
    public String visitBool() {
        return "bool";
    }

    @Override
    public String visitInteger() {
        return "int";
    }

    @Override
    public String visitDouble() {
        return "float";
    }

    @Override
    public String visitString() {
        return "str";
    }

    @Override
    public String visitDate() {
        imports.add("datetime", "date");
        return "date";
    }

    @Override
    public String visitTime() {
        imports.add("datetime", "time");
        return "time";
    }

    @Override
    public String visitDateTime() {
        imports.add("datetime", "datetime");
        return "datetime";
    }

    @Override
    public String visitArray(ArrayType arrayType) {
        return typing("List") + "[" + sourceFor(arrayType.items()) + "]";
    }

    @Override
    public String visitMap(MapType mapType) {
        return typing("Dict") + "[str, " + sourceFor(mapType.values()) + "]";
    }

    @Override
    public String visitClass(ClassType classType) {
        return names.nameFor(classType);
    }

    @Override
    public String visitEnum(EnumType enumType) {
        return names.nameFor(enumType);
    }

    @Override
    public String visitUnion(UnionType unionType) {
        Optional<Type> nullable = TypeGraph.nullableOf(unionType);
        if (nullable.isPresent()) {
            return optional(sourceFor(nullable.get()));
        }
        if (options.declareUnions()) {
            return names.nameFor(unionType);
        }
        List<String> members = new ArrayList<>();
        for (Type member : unionType.members()) {
            members.add(sourceFor(member));
        }
        return String.join(" | ", members);
    }

    String optional(String source) {
        return typing("Optional") + "[" + source + "]";
    }

    String union() {
        return typing("Union");
    }

    String enumBase() {
        imports.add("enum", "Enum");
        return "Enum";
    }

    private String typing(String name) {
        imports.add("typing", name);
        return name;
    }
}
