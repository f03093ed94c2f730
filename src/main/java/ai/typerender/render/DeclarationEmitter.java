package ai.typerender.render;

import ai.typerender.model.ClassProperty;
import ai.typerender.model.ClassType;
import ai.typerender.model.EnumType;
import ai.typerender.model.NamedType;
import ai.typerender.model.Type;
import ai.typerender.model.TypeGraph;
import ai.typerender.model.UnionType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Writes one declaration per declared named type: classes and enums first,
 * then unions, then aliases for the remaining top levels.
 */
final class DeclarationEmitter {

    private static final int MAX_LINE_LENGTH = 88;

    private final TypeGraph graph;
    private final NameTable names;
    private final TypeRenderer renderer;
    private final RenderOptions options;
    private final SourceWriter out;

    DeclarationEmitter(TypeGraph graph, NameTable names, TypeRenderer renderer,
                       RenderOptions options, SourceWriter out) {
        this.graph = graph;
        this.names = names;
        this.renderer = renderer;
        this.options = options;
        this.out = out;
    }

    int emit() {
        List<NamedType> declared = new ArrayList<>();
        for (NamedType named : graph.namedTypes()) {
            if (options.declares(named)) {
                declared.add(named);
            }
        }
        Function<NamedType, List<NamedType>> dependencies = t -> TypeGraph.namedDependencies(t, options::declares);
        List<NamedType> ordered = options.declarationOrder().arrange(declared, dependencies);

        int count = 0;
        List<NamedType> unions = new ArrayList<>();
        for (NamedType named : ordered) {
            if (named instanceof ClassType classType) {
                emitClass(classType);
                count++;
            } else if (named instanceof EnumType enumType) {
                emitEnum(enumType);
                count++;
            } else {
                unions.add(named);
            }
        }
        // Union aliases are evaluated at import time, so each one follows the unions it names.
        for (NamedType named : DeclarationOrder.TOPOLOGICAL.arrange(unions, dependencies)) {
            emitUnion((UnionType) named);
            count++;
        }
        for (Map.Entry<String, String> alias : names.topLevelAliases().entrySet()) {
            Type type = graph.topLevels().get(alias.getKey());
            startDeclaration();
            out.line(alias.getValue(), " = ", sourceAt(type, "top level " + alias.getKey()));
            count++;
        }
        return count;
    }

    private void emitClass(ClassType classType) {
        String className = names.nameFor(classType);
        Map<String, String> propertyNames = names.propertyNames(classType);

        List<String> fields = new ArrayList<>();
        List<String> parameters = new ArrayList<>();
        boolean defaultSeen = false;
        boolean requiredAfterDefault = false;
        for (Map.Entry<String, ClassProperty> entry : classType.properties().entrySet()) {
            ClassProperty property = entry.getValue();
            String location = "class " + classType.name() + ", property " + entry.getKey();
            String type = sourceAt(property.type(), location);
            if (property.optional() && !TypeGraph.isNullable(property.type())) {
                type = renderer.optional(type);
            }
            String field = propertyNames.get(entry.getKey()) + ": " + type;
            fields.add(field);
            if (property.optional()) {
                parameters.add(field + " = None");
                defaultSeen = true;
            } else {
                parameters.add(field);
                requiredAfterDefault |= defaultSeen;
            }
        }
        boolean keywordOnly = requiredAfterDefault;

        startDeclaration();
        out.line("class ", className, ":");
        out.indent(() -> {
            fields.forEach(f -> out.line(f));
            if (!fields.isEmpty()) {
                out.blank();
            }
            emitInitializer(new ArrayList<>(propertyNames.values()), parameters, keywordOnly);
        });
    }

    private void emitInitializer(List<String> fieldNames, List<String> parameters, boolean keywordOnly) {
        List<String> signature = new ArrayList<>();
        signature.add("self");
        if (keywordOnly) {
            signature.add("*");
        }
        signature.addAll(parameters);

        String oneLine = "def __init__(" + String.join(", ", signature) + ") -> None:";
        if (out.indentWidth() + oneLine.length() <= MAX_LINE_LENGTH) {
            out.line(oneLine);
        } else {
            out.line("def __init__(");
            out.indent(() -> signature.forEach(p -> out.line(p, ",")));
            out.line(") -> None:");
        }

        out.indent(() -> {
            if (fieldNames.isEmpty()) {
                out.line("pass");
            }
            for (String field : fieldNames) {
                out.line("self.", field, " = ", field);
            }
        });
    }

    private void emitEnum(EnumType enumType) {
        List<String> caseNames = names.caseNames(enumType);
        startDeclaration();
        out.line("class ", names.nameFor(enumType), "(", renderer.enumBase(), "):");
        out.indent(() -> {
            if (caseNames.isEmpty()) {
                out.line("pass");
            }
            int ordinal = 0;
            for (String caseName : caseNames) {
                out.line(caseName, " = ", Integer.toString(ordinal++));
            }
        });
    }

    private void emitUnion(UnionType unionType) {
        List<String> members = new ArrayList<>();
        int index = 0;
        for (Type member : unionType.members()) {
            members.add(sourceAt(member, "union " + unionType.name() + ", member " + index++));
        }
        startDeclaration();
        out.line(names.nameFor(unionType), " = ", renderer.union(), "[");
        out.indent(() -> members.forEach(m -> out.line(m, ",")));
        out.line("]");
    }

    private void startDeclaration() {
        out.blank();
        out.blank();
    }

    private String sourceAt(Type type, String location) {
        try {
            return renderer.sourceFor(type);
        } catch (IllegalStateException ex) {
            throw new IllegalStateException("Cannot render " + location + ": " + ex.getMessage(), ex);
        }
    }
}
