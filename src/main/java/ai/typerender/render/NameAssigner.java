package ai.typerender.render;

import ai.typerender.model.ClassType;
import ai.typerender.model.EnumType;
import ai.typerender.model.NamedType;
import ai.typerender.model.Type;
import ai.typerender.model.TypeGraph;
import ai.typerender.naming.Namer;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class NameAssigner {

    private final RenderOptions options;

    NameAssigner(RenderOptions options) {
        this.options = options;
    }

    NameTable assign(TypeGraph graph) {
        NameTable table = new NameTable();
        Namer global = PythonNames.typeNamer();

        // Top levels claim their labels before anything else in the global scope.
        for (Map.Entry<String, Type> topLevel : graph.topLevels().entrySet()) {
            Type type = topLevel.getValue();
            if (type instanceof NamedType named && options.declares(named) && !table.hasName(named)) {
                table.putTypeName(named, global.assign(topLevel.getKey()));
            } else {
                table.putTopLevelAlias(topLevel.getKey(), global.assign(topLevel.getKey()));
            }
        }

        List<NamedType> namedTypes = graph.namedTypes();
        for (NamedType named : namedTypes) {
            if (options.declares(named) && !table.hasName(named)) {
                table.putTypeName(named, global.assign(named.name()));
            }
        }

        for (NamedType named : namedTypes) {
            if (named instanceof ClassType classType) {
                Namer properties = PythonNames.propertyNamer(table.nameFor(classType));
                Map<String, String> names = new LinkedHashMap<>();
                for (String label : classType.properties().keySet()) {
                    names.put(label, properties.assign(label));
                }
                table.putPropertyNames(classType, names);
            } else if (named instanceof EnumType enumType) {
                Namer cases = PythonNames.enumCaseNamer(table.nameFor(enumType));
                List<String> names = new ArrayList<>();
                for (String label : enumType.cases()) {
                    names.add(cases.assign(label));
                }
                table.putCaseNames(enumType, names);
            }
        }
        return table;
    }
}
