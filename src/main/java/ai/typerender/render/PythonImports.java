package ai.typerender.render;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

final class PythonImports {

    private final SortedMap<String, SortedSet<String>> byModule = new TreeMap<>();

    void add(String module, String name) {
        byModule.computeIfAbsent(module, m -> new TreeSet<>()).add(name);
    }

    boolean isEmpty() {
        return byModule.isEmpty();
    }

    List<String> lines() {
        List<String> lines = new ArrayList<>();
        byModule.forEach((module, names) ->
            lines.add("from " + module + " import " + String.join(", ", names)));
        return lines;
    }
}
