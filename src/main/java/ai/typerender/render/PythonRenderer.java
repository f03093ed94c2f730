package ai.typerender.render;

import ai.typerender.model.TypeGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a type graph as one Python module. Each call builds its own name
 * table, so one instance can serve any number of renders.
 */
@Service
public class PythonRenderer {

    private static final Logger log = LoggerFactory.getLogger(PythonRenderer.class);

    public RenderResult render(TypeGraph graph, List<String> leadingComments, RenderOptions options) {
        NameTable names = new NameAssigner(options).assign(graph);
        PythonImports imports = new PythonImports();
        TypeRenderer typeRenderer = new TypeRenderer(names, options, imports);

        SourceWriter body = new SourceWriter();
        int count = new DeclarationEmitter(graph, names, typeRenderer, options, body).emit();

        List<String> lines = new ArrayList<>();
        if (leadingComments != null && !leadingComments.isEmpty()) {
            for (String comment : leadingComments) {
                for (String line : comment.split("\\R", -1)) {
                    lines.add(line.isEmpty() ? "#" : "# " + line);
                }
            }
            lines.add("");
        }
        // Annotations stay unevaluated, so classes may mention types declared further down.
        lines.add("from __future__ import annotations");
        if (!imports.isEmpty()) {
            lines.add("");
            lines.addAll(imports.lines());
        }
        lines.addAll(body.lines());

        log.debug("Rendered {} declaration(s) into {} line(s)", count, lines.size());
        return new RenderResult(lines, names, count);
    }

    public RenderResult render(TypeGraph graph, RenderOptions options) {
        return render(graph, List.of(), options);
    }
}
