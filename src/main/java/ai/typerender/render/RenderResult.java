package ai.typerender.render;

import java.util.List;

public record RenderResult(List<String> lines, NameTable names, int declarationCount) {
    public RenderResult {
        lines = List.copyOf(lines);
    }

    public String source() {
        return String.join("\n", lines) + "\n";
    }
}
