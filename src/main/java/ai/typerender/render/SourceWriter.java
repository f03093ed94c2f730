package ai.typerender.render;

import java.util.ArrayList;
import java.util.List;

final class SourceWriter {

    private static final String INDENT = "    ";

    private final List<String> lines = new ArrayList<>();
    private int level;

    void line(String... parts) {
        String text = String.join("", parts);
        lines.add(text.isEmpty() ? "" : INDENT.repeat(level) + text);
    }

    void blank() {
        lines.add("");
    }

    void indent(Runnable body) {
        level++;
        try {
            body.run();
        } finally {
            level--;
        }
    }

    int indentWidth() {
        return INDENT.length() * level;
    }

    List<String> lines() {
        return lines;
    }
}
