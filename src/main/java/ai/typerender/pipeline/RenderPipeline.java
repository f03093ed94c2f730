package ai.typerender.pipeline;

import ai.typerender.config.RenderProperties;
import ai.typerender.model.TypeGraph;
import ai.typerender.model.TypeGraphReader;
import ai.typerender.render.PythonRenderer;
import ai.typerender.render.RenderResult;
import ai.typerender.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Service
public class RenderPipeline {

    private static final Logger log = LoggerFactory.getLogger(RenderPipeline.class);

    private final TypeGraphReader reader;
    private final PythonRenderer renderer;

    public RenderPipeline(PythonRenderer renderer) {
        this.reader = new TypeGraphReader();
        this.renderer = renderer;
    }

    public RenderResult render(Path input, RenderProperties properties) throws IOException {
        log.info("Reading type graph from {}", input);
        TypeGraph graph = reader.read(input);
        log.info("Loaded {} top level(s), {} named type(s)", graph.topLevels().size(), graph.namedTypes().size());
        return renderer.render(graph, properties.getLeadingComments(), properties.toOptions());
    }

    /**
     * Renders and writes the module, and the names report when one is
     * configured. Both payloads and both target directories are ready before
     * the first file is written.
     */
    public boolean run(RenderProperties properties) {
        try {
            RenderResult result = render(properties.getInput(), properties);

            Path output = properties.getOutput();
            Path namesReport = properties.getNamesReport();
            String report = namesReport == null ? null : JsonUtils.toPrettyJson(result.names().report());

            createParentDirectories(output);
            if (namesReport != null) {
                createParentDirectories(namesReport);
            }

            Files.writeString(output, result.source());
            if (namesReport != null) {
                Files.writeString(namesReport, report);
            }

            log.info("Rendered {} declaration(s) to {}", result.declarationCount(), output);
            return true;
        } catch (Exception ex) {
            log.error("Render failed", ex);
            return false;
        }
    }

    private static void createParentDirectories(Path file) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
    }
}
