package ai.typerender.pipeline;

import ai.typerender.config.RenderProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

@Component
public class RenderRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(RenderRunner.class);

    private final RenderProperties properties;
    private final RenderPipeline pipeline;

    public RenderRunner(RenderProperties properties, RenderPipeline pipeline) {
        this.properties = properties;
        this.pipeline = pipeline;
    }

    @Override
    public void run(String... args) {
        if (properties.getInput() == null || properties.getOutput() == null) {
            log.warn("Missing renderer.input or renderer.output. Example:");
            log.warn("--renderer.input=/path/to/graph.json --renderer.output=/path/to/types.py");
            return;
        }
        pipeline.run(properties);
    }
}
