package ai.typerender;

import ai.typerender.config.RenderProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(RenderProperties.class)
public class TypeRendererApplication {
    public static void main(String[] args) {
        SpringApplication.run(TypeRendererApplication.class, args);
    }
}
