package ai.typerender;

import ai.typerender.config.RenderProperties;
import ai.typerender.pipeline.RenderPipeline;
import ai.typerender.render.DeclarationOrder;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
    "renderer.declare-unions=true",
    "renderer.declaration-order=topological",
    "renderer.leading-comments=first,second"
})
class TypeRendererApplicationTests {

    @Autowired
    RenderProperties properties;

    @Autowired
    RenderPipeline pipeline;

    @Test
    void bindsRendererProperties() {
        assertNotNull(pipeline);
        assertTrue(properties.isDeclareUnions());
        assertEquals(DeclarationOrder.TOPOLOGICAL, properties.getDeclarationOrder());
        assertEquals(2, properties.getLeadingComments().size());
        assertNull(properties.getInput());
    }
}
