package gr.imsi.athenarc.illustrator.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import gr.imsi.athenarc.illustrator.config.Stylesheet;
import gr.imsi.athenarc.illustrator.error.ConstraintException;
import gr.imsi.athenarc.illustrator.lint.Diagnostic;
import gr.imsi.athenarc.illustrator.lint.DiagnosticKind;
import gr.imsi.athenarc.illustrator.manager.RenderManager;
import gr.imsi.athenarc.illustrator.model.ConnectionSpec;
import gr.imsi.athenarc.illustrator.model.DiagramBuilder;
import gr.imsi.athenarc.illustrator.model.NodeKind;
import gr.imsi.athenarc.illustrator.model.NodeSpec;
import gr.imsi.athenarc.illustrator.scene.Scene;

public class SceneJsonWriterTest {

    private final SceneJsonWriter writer = new SceneJsonWriter();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    public void testSceneDocument() throws Exception {
        Scene scene = RenderManager.createDefault().render(new DiagramBuilder()
                .withNode(NodeSpec.builder(NodeKind.ROW).children(
                        NodeSpec.builder(NodeKind.RECTANGLE).id("a").option("size", 20).option("fill", "accent-1").build(),
                        NodeSpec.builder(NodeKind.TEXT).id("t").option("text", "hi").build()).build())
                .withConnection(ConnectionSpec.builder("a", "t").strokeDasharray("dashed").build())
                .build(), Stylesheet.empty());

        JsonNode json = mapper.readTree(writer.toJson(scene));
        assertEquals(0, json.at("/bounds/x").asDouble());
        JsonNode a = json.at("/shapes/0");
        assertEquals("a", a.get("id").asText());
        assertEquals("rectangle", a.get("kind").asText());
        assertEquals("#2196f3", a.get("fill").asText());
        assertFalse(a.has("opacity"));
        assertEquals("hi", json.at("/shapes/1/text").asText());

        JsonNode path = json.at("/paths/0");
        assertEquals("forward", path.get("direction").asText());
        assertEquals("polyline", path.get("geometry").asText());
        assertEquals("8,4", path.get("stroke_dasharray").asText());
        assertEquals(20, path.at("/points/0/0").asDouble());
    }

    @Test
    public void testDiagnosticLine() throws Exception {
        String line = writer.toJsonLine(new Diagnostic(DiagnosticKind.SIBLING_OVERLAP, List.of("a", "b"), "overlap"));
        assertFalse(line.contains("\n"));
        JsonNode json = mapper.readTree(line);
        assertEquals("sibling-overlap", json.get("kind").asText());
        assertEquals("advisory", json.get("severity").asText());
        assertEquals("b", json.at("/identifiers/1").asText());
    }

    @Test
    public void testErrorLine() throws Exception {
        JsonNode json = mapper.readTree(writer.toJsonLine(ConstraintException.unknownNode("ghost", "ghost.left = 1")));
        assertEquals("constraint", json.get("error").asText());
        assertEquals("ghost", json.at("/identifiers/0").asText());
        assertEquals("ghost", json.get("found").asText());
    }
}
