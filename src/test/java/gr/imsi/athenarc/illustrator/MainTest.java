package gr.imsi.athenarc.illustrator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public class MainTest {

    @TempDir
    Path dir;

    private Path write(String name, String content) throws Exception {
        Path file = dir.resolve(name);
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    public void testRendersToFile() throws Exception {
        Path input = write("d.json", "{\"root\": {\"kind\": \"row\", \"children\": ["
                + "{\"kind\": \"rect\", \"id\": \"a\", \"options\": {\"size\": 50}},"
                + "{\"kind\": \"rect\", \"id\": \"b\", \"options\": {\"size\": 50}}]}}");
        Path out = dir.resolve("scene.json");

        int status = Main.run("-input", input.toString(), "-out", out.toString(), "-origin", "10,5");

        assertEquals(Main.EXIT_OK, status);
        JsonNode scene = new ObjectMapper().readTree(out.toFile());
        assertEquals(2, scene.get("shapes").size());
        assertEquals(70, scene.at("/shapes/1/x").asDouble());
        assertEquals(5, scene.at("/bounds/y").asDouble());
    }

    @Test
    public void testConfigFileOverridesDefaults() throws Exception {
        Path input = write("d.json", "{\"nodes\": [{\"kind\": \"rect\", \"id\": \"a\"}, {\"kind\": \"rect\", \"id\": \"b\"}]}");
        Path config = write("layout.properties", "layout.gap=0\nlayout.size.rectangle=10x10\n");
        Path out = dir.resolve("scene.json");

        assertEquals(Main.EXIT_OK, Main.run("-input", input.toString(), "-config", config.toString(), "-out", out.toString()));
        JsonNode scene = new ObjectMapper().readTree(out.toFile());
        assertEquals(10, scene.at("/shapes/1/y").asDouble());
        assertEquals(10, scene.at("/shapes/1/width").asDouble());
    }

    @Test
    public void testLintExitStatus() throws Exception {
        Path input = write("d.json", "{\"root\": {\"kind\": \"stack\", \"options\": {\"width\": 100, \"height\": 100}, \"children\": ["
                + "{\"kind\": \"rect\", \"id\": \"a\", \"options\": {\"size\": 50}},"
                + "{\"kind\": \"rect\", \"id\": \"b\", \"options\": {\"size\": 80, \"dx\": 40}}]}}");
        Path out = dir.resolve("scene.json");

        assertEquals(Main.EXIT_OK, Main.run("-input", input.toString(), "-out", out.toString()));
        assertEquals(Main.EXIT_DIAGNOSTICS, Main.run("-input", input.toString(), "-out", out.toString(), "-lint"));
        assertTrue(Files.exists(out));
    }

    @Test
    public void testFailuresExitWithError() throws Exception {
        Path badConstraint = write("c.json", "{\"root\": {\"kind\": \"rect\", \"id\": \"a\"},"
                + "\"constraints\": [{\"target\": \"ghost\", \"edge\": \"left\", \"value\": 1}]}");
        Path malformed = write("m.json", "{\"root\": ");

        assertEquals(Main.EXIT_ERROR, Main.run("-input", badConstraint.toString()));
        assertEquals(Main.EXIT_ERROR, Main.run("-input", malformed.toString()));
        assertEquals(Main.EXIT_ERROR, Main.run("-input", dir.resolve("missing.json").toString()));
        assertEquals(Main.EXIT_ERROR, Main.run("-origin", "1,2"));
        assertEquals(Main.EXIT_OK, Main.run("--help"));
    }
}
