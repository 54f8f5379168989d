package gr.imsi.athenarc.illustrator.io;

import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import gr.imsi.athenarc.illustrator.domain.Box;
import gr.imsi.athenarc.illustrator.domain.Point;
import gr.imsi.athenarc.illustrator.error.DiagramException;
import gr.imsi.athenarc.illustrator.lint.Diagnostic;
import gr.imsi.athenarc.illustrator.scene.PlacedLabel;
import gr.imsi.athenarc.illustrator.scene.PositionedShape;
import gr.imsi.athenarc.illustrator.scene.ResolvedStyle;
import gr.imsi.athenarc.illustrator.scene.RoutedPath;
import gr.imsi.athenarc.illustrator.scene.Scene;

/**
 * Writes scenes, diagnostics and errors as JSON for the serializer and for tools.
 */
public class SceneJsonWriter {

    private static final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    private static final ObjectMapper lineMapper = new ObjectMapper();

    public void write(Scene scene, OutputStream out) throws IOException {
        mapper.writeValue(out, toMap(scene));
    }

    public String toJson(Scene scene) throws JsonProcessingException {
        return mapper.writeValueAsString(toMap(scene));
    }

    /**
     * @return the diagnostic as a single line of JSON
     */
    public String toJsonLine(Diagnostic diagnostic) throws JsonProcessingException {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("kind", diagnostic.getKind().getCode());
        map.put("severity", diagnostic.getSeverity().name().toLowerCase(Locale.ROOT));
        map.put("identifiers", diagnostic.getIdentifiers());
        map.put("message", diagnostic.getMessage());
        return lineMapper.writeValueAsString(map);
    }

    public String toJsonLine(DiagramException error) throws JsonProcessingException {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("error", error.getPhase());
        map.put("identifiers", error.getIdentifiers());
        map.put("expected", error.getExpected());
        map.put("found", error.getFound());
        map.put("message", error.getMessage());
        return lineMapper.writeValueAsString(map);
    }

    Map<String, Object> toMap(Scene scene) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("bounds", box(scene.getBounds()));

        List<Map<String, Object>> shapes = new ArrayList<>();
        for (PositionedShape shape : scene.getShapes()) {
            Map<String, Object> s = new LinkedHashMap<>();
            if (shape.getId() != null) {
                s.put("id", shape.getId());
            }
            s.put("kind", shape.getKind().getName());
            s.putAll(box(shape.getBox()));
            if (shape.getText() != null) {
                s.put("text", shape.getText());
            }
            s.putAll(style(shape.getStyle()));
            shapes.add(s);
        }
        map.put("shapes", shapes);

        List<Map<String, Object>> paths = new ArrayList<>();
        for (RoutedPath path : scene.getPaths()) {
            Map<String, Object> p = new LinkedHashMap<>();
            p.put("name", path.getName());
            p.put("from", path.getFrom());
            p.put("to", path.getTo());
            p.put("direction", path.getDirection().name().toLowerCase(Locale.ROOT));
            p.put("geometry", path.getGeometry().getKind().name().toLowerCase(Locale.ROOT));
            List<double[]> points = new ArrayList<>();
            for (Point point : path.getGeometry().getPoints()) {
                points.add(new double[] {point.getX(), point.getY()});
            }
            p.put("points", points);
            p.putAll(style(path.getStyle()));
            paths.add(p);
        }
        map.put("paths", paths);

        List<Map<String, Object>> labels = new ArrayList<>();
        for (PlacedLabel label : scene.getLabels()) {
            Map<String, Object> l = new LinkedHashMap<>();
            l.put("text", label.getText());
            l.put("owner", label.getOwner());
            l.put("x", label.getPosition().getX());
            l.put("y", label.getPosition().getY());
            l.put("box", box(label.getBox()));
            l.put("font_size", label.getFontSize());
            l.put("color", label.getColor());
            labels.add(l);
        }
        map.put("labels", labels);
        return map;
    }

    private static Map<String, Object> box(Box box) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("x", box.getX());
        map.put("y", box.getY());
        map.put("width", box.getWidth());
        map.put("height", box.getHeight());
        return map;
    }

    private static Map<String, Object> style(ResolvedStyle style) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("fill", style.getFill());
        map.put("stroke", style.getStroke());
        map.put("stroke_width", style.getStrokeWidth());
        if (style.getStrokeDasharray() != null) {
            map.put("stroke_dasharray", style.getStrokeDasharray());
        }
        if (style.getOpacity() != 1) {
            map.put("opacity", style.getOpacity());
        }
        if (style.getCssClass() != null) {
            map.put("class", style.getCssClass());
        }
        return map;
    }
}
