package gr.imsi.athenarc.illustrator.io;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import gr.imsi.athenarc.illustrator.config.MapStylesheet;
import gr.imsi.athenarc.illustrator.error.LayoutException;
import gr.imsi.athenarc.illustrator.model.ConnectionDirection;
import gr.imsi.athenarc.illustrator.model.ConnectionSpec;
import gr.imsi.athenarc.illustrator.model.ConstraintExpression;
import gr.imsi.athenarc.illustrator.model.ConstraintSpec;
import gr.imsi.athenarc.illustrator.model.ContainsSpec;
import gr.imsi.athenarc.illustrator.model.Diagram;
import gr.imsi.athenarc.illustrator.model.DiagramBuilder;
import gr.imsi.athenarc.illustrator.model.EndpointRef;
import gr.imsi.athenarc.illustrator.model.NodeKind;
import gr.imsi.athenarc.illustrator.model.NodeSpec;
import gr.imsi.athenarc.illustrator.model.Relation;
import gr.imsi.athenarc.illustrator.model.RoutingMode;

/**
 * Reads a parsed diagram tree from its JSON interchange form.
 * <pre>
 * {
 *   "nodes": [ {"kind": "row", "id": "r", "options": {"gap": 20}, "children": [ ... ]} ],
 *   "connections": [ {"from": "a", "to": "b.top", "arrow": "->", "routing": "direct",
 *                     "label": "x", "label_at": 0.25, "via": ["c"], "style": {"stroke": "accent-1"}} ],
 *   "constraints": [ {"target": "a", "edge": "left", "relation": "=", "ref": "b.right", "offset": 20},
 *                    {"target": "a", "edge": "top", "value": 100},
 *                    {"target": "a", "edge": "center_x", "midpoint": ["b", "c"]} ],
 *   "contains": [ {"container": "c", "members": ["a", "b"], "padding": 10} ]
 * }
 * </pre>
 * A single {@code "root"} object may replace {@code "nodes"}.
 */
public class DiagramJsonReader {

    private static final ObjectMapper mapper = new ObjectMapper();

    public Diagram read(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        }
    }

    public Diagram read(InputStream in) throws IOException {
        return read(mapper.readTree(in));
    }

    public Diagram read(String json) throws IOException {
        return read(mapper.readTree(json));
    }

    /**
     * Reads a stylesheet: either {@code {"colors": {...}}} or a flat name to color map.
     * Entries override the default palette.
     */
    public MapStylesheet readStylesheet(Path path) throws IOException {
        JsonNode tree;
        try (InputStream in = Files.newInputStream(path)) {
            tree = mapper.readTree(in);
        }
        JsonNode colors = tree.has("colors") ? tree.get("colors") : tree;
        Map<String, String> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = colors.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            values.put(field.getKey(), field.getValue().asText());
        }
        return MapStylesheet.overDefaults(values);
    }

    private Diagram read(JsonNode tree) {
        DiagramBuilder builder = new DiagramBuilder();
        if (tree.has("root")) {
            builder.withNode(node(tree.get("root")));
        }
        for (JsonNode node : tree.path("nodes")) {
            builder.withNode(node(node));
        }
        for (JsonNode connection : tree.path("connections")) {
            builder.withConnection(connection(connection));
        }
        for (JsonNode constraint : tree.path("constraints")) {
            builder.withConstraint(constraint(constraint));
        }
        for (JsonNode contains : tree.path("contains")) {
            builder.withContainment(contains(contains));
        }
        return builder.build();
    }

    private NodeSpec node(JsonNode json) {
        String kindName = required(json, "kind").asText();
        NodeKind kind = NodeKind.parse(kindName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown node kind: " + kindName));
        NodeSpec.Builder builder = NodeSpec.builder(kind);
        if (json.hasNonNull("id")) {
            builder.id(json.get("id").asText());
        }
        Iterator<Map.Entry<String, JsonNode>> options = json.path("options").fields();
        while (options.hasNext()) {
            Map.Entry<String, JsonNode> option = options.next();
            builder.option(option.getKey(), scalar(option.getValue()));
        }
        for (JsonNode child : json.path("children")) {
            builder.child(node(child));
        }
        return builder.build();
    }

    private static Object scalar(JsonNode value) {
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        return value.asText();
    }

    private ConnectionSpec connection(JsonNode json) {
        ConnectionSpec.Builder builder = ConnectionSpec.builder(
                EndpointRef.parse(required(json, "from").asText()),
                EndpointRef.parse(required(json, "to").asText()));
        if (json.hasNonNull("arrow")) {
            builder.direction(ConnectionDirection.fromArrow(json.get("arrow").asText()));
        }
        if (json.hasNonNull("routing")) {
            builder.routing(RoutingMode.parse(json.get("routing").asText()));
        }
        for (JsonNode point : json.path("waypoints")) {
            builder.waypoint(point.get(0).asDouble(), point.get(1).asDouble());
        }
        for (JsonNode via : json.path("via")) {
            builder.via(via.asText());
        }
        if (json.hasNonNull("label")) {
            builder.label(json.get("label").asText());
        }
        if (json.hasNonNull("label_at")) {
            builder.labelAt(json.get("label_at").asDouble());
        }
        if (json.hasNonNull("label_offset")) {
            builder.labelOffset(json.get("label_offset").asDouble());
        }
        if (json.hasNonNull("trunk")) {
            builder.trunk(json.get("trunk").asDouble());
        }
        Iterator<Map.Entry<String, JsonNode>> style = json.path("style").fields();
        String name = json.path("from").asText() + " -> " + json.path("to").asText();
        while (style.hasNext()) {
            Map.Entry<String, JsonNode> entry = style.next();
            JsonNode value = entry.getValue();
            switch (entry.getKey()) {
                case "stroke":
                    builder.stroke(value.asText());
                    break;
                case "stroke_width":
                    builder.strokeWidth(value.asDouble());
                    break;
                case "stroke_dasharray":
                    builder.strokeDasharray(value.asText());
                    break;
                case "opacity":
                    builder.opacity(value.asDouble());
                    break;
                case "font_size":
                    builder.fontSize(value.asDouble());
                    break;
                case "class":
                    builder.cssClass(value.asText());
                    break;
                default:
                    throw LayoutException.invalidModifier(name, entry.getKey(), "connection",
                            List.of("stroke", "stroke_width", "stroke_dasharray", "opacity", "font_size", "class"));
            }
        }
        return builder.build();
    }

    private ConstraintSpec constraint(JsonNode json) {
        String target = required(json, "target").asText();
        String edge = required(json, "edge").asText();
        Relation relation = json.hasNonNull("relation")
                ? Relation.fromSymbol(json.get("relation").asText())
                : Relation.EQUAL;
        double offset = json.path("offset").asDouble(0);
        ConstraintExpression expression;
        if (json.hasNonNull("ref")) {
            EndpointRef ref = EndpointRef.parse(json.get("ref").asText());
            if (!ref.hasAnchor()) {
                throw new IllegalArgumentException("Constraint reference needs node.edge, got " + ref);
            }
            expression = ConstraintExpression.edge(ref.getNodeId(), ref.getAnchor(), offset);
        } else if (json.has("midpoint")) {
            JsonNode pair = json.get("midpoint");
            if (pair.size() != 2) {
                throw new IllegalArgumentException("midpoint takes two nodes, got " + pair);
            }
            expression = ConstraintExpression.midpoint(pair.get(0).asText(), pair.get(1).asText(), offset);
        } else {
            expression = ConstraintExpression.constant(required(json, "value").asDouble() + offset);
        }
        return new ConstraintSpec(target, edge, relation, expression);
    }

    private ContainsSpec contains(JsonNode json) {
        List<String> members = new ArrayList<>();
        for (JsonNode member : required(json, "members")) {
            members.add(member.asText());
        }
        return new ContainsSpec(required(json, "container").asText(), members, json.path("padding").asDouble(0));
    }

    private static JsonNode required(JsonNode json, String field) {
        JsonNode value = json.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("Missing field '" + field + "' in " + json);
        }
        return value;
    }
}
