package gr.imsi.athenarc.illustrator.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import gr.imsi.athenarc.illustrator.error.LayoutException;
import gr.imsi.athenarc.illustrator.model.NodeKind;

public class NodeOptionsTest {

    private final LayoutConfig config = LayoutConfig.defaults();

    @Test
    public void testUnknownOptionNamesNodeAndKey() {
        LayoutException e = assertThrows(LayoutException.class,
                () -> NodeOptions.parse(NodeKind.RECTANGLE, "box", Map.of("colour", "red")));
        assertEquals(LayoutException.Reason.INVALID_MODIFIER, e.getReason());
        assertEquals(List.of("box", "colour"), e.getIdentifiers());
        assertEquals("layout", e.getPhase());
    }

    @Test
    public void testOptionNotRecognizedForKind() {
        assertThrows(LayoutException.class,
                () -> NodeOptions.parse(NodeKind.ROW, "r", Map.of("size", 10)));
        assertThrows(LayoutException.class,
                () -> NodeOptions.parse(NodeKind.CIRCLE, "c", Map.of("gap", 10)));
        assertThrows(LayoutException.class,
                () -> NodeOptions.parse(NodeKind.COLUMN, "c", Map.of("columns", 2)));
        NodeOptions grid = NodeOptions.parse(NodeKind.GRID, "g", Map.of("columns", 2, "rows", "3"));
        assertEquals(2, grid.getColumns());
        assertEquals(3, grid.getRows());
    }

    @Test
    public void testInvalidValues() {
        LayoutException negative = assertThrows(LayoutException.class,
                () -> NodeOptions.parse(NodeKind.RECTANGLE, "a", Map.of("width", -1)));
        assertEquals(LayoutException.Reason.INVALID_VALUE, negative.getReason());
        assertEquals("-1", negative.getFound());

        assertThrows(LayoutException.class,
                () -> NodeOptions.parse(NodeKind.RECTANGLE, "a", Map.of("opacity", 1.5)));
        assertThrows(LayoutException.class,
                () -> NodeOptions.parse(NodeKind.RECTANGLE, "a", Map.of("size", "big")));
        assertThrows(LayoutException.class,
                () -> NodeOptions.parse(NodeKind.GRID, "g", Map.of("columns", 1.5)));
        assertThrows(LayoutException.class,
                () -> NodeOptions.parse(NodeKind.ROW, "r", Map.of("align", "middle")));
    }

    @Test
    public void testDefaultsComeFromConfig() {
        NodeOptions options = NodeOptions.parse(NodeKind.ROW, "r", Map.of());
        assertEquals(10, options.getGap(config));
        assertEquals(0, options.getPadding(config));
        assertEquals(Alignment.START, options.getAlign(config));
        assertEquals(1.0, options.getOpacity());
        assertNull(options.getWidth());

        NodeOptions explicit = NodeOptions.parse(NodeKind.ROW, "r",
                Map.of("gap", "4", "padding", 2, "align", "center", "dx", -3));
        assertEquals(4, explicit.getGap(config));
        assertEquals(2, explicit.getPadding(config));
        assertEquals(Alignment.CENTER, explicit.getAlign(config));
        assertEquals(-3, explicit.getDx());
        assertEquals(0, explicit.getDy());
    }

    @Test
    public void testOffsetsMustBeFinite() {
        LayoutException nan = assertThrows(LayoutException.class,
                () -> NodeOptions.parse(NodeKind.RECTANGLE, "a", Map.of("dx", "NaN")));
        assertEquals(LayoutException.Reason.INVALID_VALUE, nan.getReason());
        assertEquals(List.of("a", "dx"), nan.getIdentifiers());

        assertThrows(LayoutException.class,
                () -> NodeOptions.parse(NodeKind.RECTANGLE, "a", Map.of("dy", "-Infinity")));
        assertThrows(LayoutException.class,
                () -> NodeOptions.parse(NodeKind.ROW, "r", Map.of("dx", Double.POSITIVE_INFINITY)));
    }
}
