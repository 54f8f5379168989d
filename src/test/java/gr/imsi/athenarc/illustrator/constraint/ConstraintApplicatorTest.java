package gr.imsi.athenarc.illustrator.constraint;

import static gr.imsi.athenarc.illustrator.Fixtures.layout;
import static gr.imsi.athenarc.illustrator.Fixtures.node;
import static gr.imsi.athenarc.illustrator.Fixtures.placed;
import static gr.imsi.athenarc.illustrator.Fixtures.rect;
import static gr.imsi.athenarc.illustrator.Fixtures.stack;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;

import gr.imsi.athenarc.illustrator.domain.Box;
import gr.imsi.athenarc.illustrator.error.ConstraintException;
import gr.imsi.athenarc.illustrator.layout.NodeIndex;
import gr.imsi.athenarc.illustrator.model.ConstraintExpression;
import gr.imsi.athenarc.illustrator.model.ConstraintSpec;
import gr.imsi.athenarc.illustrator.model.NodeKind;
import gr.imsi.athenarc.illustrator.model.NodeSpec;
import gr.imsi.athenarc.illustrator.model.Relation;

public class ConstraintApplicatorTest {

    private final ConstraintApplicator applicator = new ConstraintApplicator();

    /** a at [0, 50], group g (c over d) at x 70 */
    private NodeIndex rowWithGroup() {
        return layout(NodeSpec.builder(NodeKind.ROW).option("gap", 20).children(
                rect("a", 50),
                NodeSpec.builder(NodeKind.COLUMN).id("g").children(rect("c", 20), rect("d", 20)).build()).build());
    }

    private NodeIndex twoInRow() {
        return layout(NodeSpec.builder(NodeKind.ROW).option("gap", 20).children(rect("a", 50), rect("b", 50)).build());
    }

    @Test
    public void testEdgeReferenceWithOffset() {
        NodeIndex index = twoInRow();
        applicator.apply(index, List.of(ConstraintSpec.equal("b", "left", ConstraintExpression.edge("a", "right", 40))));
        assertEquals(90, node(index, "b").getBox().getLeft());
        assertEquals(0, node(index, "b").getBox().getTop());
    }

    @Test
    public void testSatisfiedConstraintIsIdempotent() {
        NodeIndex index = twoInRow();
        List<ConstraintSpec> constraints = List.of(
                ConstraintSpec.equal("b", "left", ConstraintExpression.edge("a", "right", 20)));
        applicator.apply(index, constraints);
        Box once = node(index, "b").getBox();
        applicator.apply(index, constraints);
        assertEquals(once, node(index, "b").getBox());
        assertEquals(70, once.getLeft());
    }

    @Test
    public void testPositionMovesWholeSubtree() {
        NodeIndex index = rowWithGroup();
        applicator.apply(index, List.of(ConstraintSpec.equal("g", "top", ConstraintExpression.constant(100))));
        assertEquals(100, node(index, "g").getBox().getTop());
        assertEquals(100, node(index, "c").getBox().getTop());
        assertEquals(130, node(index, "d").getBox().getTop());
        assertEquals(70, node(index, "c").getBox().getLeft());
        assertEquals(0, node(index, "a").getBox().getTop());
    }

    @Test
    public void testSizeEdgeResizesTargetOnly() {
        NodeIndex index = rowWithGroup();
        applicator.apply(index, List.of(ConstraintSpec.equal("g", "width", ConstraintExpression.constant(200))));
        assertEquals(Box.of(70, 0, 200, 50), node(index, "g").getBox());
        assertEquals(Box.of(70, 0, 20, 20), node(index, "c").getBox());
    }

    @Test
    public void testNegativeSizeClampsToZero() {
        NodeIndex index = twoInRow();
        applicator.apply(index, List.of(ConstraintSpec.equal("a", "height", ConstraintExpression.constant(-5))));
        assertEquals(0, node(index, "a").getBox().getHeight());
    }

    @Test
    public void testLaterConstraintOnSameEdgeWins() {
        NodeIndex index = twoInRow();
        applicator.apply(index, List.of(
                ConstraintSpec.equal("a", "left", ConstraintExpression.constant(5)),
                ConstraintSpec.equal("a", "x", ConstraintExpression.constant(30))));
        assertEquals(30, node(index, "a").getBox().getLeft());
    }

    @Test
    public void testInequalitiesOnlyActWhenViolated() {
        NodeIndex index = twoInRow();
        applicator.apply(index, List.of(
                new ConstraintSpec("a", "left", Relation.AT_LEAST, ConstraintExpression.constant(-5)),
                new ConstraintSpec("b", "right", Relation.AT_MOST, ConstraintExpression.constant(100))));
        assertEquals(0, node(index, "a").getBox().getLeft());
        assertEquals(100, node(index, "b").getBox().getRight());

        applicator.apply(index, List.of(
                new ConstraintSpec("a", "left", Relation.AT_LEAST, ConstraintExpression.constant(10))));
        assertEquals(10, node(index, "a").getBox().getLeft());
    }

    @Test
    public void testMidpointCentersBetweenTwoNodes() {
        NodeIndex index = layout(stack(
                placed("a", 0, 0, 20, 20),
                placed("b", 100, 0, 20, 20),
                placed("m", 0, 50, 10, 10)));
        applicator.apply(index, List.of(
                ConstraintSpec.equal("m", "center_x", ConstraintExpression.midpoint("a", "b", 0))));
        assertEquals(60, node(index, "m").getBox().getCenterX());
        assertEquals(50, node(index, "m").getBox().getTop());
    }

    @Test
    public void testUnknownNodeLeavesTreeUntouched() {
        NodeIndex index = twoInRow();
        ConstraintException e = assertThrows(ConstraintException.class, () -> applicator.apply(index, List.of(
                ConstraintSpec.equal("a", "left", ConstraintExpression.constant(5)),
                ConstraintSpec.equal("ghost", "left", ConstraintExpression.constant(0)))));
        assertEquals(ConstraintException.Reason.UNKNOWN_NODE, e.getReason());
        assertEquals(List.of("ghost"), e.getIdentifiers());
        assertEquals(0, node(index, "a").getBox().getLeft());
    }

    @Test
    public void testUnknownOperandNode() {
        NodeIndex index = twoInRow();
        ConstraintException e = assertThrows(ConstraintException.class, () -> applicator.apply(index, List.of(
                ConstraintSpec.equal("a", "left", ConstraintExpression.edge("nowhere", "right", 0)))));
        assertEquals(List.of("nowhere"), e.getIdentifiers());
    }

    @Test
    public void testUnknownEdge() {
        NodeIndex index = twoInRow();
        ConstraintException e = assertThrows(ConstraintException.class, () -> applicator.apply(index, List.of(
                ConstraintSpec.equal("a", "middle", ConstraintExpression.constant(5)))));
        assertEquals(ConstraintException.Reason.UNKNOWN_EDGE, e.getReason());
        assertEquals(List.of("a", "middle"), e.getIdentifiers());
        assertEquals("constraint", e.getPhase());
    }
}
