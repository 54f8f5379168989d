package gr.imsi.athenarc.illustrator.routing;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;

import java.util.List;

import org.junit.jupiter.api.Test;

import gr.imsi.athenarc.illustrator.domain.Point;

public class TrunkPlannerTest {

    private final TrunkPlanner planner = new TrunkPlanner();

    private static TrunkPlanner.Leg leg(String source, String target, double x0, double x1, Double override) {
        return new TrunkPlanner.Leg(source, target, new Point(x0, 0), new Point(x1, 50), true, override);
    }

    @Test
    public void testSingleLegBendsHalfway() {
        assertArrayEquals(new double[] {70}, planner.plan(List.of(leg("a.R", "b.L", 40, 100, null))), 1e-9);
        assertArrayEquals(new double[] {55}, planner.plan(List.of(leg("a.R", "b.L", 40, 100, 55.0))), 1e-9);
    }

    @Test
    public void testFanOutSharesClampedMedian() {
        double[] trunks = planner.plan(List.of(
                leg("a.R", "b.L", 40, 100, null),
                leg("a.R", "c.L", 40, 160, null),
                leg("a.R", "d.L", 40, 60, null)));
        // midpoints 70, 100, 50; median 70, clamped to [40, 60] for the last
        assertArrayEquals(new double[] {70, 70, 60}, trunks, 1e-9);
    }

    @Test
    public void testFanInAmongRemainingLegs() {
        double[] trunks = planner.plan(List.of(
                leg("a.R", "z.L", 0, 100, null),
                leg("b.R", "z.L", 20, 100, null)));
        assertArrayEquals(new double[] {55, 55}, trunks, 1e-9);
    }

    @Test
    public void testFirstOverridePinsGroup() {
        double[] trunks = planner.plan(List.of(
                leg("a.R", "b.L", 40, 100, null),
                leg("a.R", "c.L", 40, 160, 120.0),
                leg("a.R", "d.L", 40, 200, 90.0)));
        assertArrayEquals(new double[] {120, 120, 120}, trunks, 1e-9);
    }

    @Test
    public void testOrientationSeparatesGroups() {
        TrunkPlanner.Leg vertical = new TrunkPlanner.Leg("a.R", "b.T", new Point(0, 0), new Point(50, 100), false, null);
        double[] trunks = planner.plan(List.of(leg("a.R", "c.L", 0, 100, null), vertical));
        assertArrayEquals(new double[] {50, 50}, trunks, 1e-9);
    }
}
