package gr.imsi.athenarc.illustrator.routing;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import gr.imsi.athenarc.illustrator.domain.Point;

/**
 * Chooses the coordinate of the middle segment of two-bend orthogonal routes.
 * <p>
 * Routes leaving the same side of the same node form a fan-out group; of the rest, routes
 * entering the same side of the same node form a fan-in group. A group of two or more
 * shares one trunk line at the median of its members' gap midpoints, or at the first
 * explicit trunk override among its members in declaration order. The shared coordinate
 * is clamped to each member's own span so that no route doubles back past an endpoint.
 * A route outside any group bends at its own gap midpoint unless it carries an override.
 */
public class TrunkPlanner {

    private static final Logger LOG = LoggerFactory.getLogger(TrunkPlanner.class);

    /**
     * One two-bend route awaiting its trunk coordinate.
     */
    public static final class Leg {
        private final String sourceKey;
        private final String targetKey;
        private final Point start;
        private final Point end;
        private final boolean horizontal;
        private final Double override;

        /**
         * @param sourceKey node and side the route leaves through
         * @param targetKey node and side the route enters through
         * @param horizontal true when the route leaves and enters along the x axis, so the trunk is an x coordinate
         * @param override explicit trunk coordinate, or null
         */
        public Leg(String sourceKey, String targetKey, Point start, Point end, boolean horizontal, Double override) {
            this.sourceKey = sourceKey + (horizontal ? "/h" : "/v");
            this.targetKey = targetKey + (horizontal ? "/h" : "/v");
            this.start = start;
            this.end = end;
            this.horizontal = horizontal;
            this.override = override;
        }

        public boolean isHorizontal() {
            return horizontal;
        }

        double from() {
            return horizontal ? start.getX() : start.getY();
        }

        double to() {
            return horizontal ? end.getX() : end.getY();
        }

        double midpoint() {
            return (from() + to()) / 2.0;
        }

        double clamp(double value) {
            double low = Math.min(from(), to());
            double high = Math.max(from(), to());
            return Math.max(low, Math.min(high, value));
        }
    }

    /**
     * @param legs two-bend routes in declaration order
     * @return trunk coordinate of each leg, same order
     */
    public double[] plan(List<Leg> legs) {
        double[] trunks = new double[legs.size()];
        boolean[] assigned = new boolean[legs.size()];

        assignGroups(legs, trunks, assigned, true);
        assignGroups(legs, trunks, assigned, false);

        for (int i = 0; i < legs.size(); i++) {
            if (!assigned[i]) {
                Leg leg = legs.get(i);
                trunks[i] = leg.override != null ? leg.override : leg.midpoint();
            }
        }
        return trunks;
    }

    private void assignGroups(List<Leg> legs, double[] trunks, boolean[] assigned, boolean bySource) {
        Map<String, List<Integer>> groups = new LinkedHashMap<>();
        for (int i = 0; i < legs.size(); i++) {
            if (assigned[i]) {
                continue;
            }
            String key = bySource ? legs.get(i).sourceKey : legs.get(i).targetKey;
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(i);
        }
        for (Map.Entry<String, List<Integer>> group : groups.entrySet()) {
            List<Integer> members = group.getValue();
            if (members.size() < 2) {
                continue;
            }
            Double pinned = null;
            for (int member : members) {
                if (legs.get(member).override != null) {
                    pinned = legs.get(member).override;
                    break;
                }
            }
            double shared;
            if (pinned != null) {
                shared = pinned;
            } else {
                double[] midpoints = new double[members.size()];
                for (int k = 0; k < members.size(); k++) {
                    midpoints[k] = legs.get(members.get(k)).midpoint();
                }
                shared = new Median().evaluate(midpoints);
            }
            for (int member : members) {
                Leg leg = legs.get(member);
                trunks[member] = pinned != null ? pinned : leg.clamp(shared);
                assigned[member] = true;
            }
            LOG.debug("{} group {} of {} routes shares trunk {}",
                    bySource ? "Fan-out" : "Fan-in", group.getKey(), members.size(), shared);
        }
    }
}
