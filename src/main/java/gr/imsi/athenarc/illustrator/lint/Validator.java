package gr.imsi.athenarc.illustrator.lint;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.Range;

import gr.imsi.athenarc.illustrator.config.LayoutConfig;
import gr.imsi.athenarc.illustrator.domain.Box;
import gr.imsi.athenarc.illustrator.domain.Point;
import gr.imsi.athenarc.illustrator.layout.LayoutNode;
import gr.imsi.athenarc.illustrator.layout.NodeIndex;
import gr.imsi.athenarc.illustrator.model.ContainsSpec;
import gr.imsi.athenarc.illustrator.model.NodeKind;
import gr.imsi.athenarc.illustrator.routing.Route;
import gr.imsi.athenarc.illustrator.scene.PlacedLabel;
import gr.imsi.athenarc.illustrator.scene.Scene;

/**
 * Read-only detector of geometric defects in a finished render.
 * <ul>
 *   <li>sibling overlap: two children of one parent whose boxes share positive area.
 *   Children of a stack, nodes with opacity below 1, text laid over a shape, and a container
 *   paired with its own {@code contains} member are exempt.</li>
 *   <li>containment: a child outside its parent's padded content box. Members of an explicit
 *   {@code contains} declaration are checked against the declared container and padding
 *   instead of their tree parent.</li>
 *   <li>label overlap: two labels intersecting, or a label over a leaf shape it does not
 *   belong to.</li>
 *   <li>connection crossing: a path passing through a leaf shape other than its endpoints
 *   and their descendants. Text is not an obstacle.</li>
 * </ul>
 */
public class Validator {

    private static final Logger LOG = LoggerFactory.getLogger(Validator.class);

    private final LayoutConfig config;

    public Validator(LayoutConfig config) {
        this.config = config;
    }

    public ImmutableList<Diagnostic> validate(NodeIndex index, List<ContainsSpec> containments,
                                              List<Route> routes, Scene scene) {
        ImmutableList.Builder<Diagnostic> diagnostics = ImmutableList.builder();
        Map<LayoutNode, Set<LayoutNode>> declared = declaredContainment(index, containments);
        checkSiblingOverlap(index, declared, diagnostics);
        checkContainment(index, containments, diagnostics);
        checkLabels(index, scene.getLabels(), diagnostics);
        checkCrossings(index, routes, diagnostics);
        ImmutableList<Diagnostic> result = diagnostics.build();
        LOG.debug("Validation found {} diagnostics", result.size());
        return result;
    }

    /**
     * @return member to the containers that explicitly contain it
     */
    private static Map<LayoutNode, Set<LayoutNode>> declaredContainment(NodeIndex index, List<ContainsSpec> containments) {
        Map<LayoutNode, Set<LayoutNode>> declared = new HashMap<>();
        for (ContainsSpec contains : containments) {
            LayoutNode container = index.resolve(contains.getContainerId(), "contains declaration");
            for (String memberId : contains.getMemberIds()) {
                LayoutNode member = index.resolve(memberId, "contains declaration");
                declared.computeIfAbsent(member, k -> new HashSet<>()).add(container);
            }
        }
        return declared;
    }

    private void checkSiblingOverlap(NodeIndex index, Map<LayoutNode, Set<LayoutNode>> declared,
                                     ImmutableList.Builder<Diagnostic> out) {
        for (LayoutNode parent : index.getNodes()) {
            if (parent.isLeaf() || parent.getKind() == NodeKind.STACK) {
                continue;
            }
            List<LayoutNode> children = parent.getChildren();
            for (int i = 0; i < children.size(); i++) {
                LayoutNode first = children.get(i);
                if (first.getOptions().getOpacity() < 1) {
                    continue;
                }
                for (int j = i + 1; j < children.size(); j++) {
                    LayoutNode second = children.get(j);
                    if (second.getOptions().getOpacity() < 1
                            || index.isRelated(first, second)
                            || textOnShape(first, second)
                            || declaredPair(declared, first, second)) {
                        continue;
                    }
                    Box a = first.getBox();
                    Box b = second.getBox();
                    if (a.intersects(b)) {
                        double w = Math.min(a.getRight(), b.getRight()) - Math.max(a.getLeft(), b.getLeft());
                        double h = Math.min(a.getBottom(), b.getBottom()) - Math.max(a.getTop(), b.getTop());
                        out.add(new Diagnostic(DiagnosticKind.SIBLING_OVERLAP,
                                List.of(first.getName(), second.getName()),
                                "Siblings " + first.getName() + " and " + second.getName() + " in "
                                        + parent.getName() + " overlap by " + format(w) + " x " + format(h)));
                    }
                }
            }
        }
    }

    private static boolean textOnShape(LayoutNode a, LayoutNode b) {
        return (a.getKind() == NodeKind.TEXT) != (b.getKind() == NodeKind.TEXT);
    }

    private static boolean declaredPair(Map<LayoutNode, Set<LayoutNode>> declared, LayoutNode a, LayoutNode b) {
        return declared.getOrDefault(a, Set.of()).contains(b) || declared.getOrDefault(b, Set.of()).contains(a);
    }

    private void checkContainment(NodeIndex index, List<ContainsSpec> containments,
                                  ImmutableList.Builder<Diagnostic> out) {
        Set<LayoutNode> explicitMembers = new HashSet<>();
        for (ContainsSpec contains : containments) {
            LayoutNode container = index.resolve(contains.getContainerId(), "contains declaration");
            Box allowed = container.getBox().inset(contains.getPadding());
            for (String memberId : contains.getMemberIds()) {
                LayoutNode member = index.resolve(memberId, "contains declaration");
                explicitMembers.add(member);
                String overflow = overflow(allowed, member.getBox());
                if (overflow != null) {
                    out.add(new Diagnostic(DiagnosticKind.CONTAINMENT,
                            List.of(member.getName(), container.getName()),
                            member.getName() + " is not inside " + container.getName()
                                    + " (padding " + format(contains.getPadding()) + "): " + overflow));
                }
            }
        }
        for (LayoutNode node : index.getNodes()) {
            if (explicitMembers.contains(node)) {
                continue;
            }
            index.getParent(node).ifPresent(parent -> {
                Box allowed = parent.getBox().inset(parent.getOptions().getPadding(config));
                String overflow = overflow(allowed, node.getBox());
                if (overflow != null) {
                    out.add(new Diagnostic(DiagnosticKind.CONTAINMENT,
                            List.of(node.getName(), parent.getName()),
                            node.getName() + " extends outside the content box of " + parent.getName() + ": " + overflow));
                }
            });
        }
    }

    /**
     * @return which sides of {@code inner} stick out of {@code outer}, null if none
     */
    static String overflow(Box outer, Box inner) {
        Range<Double> horizontal = Range.closed(outer.getLeft() - Box.EPSILON, outer.getRight() + Box.EPSILON);
        Range<Double> vertical = Range.closed(outer.getTop() - Box.EPSILON, outer.getBottom() + Box.EPSILON);
        StringBuilder sb = new StringBuilder();
        if (!horizontal.contains(inner.getLeft())) {
            append(sb, "left by " + format(outer.getLeft() - inner.getLeft()));
        }
        if (!horizontal.contains(inner.getRight())) {
            append(sb, "right by " + format(inner.getRight() - outer.getRight()));
        }
        if (!vertical.contains(inner.getTop())) {
            append(sb, "top by " + format(outer.getTop() - inner.getTop()));
        }
        if (!vertical.contains(inner.getBottom())) {
            append(sb, "bottom by " + format(inner.getBottom() - outer.getBottom()));
        }
        return sb.length() == 0 ? null : sb.toString();
    }

    private static void append(StringBuilder sb, String part) {
        if (sb.length() > 0) {
            sb.append(", ");
        }
        sb.append(part);
    }

    private void checkLabels(NodeIndex index, List<PlacedLabel> labels, ImmutableList.Builder<Diagnostic> out) {
        for (int i = 0; i < labels.size(); i++) {
            PlacedLabel first = labels.get(i);
            for (int j = i + 1; j < labels.size(); j++) {
                PlacedLabel second = labels.get(j);
                if (first.getOwner().equals(second.getOwner())) {
                    continue;
                }
                if (first.getBox().intersects(second.getBox())) {
                    out.add(new Diagnostic(DiagnosticKind.LABEL_OVERLAP,
                            List.of(first.getOwner(), second.getOwner()),
                            "Label '" + first.getText() + "' of " + first.getOwner() + " overlaps label '"
                                    + second.getText() + "' of " + second.getOwner()));
                }
            }
        }

        ImmutableListMultimap<String, LayoutNode> byName = namesOf(index);
        for (PlacedLabel label : labels) {
            for (LayoutNode node : index.getNodes()) {
                if (!node.isLeaf() || node.getOptions().getOpacity() < 1
                        || belongsTo(index, byName, label.getRelatedNodes(), node)) {
                    continue;
                }
                if (label.getBox().intersects(node.getBox())) {
                    out.add(new Diagnostic(DiagnosticKind.LABEL_OVERLAP,
                            List.of(label.getOwner(), node.getName()),
                            "Label '" + label.getText() + "' of " + label.getOwner() + " overlaps " + node.getName()));
                }
            }
        }
    }

    private static ImmutableListMultimap<String, LayoutNode> namesOf(NodeIndex index) {
        ImmutableListMultimap.Builder<String, LayoutNode> names = ImmutableListMultimap.builder();
        for (LayoutNode node : index.getNodes()) {
            names.put(node.getName(), node);
        }
        return names.build();
    }

    private static boolean belongsTo(NodeIndex index, ImmutableListMultimap<String, LayoutNode> byName,
                                     List<String> related, LayoutNode node) {
        for (String name : related) {
            for (LayoutNode owner : byName.get(name)) {
                if (index.isAncestorOrSelf(owner, node)) {
                    return true;
                }
            }
        }
        return false;
    }

    private void checkCrossings(NodeIndex index, List<Route> routes, ImmutableList.Builder<Diagnostic> out) {
        for (Route route : routes) {
            List<Point> points = route.getPath().flatten();
            for (LayoutNode node : index.getNodes()) {
                if (!node.isLeaf()
                        || node.getKind() == NodeKind.TEXT
                        || index.isRelated(route.getSource(), node)
                        || index.isRelated(route.getTarget(), node)) {
                    continue;
                }
                if (GeometryUtils.polylineEntersInterior(points, node.getBox())) {
                    out.add(new Diagnostic(DiagnosticKind.CONNECTION_CROSSING,
                            List.of(route.getConnection().getDisplayName(), node.getName()),
                            "Connection " + route.getConnection().getDisplayName() + " crosses " + node.getName()));
                }
            }
        }
    }

    private static String format(double value) {
        if (value == Math.rint(value)) {
            return Long.toString((long) value);
        }
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
