package gr.imsi.athenarc.illustrator.scene;

import java.util.ArrayList;
import java.util.List;

import gr.imsi.athenarc.illustrator.config.LayoutConfig;
import gr.imsi.athenarc.illustrator.config.NodeOptions;
import gr.imsi.athenarc.illustrator.config.Stylesheet;
import gr.imsi.athenarc.illustrator.domain.Box;
import gr.imsi.athenarc.illustrator.domain.Point;
import gr.imsi.athenarc.illustrator.layout.LayoutNode;
import gr.imsi.athenarc.illustrator.layout.NodeIndex;
import gr.imsi.athenarc.illustrator.layout.TextMetrics;
import gr.imsi.athenarc.illustrator.model.ConnectionSpec;
import gr.imsi.athenarc.illustrator.routing.Route;

/**
 * Packages the final tree and routes into a {@link Scene}.
 */
public class SceneAssembler {

    private final LayoutConfig config;

    public SceneAssembler(LayoutConfig config) {
        this.config = config;
    }

    public Scene assemble(NodeIndex index, List<Route> routes, Stylesheet stylesheet) {
        StyleResolver styles = new StyleResolver(stylesheet);
        String textColor = styles.textColor();
        List<PositionedShape> shapes = new ArrayList<>();
        List<PlacedLabel> labels = new ArrayList<>();
        Box bounds = null;

        for (LayoutNode node : index.getNodes()) {
            NodeOptions options = node.getOptions();
            if (node.isLeaf()) {
                shapes.add(new PositionedShape(node.getId(), node.getName(), node.getKind(), node.getBox(),
                        styles.forShape(options), options.getText()));
                bounds = union(bounds, node.getBox());
            } else if (options.getFill() != null || options.getStroke() != null) {
                shapes.add(new PositionedShape(node.getId(), node.getName(), node.getKind(), node.getBox(),
                        styles.forContainer(options), null));
                bounds = union(bounds, node.getBox());
            }
            if (options.getLabel() != null) {
                PlacedLabel label = shapeLabel(node, textColor);
                labels.add(label);
                bounds = union(bounds, label.getBox());
            }
        }

        List<RoutedPath> paths = new ArrayList<>(routes.size());
        for (Route route : routes) {
            ConnectionSpec connection = route.getConnection();
            paths.add(new RoutedPath(connection.getDisplayName(), route.getSource().getName(),
                    route.getTarget().getName(), connection.getDirection(), route.getPath(),
                    styles.forConnection(connection)));
            for (Point p : route.getPath().getPoints()) {
                bounds = union(bounds, Box.of(p.getX(), p.getY(), 0, 0));
            }
            if (route.getLabelBox() != null) {
                double fontSize = connection.getFontSize() != null ? connection.getFontSize() : config.getFontSize();
                labels.add(new PlacedLabel(connection.getLabel(), route.getLabelPosition(), route.getLabelBox(),
                        fontSize, textColor, PlacedLabel.Owner.CONNECTION, connection.getDisplayName(), List.of()));
                bounds = union(bounds, route.getLabelBox());
            }
        }
        return new Scene(shapes, paths, labels, bounds == null ? Box.sized(0, 0) : bounds);
    }

    /**
     * Leaf labels sit on the shape's center; container labels sit just above the container.
     */
    private PlacedLabel shapeLabel(LayoutNode node, String textColor) {
        String text = node.getOptions().getLabel();
        double fontSize = node.getOptions().getFontSize(config);
        Box box = node.getBox();
        Point center = node.isLeaf()
                ? box.getCenter()
                : new Point(box.getCenterX(), box.getTop() - fontSize / 2.0);
        return new PlacedLabel(text, center, TextMetrics.labelBox(text, fontSize, center, config), fontSize,
                textColor, PlacedLabel.Owner.SHAPE, node.getName(), List.of(node.getName()));
    }

    private static Box union(Box current, Box next) {
        return current == null ? next : current.union(next);
    }
}
