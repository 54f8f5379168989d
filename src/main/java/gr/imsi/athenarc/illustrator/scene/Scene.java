package gr.imsi.athenarc.illustrator.scene;

import java.util.List;

import com.google.common.collect.ImmutableList;

import gr.imsi.athenarc.illustrator.domain.Box;

/**
 * The result of a render: everything a serializer needs, in drawing order, with no
 * geometry left to compute. Immutable.
 */
public final class Scene {

    private final ImmutableList<PositionedShape> shapes;
    private final ImmutableList<RoutedPath> paths;
    private final ImmutableList<PlacedLabel> labels;
    private final Box bounds;

    public Scene(List<PositionedShape> shapes, List<RoutedPath> paths, List<PlacedLabel> labels, Box bounds) {
        this.shapes = ImmutableList.copyOf(shapes);
        this.paths = ImmutableList.copyOf(paths);
        this.labels = ImmutableList.copyOf(labels);
        this.bounds = bounds;
    }

    public ImmutableList<PositionedShape> getShapes() {
        return shapes;
    }

    public ImmutableList<RoutedPath> getPaths() {
        return paths;
    }

    public ImmutableList<PlacedLabel> getLabels() {
        return labels;
    }

    /**
     * @return smallest box holding every shape, path point and label
     */
    public Box getBounds() {
        return bounds;
    }

    @Override
    public String toString() {
        return "Scene{shapes=" + shapes.size() + ", paths=" + paths.size()
                + ", labels=" + labels.size() + ", bounds=" + bounds + "}";
    }
}
