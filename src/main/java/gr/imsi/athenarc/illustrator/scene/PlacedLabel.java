package gr.imsi.athenarc.illustrator.scene;

import java.util.List;

import com.google.common.collect.ImmutableList;

import gr.imsi.athenarc.illustrator.domain.Box;
import gr.imsi.athenarc.illustrator.domain.Point;

/**
 * A label with its final box. {@link #getRelatedNodes()} names the shape a label is drawn on;
 * connection labels have none, so they may not cover their own endpoints either.
 */
public final class PlacedLabel {

    public enum Owner {
        SHAPE,
        CONNECTION
    }

    private final String text;
    private final Point position;
    private final Box box;
    private final double fontSize;
    private final String color;
    private final Owner ownerKind;
    private final String owner;
    private final ImmutableList<String> relatedNodes;

    public PlacedLabel(String text, Point position, Box box, double fontSize, String color,
                       Owner ownerKind, String owner, List<String> relatedNodes) {
        this.text = text;
        this.position = position;
        this.box = box;
        this.fontSize = fontSize;
        this.color = color;
        this.ownerKind = ownerKind;
        this.owner = owner;
        this.relatedNodes = ImmutableList.copyOf(relatedNodes);
    }

    public String getText() {
        return text;
    }

    /**
     * @return center of the label
     */
    public Point getPosition() {
        return position;
    }

    public Box getBox() {
        return box;
    }

    public double getFontSize() {
        return fontSize;
    }

    public String getColor() {
        return color;
    }

    public Owner getOwnerKind() {
        return ownerKind;
    }

    public String getOwner() {
        return owner;
    }

    public ImmutableList<String> getRelatedNodes() {
        return relatedNodes;
    }

    @Override
    public String toString() {
        return "'" + text + "' of " + owner + " at " + box;
    }
}
