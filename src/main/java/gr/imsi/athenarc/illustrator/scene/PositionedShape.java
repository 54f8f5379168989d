package gr.imsi.athenarc.illustrator.scene;

import org.jetbrains.annotations.Nullable;

import gr.imsi.athenarc.illustrator.domain.Box;
import gr.imsi.athenarc.illustrator.model.NodeKind;

/**
 * A shape ready to draw. Containers appear only when they declare a fill or a stroke, and
 * always before the shapes they contain.
 */
public final class PositionedShape {

    private final String id;
    private final String name;
    private final NodeKind kind;
    private final Box box;
    private final ResolvedStyle style;
    private final String text;

    public PositionedShape(@Nullable String id, String name, NodeKind kind, Box box, ResolvedStyle style,
                           @Nullable String text) {
        this.id = id;
        this.name = name;
        this.kind = kind;
        this.box = box;
        this.style = style;
        this.text = text;
    }

    @Nullable
    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public NodeKind getKind() {
        return kind;
    }

    public Box getBox() {
        return box;
    }

    public ResolvedStyle getStyle() {
        return style;
    }

    /**
     * @return content of a text node, null for other kinds
     */
    @Nullable
    public String getText() {
        return text;
    }

    public boolean isContainer() {
        return kind.isContainer();
    }

    @Override
    public String toString() {
        return kind.getName() + " " + name + " " + box;
    }
}
