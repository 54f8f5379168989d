package gr.imsi.athenarc.illustrator.domain;

/**
 * One of the four sides of a box. A route leaves or enters a node through a side.
 */
public enum Side {
    TOP,
    BOTTOM,
    LEFT,
    RIGHT;

    /**
     * @return true when a route through this side travels along the x axis
     */
    public boolean isHorizontal() {
        return this == LEFT || this == RIGHT;
    }

    public Anchor toAnchor() {
        switch (this) {
            case TOP:
                return Anchor.TOP;
            case BOTTOM:
                return Anchor.BOTTOM;
            case LEFT:
                return Anchor.LEFT;
            default:
                return Anchor.RIGHT;
        }
    }

    public Side opposite() {
        switch (this) {
            case TOP:
                return BOTTOM;
            case BOTTOM:
                return TOP;
            case LEFT:
                return RIGHT;
            default:
                return LEFT;
        }
    }
}
