package gr.imsi.athenarc.illustrator.model;

import java.util.List;

import com.google.common.collect.ImmutableList;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * {@code container contains a, b [padding: 10]}: an explicit containment relationship
 * between nodes that need not be parent and child in the tree.
 */
public final class ContainsSpec {

    private final String containerId;
    private final ImmutableList<String> memberIds;
    private final double padding;

    public ContainsSpec(String containerId, List<String> memberIds, double padding) {
        checkArgument(!memberIds.isEmpty(), "contains declaration for %s needs at least one member", containerId);
        checkArgument(padding >= 0, "contains padding must be non-negative, got %s", padding);
        this.containerId = checkNotNull(containerId, "containerId");
        this.memberIds = ImmutableList.copyOf(memberIds);
        this.padding = padding;
    }

    public String getContainerId() {
        return containerId;
    }

    public ImmutableList<String> getMemberIds() {
        return memberIds;
    }

    public double getPadding() {
        return padding;
    }

    @Override
    public String toString() {
        return containerId + " contains " + String.join(", ", memberIds)
                + (padding == 0 ? "" : " [padding: " + ConstraintExpression.format(padding) + "]");
    }
}
