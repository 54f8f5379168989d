package gr.imsi.athenarc.illustrator.layout;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;

import gr.imsi.athenarc.illustrator.error.LayoutException;

/**
 * Auxiliary index over a geometry tree, built once per render: nodes in pre-order,
 * parent of each node, and identifier lookup.
 */
public class NodeIndex {

    private final LayoutNode root;
    private final ImmutableList<LayoutNode> nodes;
    private final int[] parents;
    private final int[] subtreeEnds;
    private final ImmutableListMultimap<String, LayoutNode> byId;

    private NodeIndex(LayoutNode root, List<LayoutNode> nodes, int[] parents, int[] subtreeEnds,
                      ImmutableListMultimap<String, LayoutNode> byId) {
        this.root = root;
        this.nodes = ImmutableList.copyOf(nodes);
        this.parents = parents;
        this.subtreeEnds = subtreeEnds;
        this.byId = byId;
    }

    public static NodeIndex of(LayoutNode root) {
        List<LayoutNode> nodes = new ArrayList<>();
        collect(root, nodes);
        int[] parents = new int[nodes.size()];
        int[] ends = new int[nodes.size()];
        parents[root.getOrdinal()] = -1;
        ImmutableListMultimap.Builder<String, LayoutNode> byId = ImmutableListMultimap.builder();
        for (int i = 0; i < nodes.size(); i++) {
            LayoutNode node = nodes.get(i);
            if (node.getOrdinal() != i) {
                throw new IllegalStateException("Node ordinals are not in pre-order at " + node.getName());
            }
            for (LayoutNode child : node.getChildren()) {
                parents[child.getOrdinal()] = node.getOrdinal();
            }
            if (node.getId() != null) {
                byId.put(node.getId(), node);
            }
        }
        for (int i = nodes.size() - 1; i >= 0; i--) {
            LayoutNode node = nodes.get(i);
            List<LayoutNode> children = node.getChildren();
            ends[i] = children.isEmpty() ? i : ends[children.get(children.size() - 1).getOrdinal()];
        }
        return new NodeIndex(root, nodes, parents, ends, byId.build());
    }

    private static void collect(LayoutNode node, List<LayoutNode> out) {
        out.add(node);
        for (LayoutNode child : node.getChildren()) {
            collect(child, out);
        }
    }

    public LayoutNode getRoot() {
        return root;
    }

    /**
     * @return every node, parents before children, siblings in declaration order
     */
    public ImmutableList<LayoutNode> getNodes() {
        return nodes;
    }

    public Optional<LayoutNode> getParent(LayoutNode node) {
        int parent = parents[node.getOrdinal()];
        return parent < 0 ? Optional.empty() : Optional.of(nodes.get(parent));
    }

    /**
     * @return true when {@code ancestor} is {@code node} itself or one of its ancestors
     */
    public boolean isAncestorOrSelf(LayoutNode ancestor, LayoutNode node) {
        int a = ancestor.getOrdinal();
        int n = node.getOrdinal();
        return n >= a && n <= subtreeEnds[a];
    }

    public boolean isRelated(LayoutNode first, LayoutNode second) {
        return isAncestorOrSelf(first, second) || isAncestorOrSelf(second, first);
    }

    /**
     * Looks up a node by identifier.
     *
     * @throws LayoutException if the identifier is declared more than once
     */
    public Optional<LayoutNode> find(String id) {
        List<LayoutNode> matches = byId.get(id);
        if (matches.isEmpty()) {
            return Optional.empty();
        }
        if (matches.size() > 1) {
            throw LayoutException.ambiguous(id, matches.size());
        }
        return Optional.of(matches.get(0));
    }

    /**
     * Looks up a node referenced from a declaration of the given kind.
     *
     * @throws LayoutException if the identifier is unknown or ambiguous
     */
    public LayoutNode resolve(String id, String usage) {
        return find(id).orElseThrow(() -> LayoutException.unresolved(id, usage));
    }

    public int size() {
        return nodes.size();
    }
}
