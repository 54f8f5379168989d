package gr.imsi.athenarc.illustrator.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A node of the structural tree as handed over by the parser. Options are kept raw;
 * they are checked against the closed option set when the geometry tree is built.
 */
public final class NodeSpec {

    private final NodeKind kind;
    private final String id;
    private final ImmutableMap<String, Object> options;
    private final ImmutableList<NodeSpec> children;

    private NodeSpec(NodeKind kind, String id, Map<String, Object> options, List<NodeSpec> children) {
        this.kind = kind;
        this.id = id;
        this.options = ImmutableMap.copyOf(options);
        this.children = ImmutableList.copyOf(children);
    }

    public static Builder builder(@NotNull NodeKind kind) {
        return new Builder(kind);
    }

    public static NodeSpec shape(@NotNull NodeKind kind, @Nullable String id) {
        return builder(kind).id(id).build();
    }

    public NodeKind getKind() {
        return kind;
    }

    @Nullable
    public String getId() {
        return id;
    }

    public ImmutableMap<String, Object> getOptions() {
        return options;
    }

    public ImmutableList<NodeSpec> getChildren() {
        return children;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeSpec)) return false;
        NodeSpec that = (NodeSpec) o;
        return kind == that.kind && Objects.equals(id, that.id)
                && options.equals(that.options) && children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, id, options, children);
    }

    @Override
    public String toString() {
        return kind.getName() + (id == null ? "" : " " + id) + (options.isEmpty() ? "" : " " + options);
    }

    public static class Builder {
        private final NodeKind kind;
        private String id;
        private final Map<String, Object> options = new LinkedHashMap<>();
        private final ImmutableList.Builder<NodeSpec> children = ImmutableList.builder();

        private Builder(NodeKind kind) {
            this.kind = checkNotNull(kind, "kind");
        }

        public Builder id(@Nullable String id) {
            this.id = id;
            return this;
        }

        public Builder option(String key, Object value) {
            options.put(checkNotNull(key, "key"), checkNotNull(value, "value of option %s", key));
            return this;
        }

        public Builder options(Map<String, ?> values) {
            values.forEach(this::option);
            return this;
        }

        public Builder child(NodeSpec child) {
            checkArgument(kind.isContainer(), "%s nodes can not have children", kind.getName());
            children.add(child);
            return this;
        }

        public Builder children(NodeSpec... nodes) {
            for (NodeSpec node : nodes) {
                child(node);
            }
            return this;
        }

        public Builder children(List<NodeSpec> nodes) {
            nodes.forEach(this::child);
            return this;
        }

        public NodeSpec build() {
            return new NodeSpec(kind, id, options, children.build());
        }
    }
}
