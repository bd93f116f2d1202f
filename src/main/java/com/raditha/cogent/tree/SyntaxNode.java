package com.raditha.cogent.tree;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * A node of the language-neutral syntax tree the analyzers work on.
 * <p>
 * Children are kept in source order, each tagged with the {@link Role} it plays in
 * this node. Parent links are set once when the parent is built and are only used
 * for upward lookups. Nodes compare by identity.
 */
public final class SyntaxNode {

    private final NodeKind kind;
    private final Location location;
    private final @Nullable String name;
    private final @Nullable String operator;
    private final @Nullable Object value;
    private final @Nullable BindingKind binding;
    private final Set<NodeFlag> flags;
    private final @Nullable String text;
    private final List<SyntaxNode> children;

    private @Nullable SyntaxNode parent;
    private @Nullable Role role;

    private SyntaxNode(Builder builder) {
        this.kind = builder.kind;
        this.location = builder.location;
        this.name = builder.name;
        this.operator = builder.operator;
        this.value = builder.value;
        this.binding = builder.binding;
        this.flags = builder.flags.isEmpty() ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(builder.flags));
        this.text = builder.text;
        this.children = List.copyOf(builder.children);
        for (int i = 0; i < children.size(); i++) {
            children.get(i).attach(this, builder.roles.get(i));
        }
    }

    public static Builder builder(NodeKind kind) {
        return new Builder(kind);
    }

    private void attach(SyntaxNode newParent, Role newRole) {
        if (parent != null) {
            throw new IllegalStateException(kind + " at " + location + " already has a parent");
        }
        this.parent = newParent;
        this.role = newRole;
    }

    public NodeKind kind() {
        return kind;
    }

    public boolean is(NodeKind expected) {
        return kind == expected;
    }

    public Location location() {
        return location;
    }

    /**
     * Identifier name, function name, label name or type name, depending on the kind.
     */
    public @Nullable String name() {
        return name;
    }

    /**
     * Operator text of assignment, logical, binary, unary and update nodes.
     */
    public @Nullable String operator() {
        return operator;
    }

    /**
     * Literal value for {@link NodeKind#LITERAL} nodes.
     */
    public @Nullable Object value() {
        return value;
    }

    public @Nullable BindingKind binding() {
        return binding;
    }

    public boolean hasFlag(NodeFlag flag) {
        return flags.contains(flag);
    }

    public @Nullable SyntaxNode parent() {
        return parent;
    }

    /**
     * Role this node plays in its parent, or null for a root.
     */
    public @Nullable Role role() {
        return role;
    }

    public List<SyntaxNode> children() {
        return children;
    }

    /**
     * First child playing the given role.
     */
    public @Nullable SyntaxNode child(Role wanted) {
        for (SyntaxNode child : children) {
            if (child.role == wanted) {
                return child;
            }
        }
        return null;
    }

    public List<SyntaxNode> children(Role wanted) {
        List<SyntaxNode> result = new ArrayList<>();
        for (SyntaxNode child : children) {
            if (child.role == wanted) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * Source text of this node as the tree provider saw it, or a structural rendering
     * when the provider supplied none.
     */
    public String text() {
        return text != null ? text : SyntaxTrees.render(this);
    }

    @Override
    public String toString() {
        return name != null ? kind + " '" + name + "' " + location : kind + " " + location;
    }

    /**
     * Assembles a node bottom-up. Children must be built before their parent.
     */
    public static final class Builder {
        private final NodeKind kind;
        private Location location = Location.ZERO;
        private @Nullable String name;
        private @Nullable String operator;
        private @Nullable Object value;
        private @Nullable BindingKind binding;
        private final Set<NodeFlag> flags = EnumSet.noneOf(NodeFlag.class);
        private @Nullable String text;
        private final List<SyntaxNode> children = new ArrayList<>();
        private final List<Role> roles = new ArrayList<>();

        private Builder(NodeKind kind) {
            this.kind = kind;
        }

        public Builder at(@Nullable Location location) {
            this.location = location != null ? location : Location.ZERO;
            return this;
        }

        public Builder at(int startLine, int endLine) {
            return at(Location.of(startLine, endLine));
        }

        public Builder name(@Nullable String name) {
            this.name = name;
            return this;
        }

        public Builder operator(@Nullable String operator) {
            this.operator = operator;
            return this;
        }

        public Builder value(@Nullable Object value) {
            this.value = value;
            return this;
        }

        public Builder binding(@Nullable BindingKind binding) {
            this.binding = binding;
            return this;
        }

        public Builder flag(NodeFlag flag) {
            flags.add(flag);
            return this;
        }

        public Builder flagIf(boolean condition, NodeFlag flag) {
            if (condition) {
                flags.add(flag);
            }
            return this;
        }

        public Builder text(@Nullable String text) {
            this.text = text;
            return this;
        }

        /**
         * Append a child. A null child is ignored so optional slots can be passed straight through.
         */
        public Builder child(Role role, @Nullable SyntaxNode child) {
            if (child != null) {
                children.add(child);
                roles.add(role);
            }
            return this;
        }

        public Builder children(Role role, List<SyntaxNode> nodes) {
            for (SyntaxNode node : nodes) {
                child(role, node);
            }
            return this;
        }

        public SyntaxNode build() {
            return new SyntaxNode(this);
        }
    }
}
