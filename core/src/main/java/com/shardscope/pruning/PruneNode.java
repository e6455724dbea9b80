package com.shardscope.pruning;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable node of the boolean tree the pruner reasons over.
 *
 * <p>A node is a conjunction or disjunction of child nodes and leaf
 * {@link ConditionSlot}s. Normalization rewrites the tree into an OR whose
 * children are ANDs of leaves; each pass returns a new tree.
 */
public final class PruneNode {

    /**
     * Boolean operator of a node.
     */
    public enum BoolOp {
        AND,
        OR
    }

    private final BoolOp op;
    private final List<PruneNode> children;
    private final List<ConditionSlot> conditions;

    public PruneNode(BoolOp op, List<PruneNode> children, List<ConditionSlot> conditions) {
        this.op = Objects.requireNonNull(op, "op must not be null");
        this.children = Collections.unmodifiableList(new ArrayList<>(
            Objects.requireNonNull(children, "children must not be null")));
        this.conditions = Collections.unmodifiableList(new ArrayList<>(
            Objects.requireNonNull(conditions, "conditions must not be null")));
    }

    public BoolOp op() {
        return op;
    }

    public boolean isAnd() {
        return op == BoolOp.AND;
    }

    public boolean isOr() {
        return op == BoolOp.OR;
    }

    public List<PruneNode> children() {
        return children;
    }

    public List<ConditionSlot> conditions() {
        return conditions;
    }

    /**
     * Returns the number of children plus conditions.
     *
     * @return the node's size
     */
    public int size() {
        return children.size() + conditions.size();
    }

    public boolean isEmpty() {
        return children.isEmpty() && conditions.isEmpty();
    }

    /**
     * Renders the tree, one node or leaf per line, for pruning traces.
     *
     * @return the indented tree
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        format(sb, 0);
        return sb.toString();
    }

    private void format(StringBuilder sb, int depth) {
        String indent = "  ".repeat(depth);
        sb.append(indent).append(op).append('\n');
        for (ConditionSlot condition : conditions) {
            sb.append(indent).append("  ").append(condition).append('\n');
        }
        for (PruneNode child : children) {
            child.format(sb, depth + 1);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PruneNode)) return false;
        PruneNode that = (PruneNode) obj;
        return op == that.op &&
               children.equals(that.children) &&
               conditions.equals(that.conditions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(op, children, conditions);
    }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>();
        conditions.forEach(condition -> parts.add(condition.toString()));
        children.forEach(child -> parts.add(child.toString()));
        return op + "(" + String.join(", ", parts) + ")";
    }

    // ==================== Factory Methods ====================

    public static PruneNode and(List<PruneNode> children, List<ConditionSlot> conditions) {
        return new PruneNode(BoolOp.AND, children, conditions);
    }

    public static PruneNode or(List<PruneNode> children) {
        return new PruneNode(BoolOp.OR, children, List.of());
    }

    /**
     * Creates an AND node holding only leaves, i.e. one branch of a
     * normalized tree.
     */
    public static PruneNode branch(List<ConditionSlot> conditions) {
        return new PruneNode(BoolOp.AND, List.of(), conditions);
    }
}
