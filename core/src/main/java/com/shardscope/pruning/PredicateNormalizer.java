package com.shardscope.pruning;

import com.shardscope.expression.BinaryExpression;
import com.shardscope.expression.Expression;
import com.shardscope.runtime.PruningConfig;
import com.shardscope.runtime.PruningDiagnostics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Rewrites a list of implicitly ANDed predicates into an OR of ANDs over
 * classified leaves.
 *
 * <p>The rewrite runs four passes, each producing a new tree:
 * <ol>
 *   <li><b>build</b>: AND/OR expressions become nodes, runs of the same
 *       operator are flattened into one node, every other predicate becomes a
 *       leaf through the {@link ConstraintClassifier}</li>
 *   <li><b>pull-up</b>: nodes with a single child or condition are replaced
 *       by that content</li>
 *   <li><b>OR-flattening</b>: leaves directly under an OR are wrapped into
 *       single-leaf ANDs</li>
 *   <li><b>distribution</b>: ANDs are distributed over their OR children</li>
 * </ol>
 *
 * <p>The number of branches is bounded. A disjunction whose distribution
 * would exceed the bound is left out of the conjunction it belongs to, which
 * can only widen the set of rows the branches admit.
 */
public final class PredicateNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(PredicateNormalizer.class);

    private final ConstraintClassifier classifier;
    private final int maxBranches;

    public PredicateNormalizer(ConstraintClassifier classifier) {
        this(classifier, PruningConfig.DEFAULT_MAX_DISTRIBUTED_BRANCHES);
    }

    /**
     * Creates a normalizer.
     *
     * @param classifier classifies leaves
     * @param maxBranches bound on the number of AND-branches, normalized
     *        with {@link PruningConfig#normalizeMaxBranches(int)}
     */
    public PredicateNormalizer(ConstraintClassifier classifier, int maxBranches) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.maxBranches = PruningConfig.normalizeMaxBranches(maxBranches);
    }

    /**
     * Normalizes the predicates into an OR node whose children are AND nodes
     * holding only leaves.
     *
     * <p>The OR has no children when no restriction was found at all.
     *
     * @param predicates the predicates, implicitly ANDed
     * @return the normalized tree
     */
    public PruneNode normalize(List<Expression> predicates) {
        Objects.requireNonNull(predicates, "predicates must not be null");

        PruneNode tree = build(predicates);
        trace("built", tree);
        tree = pullUp(tree);
        trace("pulled up", tree);
        tree = flattenOr(tree);
        trace("flattened", tree);

        List<PruneNode> branches = new ArrayList<>();
        for (List<ConditionSlot> branch : distribute(tree)) {
            branches.add(PruneNode.branch(branch));
        }
        PruneNode normalized = PruneNode.or(branches);
        trace("distributed", normalized);
        return normalized;
    }

    // ==================== Build ====================

    /**
     * Builds the initial tree. The root is an AND of all predicates.
     *
     * @param predicates the predicates, implicitly ANDed
     * @return the tree
     */
    PruneNode build(List<Expression> predicates) {
        NodeBuilder root = new NodeBuilder(PruneNode.BoolOp.AND);
        for (Expression predicate : predicates) {
            add(root, Objects.requireNonNull(predicate, "predicate must not be null"));
        }
        return root.toNode();
    }

    private void add(NodeBuilder parent, Expression expression) {
        PruneNode.BoolOp op = boolOp(expression);
        if (op == null) {
            parent.conditions.add(classifier.classify(expression));
            return;
        }

        BinaryExpression binary = (BinaryExpression) expression;
        if (op == parent.op) {
            add(parent, binary.left());
            add(parent, binary.right());
        } else {
            NodeBuilder child = new NodeBuilder(op);
            add(child, binary.left());
            add(child, binary.right());
            parent.children.add(child);
        }
    }

    private static PruneNode.BoolOp boolOp(Expression expression) {
        if (expression instanceof BinaryExpression binary) {
            if (binary.operator() == BinaryExpression.Operator.AND) {
                return PruneNode.BoolOp.AND;
            }
            if (binary.operator() == BinaryExpression.Operator.OR) {
                return PruneNode.BoolOp.OR;
            }
        }
        return null;
    }

    // ==================== Pull-up ====================

    /**
     * Removes redundant nodes bottom-up. A child with a single child or
     * condition is replaced by that content; a child with the parent's
     * operator is merged into the parent.
     *
     * @param node the tree
     * @return the tree without redundant nodes
     */
    PruneNode pullUp(PruneNode node) {
        List<PruneNode> children = new ArrayList<>();
        List<ConditionSlot> conditions = new ArrayList<>(node.conditions());

        for (PruneNode original : node.children()) {
            PruneNode child = pullUp(original);
            if (child.size() == 1 && !child.conditions().isEmpty()) {
                conditions.add(child.conditions().get(0));
                continue;
            }
            if (child.size() == 1) {
                child = child.children().get(0);
            }
            if (child.op() == node.op()) {
                children.addAll(child.children());
                conditions.addAll(child.conditions());
            } else {
                children.add(child);
            }
        }

        PruneNode result = new PruneNode(node.op(), children, conditions);
        if (result.conditions().isEmpty() && result.children().size() == 1) {
            return result.children().get(0);
        }
        return result;
    }

    // ==================== OR-flattening ====================

    /**
     * Wraps every condition of an OR node into its own single-condition AND
     * child, so that OR nodes only have children.
     *
     * @param node the tree
     * @return the tree with condition-free OR nodes
     */
    PruneNode flattenOr(PruneNode node) {
        List<PruneNode> children = new ArrayList<>();
        if (node.isOr()) {
            for (ConditionSlot condition : node.conditions()) {
                children.add(PruneNode.branch(List.of(condition)));
            }
        }
        for (PruneNode child : node.children()) {
            children.add(flattenOr(child));
        }
        return node.isAnd() ? PruneNode.and(children, node.conditions()) : PruneNode.or(children);
    }

    // ==================== Distribution ====================

    /**
     * Converts a tree into its AND-branches.
     *
     * <p>An OR yields the concatenation of its children's branches. An AND
     * yields the cross product of its children's branches, each combined
     * with the AND's own conditions. An AND without any content yields no
     * branch.
     *
     * @param node the tree
     * @return the branches, each a list of leaves
     */
    List<List<ConditionSlot>> distribute(PruneNode node) {
        if (node.isOr()) {
            List<List<ConditionSlot>> branches = new ArrayList<>();
            for (PruneNode child : node.children()) {
                List<List<ConditionSlot>> childBranches = distribute(child);
                if (childBranches.isEmpty()) {
                    // unconstrained alternative, keep it as an empty branch
                    childBranches = List.of(List.of());
                }
                for (List<ConditionSlot> branch : childBranches) {
                    if (branches.size() >= maxBranches) {
                        logger.debug("Branch bound {} reached, disjunction is unconstrained", maxBranches);
                        return List.of(List.of());
                    }
                    branches.add(branch);
                }
            }
            return branches;
        }

        List<List<ConditionSlot>> combinations = new ArrayList<>();
        combinations.add(new ArrayList<>(node.conditions()));
        for (PruneNode child : node.children()) {
            List<List<ConditionSlot>> alternatives = distribute(child);
            if (alternatives.isEmpty()) {
                continue;
            }
            if ((long) combinations.size() * alternatives.size() > maxBranches) {
                logger.debug("Distributing {} over {} branches exceeds bound {}, conjunct dropped",
                    alternatives.size(), combinations.size(), maxBranches);
                continue;
            }
            List<List<ConditionSlot>> next = new ArrayList<>(combinations.size() * alternatives.size());
            for (List<ConditionSlot> combination : combinations) {
                for (List<ConditionSlot> alternative : alternatives) {
                    List<ConditionSlot> merged = new ArrayList<>(combination.size() + alternative.size());
                    merged.addAll(combination);
                    merged.addAll(alternative);
                    next.add(merged);
                }
            }
            combinations = next;
        }

        if (combinations.size() == 1 && combinations.get(0).isEmpty()) {
            return List.of();
        }
        return combinations;
    }

    private static void trace(String pass, PruneNode tree) {
        if (PruningDiagnostics.isLogShardPruning()) {
            logger.info("Prune tree {}:\n{}", pass, tree.format());
        }
    }

    /**
     * Mutable node used while building the initial tree.
     */
    private static final class NodeBuilder {
        private final PruneNode.BoolOp op;
        private final List<NodeBuilder> children = new ArrayList<>();
        private final List<ConditionSlot> conditions = new ArrayList<>();

        NodeBuilder(PruneNode.BoolOp op) {
            this.op = op;
        }

        PruneNode toNode() {
            List<PruneNode> nodes = new ArrayList<>(children.size());
            for (NodeBuilder child : children) {
                nodes.add(child.toNode());
            }
            return new PruneNode(op, nodes, conditions);
        }
    }
}
