package com.nei10u.taxmusr.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiConsumer;

/**
 * 对推理树的只读前序遍历（先节点，再从左到右的子节点）。三种输出的顺序保持一致。
 */
public final class TreeFormatter {

    private TreeFormatter() {
    }

    /**
     * 每个节点一行：两个空格 × 深度的缩进 + "statement (kind)"。
     */
    public static String formatReasoningTrace(ReasoningTree tree) {
        List<String> lines = new ArrayList<>();
        walk(tree.getRoot(), 0, (node, depth) ->
                lines.add("  ".repeat(depth) + node.getStatement() + " (" + node.getKind().label() + ")"));
        return String.join("\n", lines);
    }

    public static List<String> extractUnderlyingFacts(ReasoningTree tree) {
        return collect(tree, NodeKind.STORY_FACT);
    }

    public static List<String> extractRuleSignals(ReasoningTree tree) {
        return collect(tree, NodeKind.RULE_FACT);
    }

    private static List<String> collect(ReasoningTree tree, NodeKind kind) {
        List<String> statements = new ArrayList<>();
        walk(tree.getRoot(), 0, (node, depth) -> {
            if (node.getKind() == kind) {
                statements.add(node.getStatement());
            }
        });
        return statements;
    }

    private static void walk(ReasoningNode node, int depth, BiConsumer<ReasoningNode, Integer> visitor) {
        visitor.accept(node, depth);
        for (ReasoningNode child : node.getChildren()) {
            walk(child, depth + 1, visitor);
        }
    }
}
