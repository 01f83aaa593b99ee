package com.nei10u.taxmusr.tree;

import com.alibaba.fastjson2.annotation.JSONField;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 推理树节点。子节点只追加不移动，因此整体必然是树。
 */
public class ReasoningNode {

    private final String statement;
    private final NodeKind kind;
    private final List<ReasoningNode> children = new ArrayList<>();
    private boolean frozen;

    public ReasoningNode(String statement, NodeKind kind) {
        this.statement = Objects.requireNonNull(statement, "statement");
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public static ReasoningNode storyFact(String statement) {
        return new ReasoningNode(statement, NodeKind.STORY_FACT);
    }

    public static ReasoningNode deducedFact(String statement) {
        return new ReasoningNode(statement, NodeKind.DEDUCED_FACT);
    }

    public String getStatement() {
        return statement;
    }

    @JSONField(name = "node_type")
    public NodeKind getKind() {
        return kind;
    }

    public List<ReasoningNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public ReasoningNode appendChild(ReasoningNode child) {
        if (frozen) {
            throw new IllegalStateException("推理树已冻结，不能再追加节点: " + statement);
        }
        children.add(Objects.requireNonNull(child, "child"));
        return child;
    }

    void freeze() {
        frozen = true;
        for (ReasoningNode child : children) {
            child.freeze();
        }
    }
}
