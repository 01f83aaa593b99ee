package com.nei10u.taxmusr.tree;

import java.util.Objects;

public class ReasoningTree {

    private final ReasoningNode root;
    private boolean frozen;

    public ReasoningTree(ReasoningNode root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    public ReasoningNode getRoot() {
        return root;
    }

    /**
     * 构建完成后调用，之后任何节点都不能再追加子节点。
     */
    public ReasoningTree freeze() {
        root.freeze();
        frozen = true;
        return this;
    }

    public boolean frozen() {
        return frozen;
    }
}
