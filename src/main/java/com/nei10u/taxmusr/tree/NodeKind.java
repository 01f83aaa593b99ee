package com.nei10u.taxmusr.tree;

/**
 * 推理树节点类型：
 * - STORY_FACT 叙事中直接出现的细节
 * - RULE_FACT 解释推理的抽象规则（叶子）
 * - DEDUCED_FACT 中间结论，不应原样出现在叙事中
 */
public enum NodeKind {
    STORY_FACT("story_fact"),
    RULE_FACT("rule_fact"),
    DEDUCED_FACT("deduced_fact");

    private final String label;

    NodeKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
