package com.nei10u.taxmusr.tree;

import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * 每个领域的扩展策略：扩展 prompt、禁用词、规则语料，以及 story fact 的类型判定。
 *
 * @param storyFactKind 对 "Story Fact:" 行的文本给出最终节点类型
 */
public record ExpansionPolicy(String expansionTemplate,
                              List<String> forbiddenTerms,
                              List<String> ruleCorpus,
                              Function<String, NodeKind> storyFactKind) {

    public ExpansionPolicy {
        forbiddenTerms = List.copyOf(forbiddenTerms);
        ruleCorpus = List.copyOf(ruleCorpus);
    }

    /**
     * 默认判定：包含任一禁用词（忽略大小写）的 story fact 降级为 deduced fact，防止答案在错误层级泄露。
     */
    public static ExpansionPolicy withForbiddenTerms(String expansionTemplate,
                                                     List<String> forbiddenTerms,
                                                     List<String> ruleCorpus) {
        List<String> lowered = forbiddenTerms.stream().map(t -> t.toLowerCase(Locale.ROOT)).toList();
        Function<String, NodeKind> classifier = statement -> {
            String text = statement.toLowerCase(Locale.ROOT);
            return lowered.stream().anyMatch(text::contains) ? NodeKind.DEDUCED_FACT : NodeKind.STORY_FACT;
        };
        return new ExpansionPolicy(expansionTemplate, forbiddenTerms, ruleCorpus, classifier);
    }

    public NodeKind classifyStoryFact(String statement) {
        return storyFactKind.apply(statement);
    }
}
