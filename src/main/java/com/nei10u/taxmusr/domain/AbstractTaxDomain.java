package com.nei10u.taxmusr.domain;

import com.nei10u.taxmusr.model.GeneratedCase;
import com.nei10u.taxmusr.model.StoryTemplate;
import com.nei10u.taxmusr.oracle.GenerationOracle;
import com.nei10u.taxmusr.oracle.GenerationSettings;
import com.nei10u.taxmusr.oracle.OracleResponse;
import com.nei10u.taxmusr.tree.ExpansionPolicy;
import com.nei10u.taxmusr.tree.ReasoningNode;
import com.nei10u.taxmusr.tree.ReasoningTree;
import com.nei10u.taxmusr.tree.ReasoningTreeBuilder;
import com.nei10u.taxmusr.tree.TreeFormatter;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * 各领域共用的推理树扩展、叙事生成与案例组装。子类只提供模板、根结论和领域策略。
 */
public abstract class AbstractTaxDomain implements TaxDomain {

    protected final int maxDepth;
    protected final Random random;
    private final GenerationOracle oracle;
    private final GenerationSettings settings;
    private final ReasoningTreeBuilder treeBuilder;

    protected AbstractTaxDomain(int maxDepth, Random random, GenerationOracle oracle, GenerationSettings settings) {
        this.maxDepth = maxDepth;
        this.random = random;
        this.oracle = oracle;
        this.settings = settings;
        this.treeBuilder = new ReasoningTreeBuilder(oracle, settings);
    }

    public int maxDepth() {
        return maxDepth;
    }

    /**
     * 推理树根节点的结论（deduced fact）。
     */
    protected abstract String conclusion(StoryTemplate template);

    /**
     * 扩展前挂在根节点下的 story fact。
     */
    protected abstract List<String> seedFacts(StoryTemplate template);

    protected abstract ExpansionPolicy expansionPolicy();

    protected abstract String narrativeTemplate();

    @Override
    public ReasoningTree completeReasoningTree(StoryTemplate template) {
        ReasoningNode root = ReasoningNode.deducedFact(conclusion(template));
        for (String fact : seedFacts(template)) {
            root.appendChild(ReasoningNode.storyFact(fact));
        }
        ReasoningTree tree = new ReasoningTree(root);
        treeBuilder.expand(tree, maxDepth, expansionPolicy());
        // TODO: 扩展完成后做一次去重与一致性检查（目前重复或矛盾的事实原样保留）
        return tree.freeze();
    }

    @Override
    public String generateStory(ReasoningTree tree) {
        // 叙事中每个 story fact 只需出现一次
        Set<String> storyFacts = new LinkedHashSet<>(TreeFormatter.extractUnderlyingFacts(tree));
        Map<String, Object> variables = Map.of("facts_list", "- " + String.join("\n- ", storyFacts));

        OracleResponse response = oracle.generate(narrativeTemplate(), variables, settings);
        if (response.text() == null || response.text().isBlank()) {
            throw new EmptyNarrativeException(name());
        }
        return response.text();
    }

    @Override
    public GeneratedCase assembleCase(StoryTemplate template, ReasoningTree tree, String narrative) {
        return GeneratedCase.builder()
                .domain(name())
                .question(template.getQuestion())
                .answer(template.getAnswer())
                .options(options())
                .ruleSignals(TreeFormatter.extractRuleSignals(tree))
                .reasoningTrace(TreeFormatter.formatReasoningTrace(tree))
                .underlyingFacts(TreeFormatter.extractUnderlyingFacts(tree))
                .narrative(narrative)
                .reasoningTree(tree)
                .build();
    }

    protected static String childrenFact(int children) {
        if (children <= 0) {
            return "The couple has no children.";
        }
        return "The couple has " + children + " child" + (children > 1 ? "ren" : "") + ".";
    }
}
