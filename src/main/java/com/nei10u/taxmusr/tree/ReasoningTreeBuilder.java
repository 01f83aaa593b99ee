package com.nei10u.taxmusr.tree;

import com.nei10u.taxmusr.oracle.GenerationOracle;
import com.nei10u.taxmusr.oracle.GenerationSettings;
import com.nei10u.taxmusr.oracle.OracleResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 从根结论出发递归扩展推理树。
 *
 * 每次调用生成能力之前，都对整棵树重新做一次前序遍历收集已有的 story fact，
 * 包括刚刚在兄弟节点下扩展出来的内容，因此总代价是 O(n²)。不要换成增量缓存：
 * 传给模型的上下文必须与整棵树当前状态逐字节一致。
 *
 * 深度为 maxDepth + 1 的节点不再扩展。构建器不做去重和一致性校验。
 */
public class ReasoningTreeBuilder {
    private static final Logger log = LoggerFactory.getLogger(ReasoningTreeBuilder.class);

    static final String RULES_HEADER = "You can use the following rule set:\n";

    private final GenerationOracle oracle;
    private final GenerationSettings settings;
    private final ExpansionResponseParser parser = new ExpansionResponseParser();

    public ReasoningTreeBuilder(GenerationOracle oracle, GenerationSettings settings) {
        this.oracle = oracle;
        this.settings = settings;
    }

    public ReasoningTree expand(ReasoningTree tree, int maxDepth, ExpansionPolicy policy) {
        expandNode(tree, tree.getRoot(), 0, maxDepth, policy);
        return tree;
    }

    private void expandNode(ReasoningTree tree, ReasoningNode node, int depth, int maxDepth, ExpansionPolicy policy) {
        if (depth > maxDepth) {
            return;
        }
        List<String> storyFacts = TreeFormatter.extractUnderlyingFacts(tree);
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("fact", node.getStatement());
        variables.put("story_facts", bulletList(storyFacts));
        variables.put("rules", RULES_HEADER + bulletList(policy.ruleCorpus()));

        OracleResponse response = oracle.generate(policy.expansionTemplate(), variables, settings);
        List<ExpansionResponseParser.ExpansionLine> lines = parser.parse(response.text());
        log.debug("depth={} fact='{}' known={} parsed={}", depth, node.getStatement(), storyFacts.size(), lines.size());

        for (ExpansionResponseParser.ExpansionLine line : lines) {
            if (line.rule()) {
                node.appendChild(new ReasoningNode(line.statement(), NodeKind.RULE_FACT));
            } else {
                // deduced fact 同样继续扩展
                ReasoningNode child = node.appendChild(
                        new ReasoningNode(line.statement(), policy.classifyStoryFact(line.statement())));
                expandNode(tree, child, depth + 1, maxDepth, policy);
            }
        }
    }

    static String bulletList(List<String> items) {
        return items.stream().map(item -> "- " + item).collect(Collectors.joining("\n"));
    }
}
