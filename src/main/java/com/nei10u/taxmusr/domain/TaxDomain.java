package com.nei10u.taxmusr.domain;

import com.nei10u.taxmusr.model.GeneratedCase;
import com.nei10u.taxmusr.model.StoryTemplate;
import com.nei10u.taxmusr.tree.ReasoningTree;

import java.util.List;

/**
 * 一个税法领域的案例生成流程：模板 -> 推理树 -> 叙事 -> 组装。
 */
public interface TaxDomain {

    String name();

    String description();

    List<String> options();

    /**
     * 阶段一：金标准事实与多样性事实。
     */
    StoryTemplate constructTemplate();

    /**
     * 阶段二：把事实扩展为完整推理树，返回时树已冻结。
     */
    ReasoningTree completeReasoningTree(StoryTemplate template);

    /**
     * 阶段三：把树上的 story fact 写成叙事。
     */
    String generateStory(ReasoningTree tree);

    GeneratedCase assembleCase(StoryTemplate template, ReasoningTree tree, String narrative);
}
