package com.nei10u.taxmusr.model;

import com.alibaba.fastjson2.PropertyNamingStrategy;
import com.alibaba.fastjson2.annotation.JSONType;
import com.nei10u.taxmusr.tree.ReasoningTree;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * 最终输出单元，序列化为 JSONL 中的一行（字段名为 snake_case）。
 */
@Data
@JSONType(naming = PropertyNamingStrategy.SnakeCase)
@Builder
public class GeneratedCase {
    private String domain;

    // 第一人称叙事
    private String narrative;

    private List<String> underlyingFacts;

    // 应当被触发的税法规则 / 启发式
    private List<String> ruleSignals;

    private String reasoningTrace;

    private String question;
    private String answer;
    private List<String> options;

    private ReasoningTree reasoningTree;
}
