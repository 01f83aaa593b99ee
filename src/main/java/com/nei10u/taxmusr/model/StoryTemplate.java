package com.nei10u.taxmusr.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 阶段一产物：金标准事实、多样性事实、问题与答案。
 */
@Data
@Builder
public class StoryTemplate {
    private List<String> goldFacts;
    private List<String> diversityFacts;
    private String question;
    private String answer;

    // 可选：提示推理时应触发的规则
    @Builder.Default
    private List<String> ruleSignals = new ArrayList<>();

    // 例如 grounded 模式下用于计算答案的 CoupleInput
    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();
}
