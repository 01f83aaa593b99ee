package com.nei10u.taxmusr.service;

import com.alibaba.fastjson2.JSONObject;
import com.nei10u.taxmusr.model.WorkflowOutput;
import com.nei10u.taxmusr.oracle.GenerationOracle;
import com.nei10u.taxmusr.oracle.GenerationSettings;
import com.nei10u.taxmusr.oracle.OracleResponse;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 让模型阅读叙事并回答问题（可选 chain-of-thought 与 few-shot）。
 */
public class AnswerWorkflow {

    static final String ANSWER_MARKER = "ANSWER:";

    private final GenerationOracle oracle;
    private final GenerationSettings settings;
    private final boolean cot;
    private final List<JSONObject> fewShotExamples;

    public AnswerWorkflow(GenerationOracle oracle, GenerationSettings settings, boolean cot,
                          int numExamples, List<JSONObject> fewShotExamples) {
        this.oracle = oracle;
        this.settings = settings;
        this.cot = cot;
        int limit = Math.max(0, Math.min(numExamples, fewShotExamples.size()));
        this.fewShotExamples = List.copyOf(fewShotExamples.subList(0, limit));
    }

    public WorkflowOutput run(JSONObject example) {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("narrative", example.getString("narrative"));
        variables.put("question", example.getString("question"));
        List<String> options = example.getList("options", String.class);
        variables.put("options", options == null ? "" : String.join(", ", options));
        variables.put("cot", cot ? EvaluationPrompts.COT_INSTRUCTION : "");
        variables.put("examples", examplesBlock());

        OracleResponse response = oracle.generate(EvaluationPrompts.EVALUATION, variables, settings);
        return parse(response);
    }

    private String examplesBlock() {
        if (fewShotExamples.isEmpty()) {
            return "";
        }
        List<String> blocks = new ArrayList<>();
        for (JSONObject ex : fewShotExamples) {
            blocks.add("STORY:\n" + ex.getString("narrative") + "\n\nQUESTION:\n" + ex.getString("question")
                    + "\n\n\"ANSWER: " + ex.getString("answer") + "\".");
        }
        return "Here are examples:\n\n" + String.join("\n", blocks);
    }

    /**
     * 以第一个 "ANSWER:" 为分界：之前是推理过程，之后是最终答案。没有标记时整段文本同时作为两者。
     */
    static WorkflowOutput parse(OracleResponse response) {
        String content = response.text() == null ? "" : response.text().strip();
        int marker = content.indexOf(ANSWER_MARKER);
        if (marker < 0) {
            return new WorkflowOutput(content, content, response.usage());
        }
        String reasoning = content.substring(0, marker).strip();
        String answer = content.substring(marker + ANSWER_MARKER.length()).strip();
        return new WorkflowOutput(answer, reasoning, response.usage());
    }
}
