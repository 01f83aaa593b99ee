package com.nei10u.taxmusr.service;

import com.alibaba.fastjson2.JSONObject;
import com.nei10u.taxmusr.model.WorkflowOutput;
import com.nei10u.taxmusr.oracle.GenerationSettings;
import com.nei10u.taxmusr.oracle.OracleResponse;
import com.nei10u.taxmusr.oracle.TokenUsage;
import com.nei10u.taxmusr.support.ScriptedOracle;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AnswerWorkflowTest {

    @Test
    void splitsAtTheFirstAnswerMarker() {
        TokenUsage usage = new TokenUsage(120, 30, 150);
        WorkflowOutput output = AnswerWorkflow.parse(new OracleResponse(
                "Incomes are imbalanced, so splitting helps.\nANSWER: joint\nANSWER: individual", usage));

        assertEquals("Incomes are imbalanced, so splitting helps.", output.reasoning());
        assertEquals("joint\nANSWER: individual", output.predictedAnswer());
        assertSame(usage, output.tokenUsage());
    }

    @Test
    void withoutMarkerTheWholeReplyIsBothAnswerAndReasoning() {
        WorkflowOutput output = AnswerWorkflow.parse(OracleResponse.of("  individual  "));
        assertEquals("individual", output.predictedAnswer());
        assertEquals("individual", output.reasoning());

        WorkflowOutput empty = AnswerWorkflow.parse(OracleResponse.of(null));
        assertEquals("", empty.predictedAnswer());
    }

    @Test
    void promptVariablesCarryOptionsCotAndFewShotExamples() {
        ScriptedOracle oracle = new ScriptedOracle(call -> "ANSWER: joint");
        JSONObject shot = new JSONObject()
                .fluentPut("narrative", "We both work.")
                .fluentPut("question", "Joint or not?")
                .fluentPut("answer", "joint");
        AnswerWorkflow workflow = new AnswerWorkflow(oracle, GenerationSettings.defaults(), true, 5, List.of(shot));

        JSONObject example = new JSONObject()
                .fluentPut("narrative", "My wife earns more.")
                .fluentPut("question", "Which assessment?")
                .fluentPut("options", List.of("joint", "individual"));
        WorkflowOutput output = workflow.run(example);

        assertEquals("joint", output.predictedAnswer());
        ScriptedOracle.Call call = oracle.calls().get(0);
        assertEquals(EvaluationPrompts.EVALUATION, call.template());
        assertEquals("joint, individual", call.variable("options"));
        assertEquals(EvaluationPrompts.COT_INSTRUCTION, call.variable("cot"));
        assertTrue(call.variable("examples").startsWith("Here are examples:\n\nSTORY:\nWe both work."));
        assertTrue(call.variable("examples").endsWith("\"ANSWER: joint\"."));
    }

    @Test
    void zeroShotWithoutCotLeavesBlocksEmpty() {
        ScriptedOracle oracle = new ScriptedOracle(call -> "ANSWER: flatrate");
        AnswerWorkflow workflow = new AnswerWorkflow(oracle, GenerationSettings.defaults(), false, 0, List.of());

        workflow.run(new JSONObject()
                .fluentPut("narrative", "I rent two rooms.")
                .fluentPut("question", "Which deduction?"));

        ScriptedOracle.Call call = oracle.calls().get(0);
        assertEquals("", call.variable("examples"));
        assertEquals("", call.variable("cot"));
        assertEquals("", call.variable("options"));
    }
}
