package com.nei10u.taxmusr.domain;

import com.nei10u.taxmusr.model.StoryTemplate;
import com.nei10u.taxmusr.oracle.GenerationSettings;
import com.nei10u.taxmusr.support.ScriptedOracle;
import com.nei10u.taxmusr.tree.NodeKind;
import com.nei10u.taxmusr.tree.ReasoningNode;
import com.nei10u.taxmusr.tree.ReasoningTree;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JointAssessmentDomainTest {

    private JointAssessmentDomain domain(ScriptedOracle oracle, long seed) {
        return new JointAssessmentDomain(JointAssessmentDomain.DEFAULT_MAX_DEPTH, new Random(seed),
                oracle, GenerationSettings.defaults());
    }

    @Test
    void roughlyThirtyPercentOfAnswersAreIndividual() {
        JointAssessmentDomain domain = domain(ScriptedOracle.silent(), 42);
        int individual = 0;
        for (int i = 0; i < 1000; i++) {
            StoryTemplate template = domain.constructTemplate();
            assertTrue(domain.options().contains(template.getAnswer()));
            if ("individual".equals(template.getAnswer())) {
                individual++;
                assertTrue(template.getGoldFacts().get(0).contains("individual assessment"));
            } else {
                assertTrue(template.getGoldFacts().get(0).contains("should opt for it"));
            }
            assertTrue(template.getDiversityFacts().get(0).startsWith("The couple has "));
        }
        assertTrue(individual > 230 && individual < 370, "individual answers: " + individual);
    }

    @Test
    void rootIsTheFirstGoldFactAndStoryFactsAreDeduplicatedForTheNarrative() {
        ScriptedOracle oracle = new ScriptedOracle(call -> {
            if (call.isNarrative()) {
                return "We got married last spring.";
            }
            return "Story Fact: They married in 2019.\nStory Fact: They married in 2019.\n"
                    + "Story Fact: Joint Assessment saves them money.";
        });
        JointAssessmentDomain domain = new JointAssessmentDomain(0, new Random(1), oracle, GenerationSettings.defaults());
        StoryTemplate template = domain.constructTemplate();

        ReasoningTree tree = domain.completeReasoningTree(template);
        String narrative = domain.generateStory(tree);

        assertEquals(template.getGoldFacts().get(0), tree.getRoot().getStatement());
        List<ReasoningNode> children = tree.getRoot().getChildren();
        assertEquals(template.getDiversityFacts().get(0), children.get(0).getStatement());
        // 含禁用词的事实降级为 deduced fact
        assertEquals(NodeKind.DEDUCED_FACT, children.get(3).getKind());
        assertEquals("We got married last spring.", narrative);

        ScriptedOracle.Call narrativeCall = oracle.calls().get(oracle.calls().size() - 1);
        assertEquals(JointAssessmentPrompts.NARRATIVE, narrativeCall.template());
        assertEquals("- " + template.getDiversityFacts().get(0) + "\n- They married in 2019.",
                narrativeCall.variable("facts_list"));
    }
}
