package com.nei10u.taxmusr.domain;

import com.nei10u.taxmusr.assessment.CoupleInputSampler;
import com.nei10u.taxmusr.model.Recommendation;
import com.nei10u.taxmusr.model.StoryTemplate;
import com.nei10u.taxmusr.oracle.GenerationOracle;
import com.nei10u.taxmusr.oracle.GenerationSettings;
import com.nei10u.taxmusr.tree.ExpansionPolicy;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * 已婚夫妇选择合并申报还是单独申报。答案随机给定，由推理树为其编造支撑事实。
 */
public class JointAssessmentDomain extends AbstractTaxDomain {

    public static final String NAME = "joint_assessment";
    public static final int DEFAULT_MAX_DEPTH = 2;

    static final String QUESTION =
            "Should the couple opt for joint assessment or individual assessment to minimize their tax burden?";
    static final List<String> OPTIONS = List.of(Recommendation.JOINT.label(), Recommendation.INDIVIDUAL.label());

    private static final ExpansionPolicy POLICY = ExpansionPolicy.withForbiddenTerms(
            JointAssessmentPrompts.FACT_EXPANSION, JointAssessmentRules.FORBIDDEN_TERMS, JointAssessmentRules.TAX_RULES);

    public JointAssessmentDomain(int maxDepth, Random random, GenerationOracle oracle, GenerationSettings settings) {
        super(maxDepth, random, oracle, settings);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Joint assessment tax cases involving married couples.";
    }

    @Override
    public List<String> options() {
        return OPTIONS;
    }

    @Override
    public StoryTemplate constructTemplate() {
        String answer = random.nextDouble() < 0.3 ? Recommendation.INDIVIDUAL.label() : Recommendation.JOINT.label();
        List<String> goldFacts = new ArrayList<>();
        if (Recommendation.JOINT.label().equals(answer)) {
            goldFacts.add("The couple is eligible for joint assessment and should opt for it to minimize their tax burden.");
        } else if (random.nextBoolean()) {
            goldFacts.add("The couple is not eligible for joint assessment and must file individual assessments.");
        } else {
            goldFacts.add("The couple is eligible for joint assessment, but should opt for individual assessment to minimize their tax burden.");
        }
        // 多样性事实只丰富故事，不影响结论
        List<String> diversityFacts = new ArrayList<>();
        diversityFacts.add(childrenFact(CoupleInputSampler.sampleChildren(random)));

        return StoryTemplate.builder()
                .goldFacts(goldFacts)
                .diversityFacts(diversityFacts)
                .question(QUESTION)
                .answer(answer)
                .build();
    }

    /**
     * 只以第一条金标准事实作为根结论。
     */
    @Override
    protected String conclusion(StoryTemplate template) {
        return template.getGoldFacts().get(0);
    }

    @Override
    protected List<String> seedFacts(StoryTemplate template) {
        return template.getDiversityFacts();
    }

    @Override
    protected ExpansionPolicy expansionPolicy() {
        return POLICY;
    }

    @Override
    protected String narrativeTemplate() {
        return JointAssessmentPrompts.NARRATIVE;
    }
}
