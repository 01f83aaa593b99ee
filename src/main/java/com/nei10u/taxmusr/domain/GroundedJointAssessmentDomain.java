package com.nei10u.taxmusr.domain;

import com.nei10u.taxmusr.assessment.AssessmentComparator;
import com.nei10u.taxmusr.assessment.CoupleInputSampler;
import com.nei10u.taxmusr.model.AssessmentResult;
import com.nei10u.taxmusr.model.CoupleInput;
import com.nei10u.taxmusr.model.Person;
import com.nei10u.taxmusr.model.Recommendation;
import com.nei10u.taxmusr.model.StoryTemplate;
import com.nei10u.taxmusr.oracle.GenerationOracle;
import com.nei10u.taxmusr.oracle.GenerationSettings;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * 合并申报领域的 grounded 变体：先采样夫妻数据，用评估引擎算出答案，再由计算输入生成金标准事实。
 * 叙事因此与一次可复现的计算保持一致。
 */
public class GroundedJointAssessmentDomain extends JointAssessmentDomain {

    public static final String NAME = "grounded_joint_assessment";
    public static final int DEFAULT_MAX_DEPTH = 1;

    public static final String META_COUPLE = "couple_facts";
    public static final String META_ASSESSMENT = "assessment";

    static final List<String> JOBS = List.of("Software Engineer", "Teacher", "Doctor", "Graphic Designer", "Chef",
            "Mechanic", "Nurse", "Photographer", "Electrician", "Plumber", "Carpenter", "Secretary", "Writer",
            "Accountant", "Salesperson");

    static final String ELIGIBILITY_RULE = "Couples are eligible for joint assessment if married, both are fully "
            + "liable for tax in Germany and have lived together for at least one day of the assessment year.";

    private final CoupleInputSampler sampler;
    private final AssessmentComparator comparator;

    public GroundedJointAssessmentDomain(int maxDepth, Random random, GenerationOracle oracle,
                                         GenerationSettings settings, AssessmentComparator comparator) {
        this(maxDepth, random, oracle, settings, comparator, new CoupleInputSampler(random));
    }

    public GroundedJointAssessmentDomain(int maxDepth, Random random, GenerationOracle oracle,
                                         GenerationSettings settings, AssessmentComparator comparator,
                                         CoupleInputSampler sampler) {
        super(maxDepth, random, oracle, settings);
        this.comparator = comparator;
        this.sampler = sampler;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Joint assessment cases whose answer is computed from sampled couple finances.";
    }

    @Override
    public StoryTemplate constructTemplate() {
        return templateFor(sampler.sample());
    }

    StoryTemplate templateFor(CoupleInput couple) {
        AssessmentResult result = comparator.compare(couple);
        // 不满足合并申报条件时答案只能是单独申报
        String answer = couple.eligibleForJointAssessment()
                ? result.recommendation().label()
                : Recommendation.INDIVIDUAL.label();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(META_COUPLE, couple);
        metadata.put(META_ASSESSMENT, result);

        List<String> ruleSignals = new ArrayList<>();
        ruleSignals.add(ELIGIBILITY_RULE);

        return StoryTemplate.builder()
                .goldFacts(goldFacts(couple))
                .diversityFacts(diversityFacts(couple))
                .question(QUESTION)
                .answer(answer)
                .ruleSignals(ruleSignals)
                .metadata(metadata)
                .build();
    }

    @Override
    protected String conclusion(StoryTemplate template) {
        if (Recommendation.INDIVIDUAL.label().equals(template.getAnswer())) {
            return "The couple should file individual assessments.";
        }
        return "The couple should opt for joint assessment to minimize their tax burden.";
    }

    @Override
    protected List<String> seedFacts(StoryTemplate template) {
        List<String> facts = new ArrayList<>(template.getGoldFacts());
        facts.addAll(template.getDiversityFacts());
        return facts;
    }

    List<String> goldFacts(CoupleInput couple) {
        Person a = couple.a();
        Person b = couple.b();
        List<String> facts = new ArrayList<>();
        facts.add("Person A and Person B are " + (couple.married() ? "married" : "not married") + ".");
        facts.add(incomeFact("Person A", a));
        facts.add(incomeFact("Person B", b));
        if (!a.fullyLiableForTax()) {
            facts.add("Person A is not fully liable for tax in Germany.");
        }
        if (!b.fullyLiableForTax()) {
            facts.add("Person B is not fully liable for tax in Germany.");
        }
        if (couple.liveTogether()) {
            facts.add("The couple lived together at least for one day during the year.");
        } else {
            facts.add("The couple did not live together at any point during the year.");
        }
        if (a.wageReplacement() > 0) {
            facts.add("Person A received " + amount(a.wageReplacement()) + " euros in wage replacement benefits.");
        }
        if (b.wageReplacement() > 0) {
            facts.add("Person B received " + amount(b.wageReplacement()) + " euros in wage replacement benefits.");
        }
        if (a.medicalCosts() > 0) {
            facts.add("Person A paid " + amount(a.medicalCosts()) + " euros in medical costs out of pocket.");
        }
        if (b.medicalCosts() > 0) {
            facts.add("Person B paid " + amount(b.medicalCosts()) + " euros in medical costs out of pocket.");
        }
        if (a.churchMember() || b.churchMember()) {
            facts.add("The church tax rate is " + amount(couple.churchTaxRate() * 100) + " percent.");
            if (a.churchMember() && b.churchMember()) {
                facts.add("Both Person A and Person B are members of a church that requires church tax.");
            } else if (a.churchMember()) {
                facts.add("Only Person A is a member of a church that requires church tax.");
            } else {
                facts.add("Only Person B is a member of a church that requires church tax.");
            }
        }
        return facts;
    }

    private List<String> diversityFacts(CoupleInput couple) {
        List<String> facts = new ArrayList<>();
        facts.add(jobFact("Person A", couple.a()));
        facts.add(jobFact("Person B", couple.b()));
        facts.add(childrenFact(couple.children()));
        return facts;
    }

    private String incomeFact(String who, Person person) {
        if (person.income() > 0) {
            return who + " has a taxable income of " + amount(person.income()) + " euros.";
        }
        return who + " has no taxable income.";
    }

    private String jobFact(String who, Person person) {
        if (person.income() > 0) {
            return who + " is working as a " + JOBS.get(random.nextInt(JOBS.size())) + ".";
        }
        return who + " is currently unemployed.";
    }

    static String amount(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).stripTrailingZeros().toPlainString();
    }
}
