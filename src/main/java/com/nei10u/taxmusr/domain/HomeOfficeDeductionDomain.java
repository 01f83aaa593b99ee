package com.nei10u.taxmusr.domain;

import com.nei10u.taxmusr.model.StoryTemplate;
import com.nei10u.taxmusr.oracle.GenerationOracle;
import com.nei10u.taxmusr.oracle.GenerationSettings;
import com.nei10u.taxmusr.tree.ExpansionPolicy;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * 居家办公：按比例扣除实际费用，还是只能申请年度定额。
 */
public class HomeOfficeDeductionDomain extends AbstractTaxDomain {

    public static final String NAME = "home_office_deduction";
    public static final int DEFAULT_MAX_DEPTH = 1;

    static final String PRO_RATA = "pro-rata";
    static final String FLATRATE = "flatrate";
    static final String QUESTION =
            "Can the narrator deduct the pro-rata costs for the home office or should they claim the flatrate?";

    static final List<String> JOBS = List.of("Software Engineer", "Teacher", "Graphic Designer", "Photographer",
            "Interpreter", "Professor", "Secretary", "Writer", "Accountant", "Salesperson");

    // 该领域没有禁用词
    private static final ExpansionPolicy POLICY = ExpansionPolicy.withForbiddenTerms(
            HomeOfficePrompts.FACT_EXPANSION, List.of(), HomeOfficeRules.TAX_RULES);

    public HomeOfficeDeductionDomain(int maxDepth, Random random, GenerationOracle oracle, GenerationSettings settings) {
        super(maxDepth, random, oracle, settings);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Home office deduction tax cases.";
    }

    @Override
    public List<String> options() {
        return List.of(PRO_RATA, FLATRATE);
    }

    @Override
    public StoryTemplate constructTemplate() {
        String answer = random.nextDouble() > 0.3 ? FLATRATE : PRO_RATA;
        List<String> goldFacts = new ArrayList<>();
        if (PRO_RATA.equals(answer)) {
            goldFacts.add("The home office is eligible and the pro-rata costs can be deducted.");
        } else {
            goldFacts.add("The home office is not eligible, but the taxpayer can use the home office flatrate.");
        }
        int rooms = random.nextBoolean() ? 2 : 3;
        List<String> diversityFacts = new ArrayList<>();
        diversityFacts.add("The narrator works as a " + JOBS.get(random.nextInt(JOBS.size())) + ".");
        diversityFacts.add("The narrator lives in an apartment with " + rooms + " rooms.");

        return StoryTemplate.builder()
                .goldFacts(goldFacts)
                .diversityFacts(diversityFacts)
                .question(QUESTION)
                .answer(answer)
                .build();
    }

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
        return HomeOfficePrompts.NARRATIVE;
    }
}
