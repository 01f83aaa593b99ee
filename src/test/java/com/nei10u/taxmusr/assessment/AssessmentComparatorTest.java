package com.nei10u.taxmusr.assessment;

import com.nei10u.taxmusr.model.AssessmentResult;
import com.nei10u.taxmusr.model.CoupleInput;
import com.nei10u.taxmusr.model.Person;
import com.nei10u.taxmusr.model.Recommendation;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AssessmentComparatorTest {

    private final AssessmentComparator comparator =
            new AssessmentComparator(new AssessmentCalculator(new Tariff2025()));

    @Test
    void tieResolvesToJoint() {
        AssessmentResult result = comparator.compare(CoupleInput.of(Person.withIncome(0), Person.withIncome(0)));
        assertEquals(0.0, result.jointTotal());
        assertEquals(0.0, result.individualTotal());
        assertEquals(0.0, result.advantage());
        assertEquals(Recommendation.JOINT, result.recommendation());
    }

    @Test
    void highImbalanceFavoursJoint() {
        AssessmentResult result = comparator.compare(CoupleInput.of(Person.withIncome(95000), Person.withIncome(22000)));
        assertEquals(31132.0, result.individualTotal());
        assertEquals(27668.0, result.jointTotal());
        assertEquals(3464.0, result.advantage());
        assertEquals(Recommendation.JOINT, result.recommendation());
    }

    @Test
    void similarIncomesTieAndFavourJoint() {
        AssessmentResult result = comparator.compare(CoupleInput.of(Person.withIncome(72000), Person.withIncome(70000)));
        assertEquals(37816.0, result.individualTotal());
        assertEquals(37816.0, result.jointTotal());
        assertEquals(Recommendation.JOINT, result.recommendation());
    }

    @Test
    void transferIncomeCanMakeIndividualCheaper() {
        AssessmentResult result = comparator.compare(CoupleInput.of(
                Person.withIncome(20000).withWageReplacement(10800),
                Person.withIncome(20000)));
        assertEquals(4581.21, result.individualTotal());
        assertEquals(4777.95, result.jointTotal());
        assertEquals(-196.74, result.advantage());
        assertEquals(Recommendation.INDIVIDUAL, result.recommendation());
    }

    @Test
    void lowShareMemberStillFavoursJoint() {
        AssessmentResult result = comparator.compare(CoupleInput.of(
                Person.withIncome(95000),
                Person.withIncome(22000).withChurchMember(true)));
        assertEquals(31324.96, result.individualTotal());
        assertEquals(28364.0, result.jointTotal());
        assertEquals(2960.96, result.advantage());
    }
}
