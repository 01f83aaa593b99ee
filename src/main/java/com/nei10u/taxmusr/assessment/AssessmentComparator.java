package com.nei10u.taxmusr.assessment;

import com.nei10u.taxmusr.model.AssessmentResult;
import com.nei10u.taxmusr.model.CoupleInput;
import com.nei10u.taxmusr.model.Recommendation;
import org.springframework.stereotype.Service;

/**
 * 比较两种申报方式，给出推荐。税额相同时推荐合并申报。
 */
@Service
public class AssessmentComparator {

    private final AssessmentCalculator calculator;

    public AssessmentComparator(AssessmentCalculator calculator) {
        this.calculator = calculator;
    }

    public AssessmentResult compare(CoupleInput couple) {
        double jointTotal = calculator.jointTotal(couple);
        double individualTotal = calculator.individualTotal(couple);

        double advantage = AssessmentCalculator.round2(individualTotal - jointTotal);
        Recommendation recommendation;
        if (jointTotal < individualTotal) {
            recommendation = Recommendation.JOINT;
        } else if (individualTotal < jointTotal) {
            recommendation = Recommendation.INDIVIDUAL;
        } else {
            recommendation = Recommendation.JOINT;
        }
        return new AssessmentResult(individualTotal, jointTotal, advantage, recommendation);
    }
}
