package com.nei10u.taxmusr.domain;

import com.nei10u.taxmusr.assessment.AssessmentComparator;
import com.nei10u.taxmusr.oracle.GenerationOracle;
import com.nei10u.taxmusr.oracle.GenerationSettings;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Random;

/**
 * 按名称创建领域。maxDepth 为 null 时使用各领域的默认深度。
 */
@Component
public class TaxDomainFactory {

    public static final List<String> DOMAINS = List.of(
            JointAssessmentDomain.NAME, GroundedJointAssessmentDomain.NAME, HomeOfficeDeductionDomain.NAME);

    private final GenerationOracle oracle;
    private final GenerationSettings settings;
    private final AssessmentComparator comparator;
    private final Random random;

    @Autowired
    public TaxDomainFactory(GenerationOracle oracle, GenerationSettings settings, AssessmentComparator comparator) {
        this(oracle, settings, comparator, new Random());
    }

    public TaxDomainFactory(GenerationOracle oracle, GenerationSettings settings,
                            AssessmentComparator comparator, Random random) {
        this.oracle = oracle;
        this.settings = settings;
        this.comparator = comparator;
        this.random = random;
    }

    public TaxDomain create(String name, Integer maxDepth) {
        if (name == null) {
            throw new UnknownDomainException(null);
        }
        switch (name) {
            case JointAssessmentDomain.NAME:
                return new JointAssessmentDomain(depth(maxDepth, JointAssessmentDomain.DEFAULT_MAX_DEPTH),
                        random, oracle, settings);
            case GroundedJointAssessmentDomain.NAME:
                return new GroundedJointAssessmentDomain(depth(maxDepth, GroundedJointAssessmentDomain.DEFAULT_MAX_DEPTH),
                        random, oracle, settings, comparator);
            case HomeOfficeDeductionDomain.NAME:
                return new HomeOfficeDeductionDomain(depth(maxDepth, HomeOfficeDeductionDomain.DEFAULT_MAX_DEPTH),
                        random, oracle, settings);
            default:
                throw new UnknownDomainException(name);
        }
    }

    private int depth(Integer requested, int fallback) {
        return requested == null ? fallback : Math.max(0, requested);
    }
}
