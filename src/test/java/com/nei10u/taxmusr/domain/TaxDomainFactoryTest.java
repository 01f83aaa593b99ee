package com.nei10u.taxmusr.domain;

import com.nei10u.taxmusr.assessment.AssessmentCalculator;
import com.nei10u.taxmusr.assessment.AssessmentComparator;
import com.nei10u.taxmusr.assessment.Tariff2025;
import com.nei10u.taxmusr.oracle.GenerationSettings;
import com.nei10u.taxmusr.support.ScriptedOracle;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TaxDomainFactoryTest {

    private final TaxDomainFactory factory = new TaxDomainFactory(ScriptedOracle.silent(), GenerationSettings.defaults(),
            new AssessmentComparator(new AssessmentCalculator(new Tariff2025())), new Random(3));

    @Test
    void createsEveryRegisteredDomainWithItsDefaultDepth() {
        assertEquals(2, depthOf(factory.create("joint_assessment", null)));
        assertEquals(1, depthOf(factory.create("grounded_joint_assessment", null)));
        assertEquals(1, depthOf(factory.create("home_office_deduction", null)));
        for (String name : TaxDomainFactory.DOMAINS) {
            assertEquals(name, factory.create(name, null).name());
        }
    }

    @Test
    void explicitDepthOverridesTheDefault() {
        assertEquals(4, depthOf(factory.create("grounded_joint_assessment", 4)));
        assertEquals(0, depthOf(factory.create("joint_assessment", -1)));
    }

    @Test
    void homeOfficeOffersItsOwnOptions() {
        TaxDomain domain = factory.create("home_office_deduction", null);
        assertEquals(List.of("pro-rata", "flatrate"), domain.options());
        assertEquals(2, domain.constructTemplate().getDiversityFacts().size());
    }

    @Test
    void unknownNameIsAConfigurationError() {
        assertThrows(UnknownDomainException.class, () -> factory.create("vat_refund", null));
        assertThrows(UnknownDomainException.class, () -> factory.create(null, null));
    }

    private int depthOf(TaxDomain domain) {
        return assertInstanceOf(AbstractTaxDomain.class, domain).maxDepth();
    }
}
