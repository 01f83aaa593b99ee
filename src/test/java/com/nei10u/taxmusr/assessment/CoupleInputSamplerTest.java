package com.nei10u.taxmusr.assessment;

import com.nei10u.taxmusr.model.CoupleInput;
import org.junit.jupiter.api.Test;

import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CoupleInputSamplerTest {

    @Test
    void samplesStayWithinPlausibleRanges() {
        CoupleInputSampler sampler = new CoupleInputSampler(new Random(42));
        for (int i = 0; i < 1000; i++) {
            CoupleInput couple = sampler.sample();
            assertTrue(couple.a().income() >= 0);
            assertTrue(couple.b().income() >= 0);
            assertTrue(Set.of(0.0, 10800.0, 21600.0).contains(couple.a().wageReplacement()));
            assertEquals(0.0, couple.b().wageReplacement());
            assertTrue(couple.a().medicalCosts() >= 0);
            assertTrue(couple.churchTaxRate() == 0.09 || couple.churchTaxRate() == 0.08);
            assertTrue(couple.children() >= 0 && couple.children() <= 3);
            assertTrue(couple.married());
            assertTrue(couple.a().fullyLiableForTax() && couple.b().fullyLiableForTax());
            assertEquals(Math.floor(couple.a().income()), couple.a().income());
        }
    }

    @Test
    void sameSeedGivesSameSequence() {
        CoupleInputSampler first = new CoupleInputSampler(new Random(3));
        CoupleInputSampler second = new CoupleInputSampler(new Random(3));
        for (int i = 0; i < 20; i++) {
            assertEquals(first.sample(), second.sample());
        }
    }

    @Test
    void childrenFollowAllFourOutcomes() {
        Random random = new Random(11);
        int[] counts = new int[4];
        for (int i = 0; i < 4000; i++) {
            counts[CoupleInputSampler.sampleChildren(random)]++;
        }
        for (int count : counts) {
            assertTrue(count > 400);
        }
        // two children is the most likely outcome
        assertTrue(counts[2] > counts[0] && counts[2] > counts[1] && counts[2] > counts[3]);
    }
}
