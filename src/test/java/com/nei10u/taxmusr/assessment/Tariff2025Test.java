package com.nei10u.taxmusr.assessment;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class Tariff2025Test {

    private final Tariff2025 tariff = new Tariff2025();

    @Test
    void zeroUpToBasicAllowance() {
        assertEquals(0, tariff.tax(0));
        assertEquals(0, tariff.tax(5000));
        assertEquals(0, tariff.tax(12096));
        assertEquals(0, tariff.tax(12096.99)); // floored before lookup
    }

    @Test
    void negativeIncomeIsClampedToZero() {
        assertEquals(0, tariff.tax(-25000));
    }

    @Test
    void matchesStatutoryTableInEveryZone() {
        assertEquals(485, tariff.tax(15000));
        assertEquals(1015, tariff.tax(17443));
        assertEquals(1015, tariff.tax(17444));
        assertEquals(4303, tariff.tax(30000));
        assertEquals(17849, tariff.tax(68480));
        assertEquals(17850, tariff.tax(68481));
        assertEquals(31088, tariff.tax(100000));
        assertEquals(105774, tariff.tax(277825));
        assertEquals(115753, tariff.tax(300000));
    }

    @Test
    void fractionalIncomeIsFlooredFirst() {
        assertEquals(tariff.tax(30000), tariff.tax(30000.99));
    }

    @Test
    void liabilityIsNonDecreasingAboveBasicAllowance() {
        long previous = tariff.tax(12097);
        for (int income = 12098; income <= 400_000; income += 37) {
            long current = tariff.tax(income);
            assertTrue(current >= previous, "tax decreased at " + income);
            previous = current;
        }
    }

    @Test
    void registryResolvesKnownVersionAndRejectsUnknown() {
        TaxTariffRegistry registry = new TaxTariffRegistry();
        assertEquals("2025", registry.resolve("2025").version());
        UnknownTariffException error = assertThrows(
                UnknownTariffException.class, () -> registry.resolve("1999"));
        assertTrue(error.getMessage().contains("1999"));
        assertTrue(error.getMessage().contains("2025"));
    }
}
