package com.nei10u.taxmusr.assessment;

/**
 * 特别教会税（besonderes Kirchgeld）阶梯表：按夫妻合计应税收入返回固定金额。
 * 仅在只有一方是教会成员且其收入占比很低时才参与计算，见 {@link AssessmentCalculator#joint}。
 */
public final class ChurchLevySchedule {

    private static final double[] UPPER_BOUNDS = {
            50000, 57500, 70000, 82500, 95000, 107500, 120000,
            145000, 170000, 195000, 220000, 270000, 320000
    };
    private static final double[] AMOUNTS = {
            0, 96, 156, 276, 396, 540, 696,
            840, 1200, 1560, 1860, 2220, 2940
    };
    private static final double TOP_AMOUNT = 3600;

    public double specialLevy(double combinedTaxableIncome) {
        double income = Math.max(0.0, combinedTaxableIncome);
        for (int i = 0; i < UPPER_BOUNDS.length; i++) {
            if (income < UPPER_BOUNDS[i]) {
                return AMOUNTS[i];
            }
        }
        return TOP_AMOUNT;
    }
}
