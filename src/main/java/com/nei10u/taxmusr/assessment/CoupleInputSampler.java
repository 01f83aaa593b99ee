package com.nei10u.taxmusr.assessment;

import com.nei10u.taxmusr.model.CoupleInput;
import com.nei10u.taxmusr.model.Person;

import java.util.List;
import java.util.Random;

/**
 * 随机生成合理的夫妻计税输入：一半收入悬殊，一半收入接近，再叠加高斯噪声。
 */
public class CoupleInputSampler {

    static final List<double[]> IMBALANCED = List.of(
            new double[]{58000, 0}, new double[]{60000, 6000}, new double[]{95000, 22000});
    static final List<double[]> SIMILAR = List.of(
            new double[]{72000, 70000}, new double[]{40000, 42000}, new double[]{55000, 53000});

    static final double INCOME_NOISE = 5000;
    static final double MEDICAL_NOISE = 300;
    static final int[] WAGE_REPLACEMENT_OPTIONS = {0, 10800, 21600};
    static final int[] MEDICAL_COST_OPTIONS = {500, 2000, 5000};
    static final double[] CHILDREN_WEIGHTS = {0.20, 0.24, 0.38, 0.18};

    private final Random random;

    public CoupleInputSampler(Random random) {
        this.random = random;
    }

    public CoupleInput sample() {
        double[] pair = random.nextDouble() < 0.5 ? pick(IMBALANCED) : pick(SIMILAR);
        int incomeA = Math.max(0, (int) gauss(pair[0], INCOME_NOISE));
        int incomeB = Math.max(0, (int) gauss(pair[1], INCOME_NOISE));

        boolean churchA = random.nextDouble() < 0.3;
        boolean churchB = random.nextDouble() < 0.3;
        int wageReplacementA = WAGE_REPLACEMENT_OPTIONS[random.nextInt(WAGE_REPLACEMENT_OPTIONS.length)];
        int medicalA = sampleMedicalCosts();
        int medicalB = sampleMedicalCosts();
        // 8% 仅适用于巴伐利亚和巴符州
        double churchTaxRate = random.nextDouble() < 0.8 ? 0.09 : 0.08;

        Person a = new Person(incomeA, churchA, wageReplacementA, medicalA, true);
        Person b = new Person(incomeB, churchB, 0, medicalB, true);
        boolean liveTogether = random.nextDouble() < 0.9;
        return new CoupleInput(a, b, churchTaxRate, true, sampleChildren(random), liveTogether);
    }

    /**
     * 子女数量 0..3，权重与 grounded / 非 grounded 模板共用。
     */
    public static int sampleChildren(Random random) {
        double roll = random.nextDouble();
        double cumulative = 0;
        for (int i = 0; i < CHILDREN_WEIGHTS.length; i++) {
            cumulative += CHILDREN_WEIGHTS[i];
            if (roll < cumulative) {
                return i;
            }
        }
        return CHILDREN_WEIGHTS.length - 1;
    }

    private int sampleMedicalCosts() {
        if (random.nextDouble() >= 0.3) {
            return 0;
        }
        int base = MEDICAL_COST_OPTIONS[random.nextInt(MEDICAL_COST_OPTIONS.length)];
        return Math.max(0, (int) gauss(base, MEDICAL_NOISE));
    }

    private double gauss(double mean, double sigma) {
        return mean + random.nextGaussian() * sigma;
    }

    private double[] pick(List<double[]> options) {
        return options.get(random.nextInt(options.size()));
    }
}
