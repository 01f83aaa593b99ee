package com.nei10u.taxmusr.assessment;

import com.nei10u.taxmusr.model.CoupleInput;
import com.nei10u.taxmusr.model.Person;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 单独申报 / 合并申报（Splitting）的税额计算。
 *
 * 计算顺序：
 * - 每人先扣除超过阈值的医疗费用
 * - 免税的工资替代收入只参与税率计算（累进保留），实际征税基数不含该部分
 * - 合并申报时再按收入比例分摊所得税，计算教会税及特别教会税
 */
public class AssessmentCalculator {

    static final double SPECIAL_LEVY_SHARE_LIMIT = 0.35;

    private final TaxTariff tariff;
    private final ChurchLevySchedule levySchedule;

    public AssessmentCalculator(TaxTariff tariff) {
        this(tariff, new ChurchLevySchedule());
    }

    public AssessmentCalculator(TaxTariff tariff, ChurchLevySchedule levySchedule) {
        this.tariff = tariff;
        this.levySchedule = levySchedule;
    }

    public double singleAssessment(double taxableIncome) {
        return tariff.tax(Math.max(0.0, taxableIncome));
    }

    /**
     * Splitting：合计收入减半计税，再乘以 2。
     */
    public double jointAssessment(double taxableIncome) {
        double half = Math.max(0.0, taxableIncome) / 2.0;
        return 2.0 * tariff.tax(half);
    }

    /**
     * 累进保留下的平均税率：把工资替代收入并入计税基数求得税率，该税率只作用于应税部分。
     */
    public double progressionRate(double taxableIncome, double wageReplacement, boolean joint) {
        double basePlus = Math.max(0.0, taxableIncome) + Math.max(0.0, wageReplacement);
        if (basePlus <= 0) {
            return 0.0;
        }
        double taxWithProgression = joint ? jointAssessment(basePlus) : singleAssessment(basePlus);
        return taxWithProgression / basePlus;
    }

    /**
     * 医疗费用只有超过收入相关的自负额（5% / 6% / 7%）的部分可以扣除。
     */
    public double taxableAfterMedical(Person person) {
        double income = Math.max(0.0, person.income());
        double medical = Math.max(0.0, person.medicalCosts());

        double threshold;
        if (income <= 15340) {
            threshold = 0.05 * income;
        } else if (income <= 51130) {
            threshold = 0.06 * income;
        } else {
            threshold = 0.07 * income;
        }

        double deductible = Math.max(0.0, medical - threshold);
        return Math.max(0.0, income - deductible);
    }

    public FilingBreakdown joint(CoupleInput couple) {
        double ta = taxableAfterMedical(couple.a());
        double tb = taxableAfterMedical(couple.b());
        double taxableTotal = ta + tb;

        double wrbTotal = Math.max(0.0, couple.a().wageReplacement()) + Math.max(0.0, couple.b().wageReplacement());

        double rate = progressionRate(taxableTotal, wrbTotal, true);
        double incomeTax = rate * taxableTotal;

        // 合计收入为 0 时两人占比都记为 0
        double shareA = taxableTotal > 0 ? ta / taxableTotal : 0.0;
        double shareB = taxableTotal > 0 ? tb / taxableTotal : 0.0;

        double levyA = couple.a().churchMember() ? incomeTax * shareA * couple.churchTaxRate() : 0.0;
        double levyB = couple.b().churchMember() ? incomeTax * shareB * couple.churchTaxRate() : 0.0;

        Partner specialLevyPartner = null;
        if (couple.a().churchMember() != couple.b().churchMember()) {
            if (couple.a().churchMember() && shareA < SPECIAL_LEVY_SHARE_LIMIT) {
                levyA = Math.max(levyA, levySchedule.specialLevy(taxableTotal));
                specialLevyPartner = Partner.A;
            } else if (couple.b().churchMember() && shareB < SPECIAL_LEVY_SHARE_LIMIT) {
                levyB = Math.max(levyB, levySchedule.specialLevy(taxableTotal));
                specialLevyPartner = Partner.B;
            }
        }

        return new FilingBreakdown(incomeTax, levyA, levyB, specialLevyPartner,
                round2(incomeTax + levyA + levyB));
    }

    public FilingBreakdown individual(CoupleInput couple) {
        double ta = taxableAfterMedical(couple.a());
        double baseA = progressionRate(ta, couple.a().wageReplacement(), false) * ta;
        double levyA = couple.a().churchMember() ? baseA * couple.churchTaxRate() : 0.0;

        double tb = taxableAfterMedical(couple.b());
        double baseB = progressionRate(tb, couple.b().wageReplacement(), false) * tb;
        double levyB = couple.b().churchMember() ? baseB * couple.churchTaxRate() : 0.0;

        return new FilingBreakdown(baseA + baseB, levyA, levyB, null,
                round2((baseA + levyA) + (baseB + levyB)));
    }

    public double jointTotal(CoupleInput couple) {
        return joint(couple).total();
    }

    public double individualTotal(CoupleInput couple) {
        return individual(couple).total();
    }

    /**
     * 两位小数，按 double 的精确二进制值做 HALF_EVEN。
     */
    static double round2(double value) {
        return new BigDecimal(value).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }
}
