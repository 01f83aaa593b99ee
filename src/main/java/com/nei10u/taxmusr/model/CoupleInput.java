package com.nei10u.taxmusr.model;

/**
 * 一对伴侣的计税输入，每个案例由采样器生成一次，只被评估引擎消费。
 *
 * @param churchTaxRate 教会税率（0.09，巴伐利亚/巴符州为 0.08）
 * @param liveTogether  评估年度内是否至少共同居住过一天
 */
public record CoupleInput(Person a,
                          Person b,
                          double churchTaxRate,
                          boolean married,
                          int children,
                          boolean liveTogether) {

    public static CoupleInput of(Person a, Person b) {
        return new CoupleInput(a, b, 0.09, true, 0, true);
    }

    /**
     * 合并申报的法定前提：已婚、双方无限纳税义务、共同居住。
     */
    public boolean eligibleForJointAssessment() {
        return married && liveTogether && a.fullyLiableForTax() && b.fullyLiableForTax();
    }
}
