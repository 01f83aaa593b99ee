package com.nei10u.taxmusr.assessment;

/**
 * 单一申报方式下的税额明细。
 *
 * @param incomeTax           所得税（已应用累进税率保留）
 * @param levyA               A 的教会税
 * @param levyB               B 的教会税
 * @param specialLevyPartner  被特别教会税覆盖的一方，没有则为 null
 * @param total               保留两位小数的总额
 */
public record FilingBreakdown(double incomeTax,
                              double levyA,
                              double levyB,
                              Partner specialLevyPartner,
                              double total) {

    public boolean specialLevyApplied() {
        return specialLevyPartner != null;
    }
}
