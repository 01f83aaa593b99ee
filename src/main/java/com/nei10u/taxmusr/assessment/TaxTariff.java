package com.nei10u.taxmusr.assessment;

/**
 * 累进税率表（按年度版本区分），把应税收入映射为整数税额。
 * 新年度的税率表只需新增实现并注册到 {@link TaxTariffRegistry}，已计算的案例不受影响。
 */
public interface TaxTariff {

    String version();

    /**
     * @param taxableIncome 应税收入，负数按 0 处理
     * @return 向下取整后的税额，非负
     */
    long tax(double taxableIncome);
}
