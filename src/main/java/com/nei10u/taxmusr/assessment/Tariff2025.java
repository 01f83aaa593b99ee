package com.nei10u.taxmusr.assessment;

/**
 * 2025 年所得税基本税率表（EStG §32a）。
 * 系数必须与法定表格逐位一致。
 */
public final class Tariff2025 implements TaxTariff {

    public static final String VERSION = "2025";

    static final long BASIC_ALLOWANCE = 12096;
    static final long ZONE_2_END = 17443;
    static final long ZONE_3_END = 68480;
    static final long ZONE_4_END = 277825;

    @Override
    public String version() {
        return VERSION;
    }

    @Override
    public long tax(double taxableIncome) {
        double x = Math.floor(Math.max(0.0, taxableIncome));

        double tax;
        if (x <= BASIC_ALLOWANCE) {
            tax = 0.0;
        } else if (x <= ZONE_2_END) {
            // 超过基本免税额部分的万分之一
            double y = (x - BASIC_ALLOWANCE) / 10000.0;
            tax = (932.30 * y + 1400.0) * y;
        } else if (x <= ZONE_3_END) {
            double z = (x - ZONE_2_END) / 10000.0;
            tax = (176.64 * z + 2397.0) * z + 1015.13;
        } else if (x <= ZONE_4_END) {
            tax = 0.42 * x - 10911.92;
        } else {
            tax = 0.45 * x - 19246.67;
        }
        return (long) Math.floor(tax);
    }
}
