package com.nei10u.taxmusr.assessment;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 按版本号查找税率表。
 */
@Component
public class TaxTariffRegistry {

    private final Map<String, TaxTariff> tariffs;

    public TaxTariffRegistry() {
        Map<String, TaxTariff> known = new LinkedHashMap<>();
        register(known, new Tariff2025());
        this.tariffs = Collections.unmodifiableMap(known);
    }

    public TaxTariff resolve(String version) {
        TaxTariff tariff = version == null ? null : tariffs.get(version.trim());
        if (tariff == null) {
            throw new UnknownTariffException(version, versions());
        }
        return tariff;
    }

    public Set<String> versions() {
        return tariffs.keySet();
    }

    private static void register(Map<String, TaxTariff> target, TaxTariff tariff) {
        target.put(tariff.version(), tariff);
    }
}
