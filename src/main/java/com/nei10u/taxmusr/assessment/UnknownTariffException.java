package com.nei10u.taxmusr.assessment;

import java.util.Set;

public class UnknownTariffException extends IllegalArgumentException {

    public UnknownTariffException(String version, Set<String> known) {
        super("未知的税率表版本: " + version + "，可用版本: " + known);
    }
}
