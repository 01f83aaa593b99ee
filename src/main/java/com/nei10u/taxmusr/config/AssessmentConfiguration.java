package com.nei10u.taxmusr.config;

import com.nei10u.taxmusr.assessment.AssessmentCalculator;
import com.nei10u.taxmusr.assessment.TaxTariff;
import com.nei10u.taxmusr.assessment.TaxTariffRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AssessmentConfiguration {
    private static final Logger log = LoggerFactory.getLogger(AssessmentConfiguration.class);

    /**
     * 未知的税率表版本在启动时直接失败。
     */
    @Bean
    public AssessmentCalculator assessmentCalculator(TaxTariffRegistry registry,
                                                     @Value("${taxmusr.tariff.version:2025}") String version) {
        TaxTariff tariff = registry.resolve(version);
        log.info("using tax tariff {}", tariff.version());
        return new AssessmentCalculator(tariff);
    }
}
