package com.nei10u.taxmusr.service;

import com.nei10u.taxmusr.domain.TaxDomain;
import com.nei10u.taxmusr.model.GeneratedCase;
import com.nei10u.taxmusr.model.GenerationReport;
import com.nei10u.taxmusr.model.StoryTemplate;
import com.nei10u.taxmusr.tree.ReasoningTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.UUID;

/**
 * 逐个生成案例：模板 -> 推理树 -> 叙事 -> 组装 -> 追加写入。
 * 单个案例失败只跳过该案例，已写入的案例不受影响。
 */
@Service
public class CaseGenerator {
    private static final Logger log = LoggerFactory.getLogger(CaseGenerator.class);

    private final CaseStore caseStore;

    public CaseGenerator(CaseStore caseStore) {
        this.caseStore = caseStore;
    }

    public GenerationReport generate(TaxDomain domain, int numCases, Path outputDir) {
        int generated = 0;
        int skipped = 0;
        Path outputFile = caseStore.fileFor(outputDir, domain.name());
        log.info("[{}] {} ({} cases)", domain.name(), domain.description(), numCases);
        for (int i = 0; i < numCases; i++) {
            String caseId = domain.name() + "-" + UUID.randomUUID().toString().substring(0, 8);
            try {
                GeneratedCase generatedCase = generateOne(domain, caseId);
                caseStore.append(outputDir, generatedCase);
                generated++;
                log.info("[{}] case appended to {}", caseId, outputFile);
            } catch (RuntimeException e) {
                skipped++;
                log.warn("[{}] case skipped: {}", caseId, e.getMessage(), e);
            }
        }
        log.info("[{}] generated={} skipped={}", domain.name(), generated, skipped);
        return GenerationReport.builder()
                .domain(domain.name())
                .generated(generated)
                .skipped(skipped)
                .outputFile(outputFile.toString())
                .build();
    }

    GeneratedCase generateOne(TaxDomain domain, String caseId) {
        log.info("[{}] case start", caseId);
        StoryTemplate template = domain.constructTemplate();
        log.info("[{}] template built, answer={}", caseId, template.getAnswer());
        ReasoningTree tree = domain.completeReasoningTree(template);
        log.info("[{}] reasoning tree built", caseId);
        String narrative = domain.generateStory(tree);
        return domain.assembleCase(template, tree, narrative);
    }
}
