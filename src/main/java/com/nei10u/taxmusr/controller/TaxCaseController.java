package com.nei10u.taxmusr.controller;

import com.nei10u.taxmusr.assessment.AssessmentComparator;
import com.nei10u.taxmusr.domain.TaxDomain;
import com.nei10u.taxmusr.domain.TaxDomainFactory;
import com.nei10u.taxmusr.model.AssessmentResult;
import com.nei10u.taxmusr.model.CoupleInput;
import com.nei10u.taxmusr.model.EvaluateRequest;
import com.nei10u.taxmusr.model.EvaluationReport;
import com.nei10u.taxmusr.model.GenerateRequest;
import com.nei10u.taxmusr.model.GenerationReport;
import com.nei10u.taxmusr.service.CaseGenerator;
import com.nei10u.taxmusr.service.EvaluationService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class TaxCaseController {

    private static final Logger log = LoggerFactory.getLogger(TaxCaseController.class);
    private final TaxDomainFactory domainFactory;
    private final CaseGenerator caseGenerator;
    private final EvaluationService evaluationService;
    private final AssessmentComparator assessmentComparator;

    @Value("${taxmusr.output-dir:output}")
    private String defaultOutputDir;

    @PostMapping("/cases/generate")
    public ResponseEntity<GenerationReport> generate(@RequestBody GenerateRequest request) {
        TaxDomain domain = domainFactory.create(request.getDomain(), request.getMaxDepth());
        String outputDir = StringUtils.hasText(request.getOutputDir()) ? request.getOutputDir() : defaultOutputDir;
        log.info("generate {} samples for '{}' into {}", request.getNumSamples(), domain.name(), outputDir);
        return ResponseEntity.ok(caseGenerator.generate(domain, request.getNumSamples(), Path.of(outputDir)));
    }

    @PostMapping("/cases/evaluate")
    public ResponseEntity<EvaluationReport> evaluate(@RequestBody EvaluateRequest request) {
        log.info("evaluate dataset {} (cot={}, examples={})", request.getDataset(), request.isCot(), request.getNumExamples());
        return ResponseEntity.ok(evaluationService.run(request));
    }

    @PostMapping("/assessment/compare")
    public ResponseEntity<AssessmentResult> compare(@RequestBody CoupleInput couple) {
        if (couple == null || couple.a() == null || couple.b() == null) {
            throw new IllegalArgumentException("a 与 b 两位伴侣的数据都必须提供");
        }
        return ResponseEntity.ok(assessmentComparator.compare(couple));
    }

    // 未知领域 / 税率表等配置错误，以及不完整的请求体
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        log.warn("rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
