package com.nei10u.taxmusr.service;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.nei10u.taxmusr.model.EvaluateRequest;
import com.nei10u.taxmusr.model.EvaluationReport;
import com.nei10u.taxmusr.model.WorkflowOutput;
import com.nei10u.taxmusr.oracle.GenerationOracle;
import com.nei10u.taxmusr.oracle.GenerationSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 用生成能力回答数据集中的问题，并与金标准答案比较准确率。
 */
@Service
public class EvaluationService {
    private static final Logger log = LoggerFactory.getLogger(EvaluationService.class);

    private final GenerationOracle oracle;
    private final GenerationSettings settings;

    public EvaluationService(GenerationOracle oracle, GenerationSettings settings) {
        this.oracle = oracle;
        this.settings = settings;
    }

    public EvaluationReport run(EvaluateRequest request) {
        if (!StringUtils.hasText(request.getDataset()) || !StringUtils.hasText(request.getOutputPath())) {
            throw new IllegalArgumentException("dataset 与 outputPath 不能为空");
        }
        List<JSONObject> examples = load(Path.of(request.getDataset()));
        log.info("loaded {} examples from {}", examples.size(), request.getDataset());

        List<JSONObject> fewShot = StringUtils.hasText(request.getFewShotDataset())
                ? load(Path.of(request.getFewShotDataset()))
                : List.of();
        AnswerWorkflow workflow = new AnswerWorkflow(oracle, settings, request.isCot(), request.getNumExamples(), fewShot);

        int correct = 0;
        List<String> lines = new ArrayList<>();
        for (JSONObject example : examples) {
            WorkflowOutput output = workflow.run(example);
            if (isCorrect(example.getString("answer"), output.predictedAnswer())) {
                correct++;
            }
            Map<String, Object> prediction = new LinkedHashMap<>();
            prediction.put("predicted_answer", output.predictedAnswer());
            prediction.put("reasoning", output.reasoning());
            prediction.put("token_usage", output.tokenUsage());
            example.put("prediction", prediction);
            lines.add(JSON.toJSONString(example));
        }

        double accuracy = examples.isEmpty() ? 0.0 : (double) correct / examples.size();
        log.info("accuracy: {}%", String.format("%.2f", accuracy * 100));

        Path output = Path.of(request.getOutputPath());
        write(output, lines);
        log.info("wrote {} evaluated examples to {}", lines.size(), output);
        return EvaluationReport.builder()
                .total(examples.size())
                .correct(correct)
                .accuracy(accuracy)
                .outputPath(output.toString())
                .build();
    }

    static boolean isCorrect(String gold, String predicted) {
        return gold != null && predicted != null && gold.strip().equalsIgnoreCase(predicted.strip());
    }

    /**
     * 支持 .json（数组）与 .jsonl（每行一个对象）。
     */
    List<JSONObject> load(Path dataset) {
        String name = dataset.getFileName().toString();
        String content;
        try {
            content = Files.readString(dataset, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("读取数据集失败: " + dataset, e);
        }
        List<JSONObject> examples = new ArrayList<>();
        if (name.endsWith(".json")) {
            JSONArray array = JSON.parseArray(content);
            for (int i = 0; i < array.size(); i++) {
                examples.add(array.getJSONObject(i));
            }
        } else if (name.endsWith(".jsonl")) {
            for (String line : content.split("\\r?\\n")) {
                if (StringUtils.hasText(line)) {
                    examples.add(JSON.parseObject(line));
                }
            }
        } else {
            throw new IllegalArgumentException("不支持的数据集格式: " + name);
        }
        return examples;
    }

    private void write(Path output, List<String> lines) {
        try {
            if (output.getParent() != null) {
                Files.createDirectories(output.getParent());
            }
            Files.write(output, lines, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("写入评估结果失败: " + output, e);
        }
    }
}
