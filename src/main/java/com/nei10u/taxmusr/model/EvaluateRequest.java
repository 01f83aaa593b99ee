package com.nei10u.taxmusr.model;

import lombok.Data;

@Data
public class EvaluateRequest {
    private String dataset;         // .json 或 .jsonl
    private String outputPath;      // 结果写为 .jsonl
    private boolean cot = true;     // 是否要求逐步推理
    private int numExamples;        // few-shot 数量，0 为 zero-shot
    private String fewShotDataset;  // few-shot 示例来源，可选
}
