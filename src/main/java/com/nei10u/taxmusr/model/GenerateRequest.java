package com.nei10u.taxmusr.model;

import lombok.Data;

@Data
public class GenerateRequest {
    private String domain = "joint_assessment";
    private int numSamples = 10;
    private Integer maxDepth;  // 为空时使用领域默认深度
    private String outputDir;  // 为空时使用 taxmusr.output-dir
}
