package com.nei10u.taxmusr.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvaluationReport {
    private int total;
    private int correct;
    private double accuracy;
    private String outputPath;
}
