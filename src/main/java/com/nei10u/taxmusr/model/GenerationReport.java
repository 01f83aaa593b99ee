package com.nei10u.taxmusr.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationReport {
    private String domain;
    private int generated;
    private int skipped;
    private String outputFile;
}
