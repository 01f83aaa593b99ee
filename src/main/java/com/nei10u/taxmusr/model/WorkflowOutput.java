package com.nei10u.taxmusr.model;

import com.nei10u.taxmusr.oracle.TokenUsage;

public record WorkflowOutput(String predictedAnswer, String reasoning, TokenUsage tokenUsage) {
}
