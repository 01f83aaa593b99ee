package com.nei10u.taxmusr.oracle;

public record TokenUsage(Integer promptTokens, Integer completionTokens, Integer totalTokens) {

    public static TokenUsage empty() {
        return new TokenUsage(null, null, null);
    }
}
