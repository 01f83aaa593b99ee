package com.nei10u.taxmusr.oracle;

/**
 * 单次生成调用的模型参数，null 表示沿用模型默认值。
 */
public record GenerationSettings(String model, Double temperature, Double topP, Integer maxTokens) {

    public static GenerationSettings defaults() {
        return new GenerationSettings(null, 1.0, 1.0, 2048);
    }
}
