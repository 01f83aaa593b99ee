package com.nei10u.taxmusr.oracle;

public record OracleResponse(String text, TokenUsage usage) {

    public static OracleResponse of(String text) {
        return new OracleResponse(text, TokenUsage.empty());
    }
}
