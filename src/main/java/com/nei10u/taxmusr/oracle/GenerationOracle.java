package com.nei10u.taxmusr.oracle;

import java.util.Map;

/**
 * 外部文本生成能力。实现必须把变量确定性地代入固定的 prompt 模板。
 * 调用是同步的，失败直接抛出给调用方。
 */
public interface GenerationOracle {

    OracleResponse generate(String template, Map<String, Object> variables, GenerationSettings settings);
}
