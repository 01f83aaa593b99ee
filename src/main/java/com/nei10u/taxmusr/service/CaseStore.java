package com.nei10u.taxmusr.service;

import com.alibaba.fastjson2.JSON;
import com.nei10u.taxmusr.config.FastJsonConfiguration;
import com.nei10u.taxmusr.model.GeneratedCase;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * 每个领域一个 JSONL 文件，每行一个案例。只追加，从不重写已有行。
 */
@Component
public class CaseStore {

    public Path fileFor(Path outputDir, String domain) {
        return outputDir.resolve(domain + "_cases.jsonl");
    }

    public Path append(Path outputDir, GeneratedCase generatedCase) {
        Path file = fileFor(outputDir, generatedCase.getDomain());
        String line = JSON.toJSONString(generatedCase, FastJsonConfiguration.CASE_RECORD_FEATURES) + "\n";
        try {
            Files.createDirectories(outputDir);
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("写入案例失败: " + file, e);
        }
        return file;
    }
}
