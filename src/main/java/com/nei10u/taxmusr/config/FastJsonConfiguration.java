package com.nei10u.taxmusr.config;

import com.alibaba.fastjson2.JSONReader;
import com.alibaba.fastjson2.JSONWriter;
import com.alibaba.fastjson2.support.config.FastJsonConfig;
import com.alibaba.fastjson2.support.spring6.http.converter.FastJsonHttpMessageConverter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.http.HttpMessageConverters;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;

import java.util.ArrayList;
import java.util.List;

/**
 * 接口与 JSONL 案例记录共用同一套 fastjson2 写出特性：
 * 枚举按小写标签输出（joint / story_fact），null 字段保留，保证每条记录字段齐全。
 * 接口响应可额外开启缩进，案例记录必须保持单行。
 */
@Configuration
public class FastJsonConfiguration {

    public static final JSONWriter.Feature[] CASE_RECORD_FEATURES = {
            JSONWriter.Feature.WriteEnumUsingToString,
            JSONWriter.Feature.WriteMapNullValue
    };

    @Value("${taxmusr.http.pretty-json:true}")
    private boolean prettyJson;

    @Bean
    public HttpMessageConverters fastJsonHttpMessageConverters() {
        FastJsonHttpMessageConverter converter = new FastJsonHttpMessageConverter();
        converter.setFastJsonConfig(httpConfig(prettyJson));
        converter.setSupportedMediaTypes(List.of(
                MediaType.APPLICATION_JSON,
                new MediaType("application", "*+json")
        ));
        return new HttpMessageConverters(converter);
    }

    /**
     * 请求体同时接受 camelCase 与 snake_case 字段（numSamples / num_samples）。
     */
    static FastJsonConfig httpConfig(boolean pretty) {
        FastJsonConfig config = new FastJsonConfig();
        config.setReaderFeatures(JSONReader.Feature.SupportSmartMatch);

        List<JSONWriter.Feature> writerFeatures = new ArrayList<>(List.of(CASE_RECORD_FEATURES));
        if (pretty) {
            writerFeatures.add(JSONWriter.Feature.PrettyFormat);
        }
        config.setWriterFeatures(writerFeatures.toArray(new JSONWriter.Feature[0]));
        return config;
    }
}
