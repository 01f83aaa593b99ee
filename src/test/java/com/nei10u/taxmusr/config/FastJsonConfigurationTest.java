package com.nei10u.taxmusr.config;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONReader;
import com.alibaba.fastjson2.JSONWriter;
import com.alibaba.fastjson2.support.config.FastJsonConfig;
import com.nei10u.taxmusr.model.AssessmentResult;
import com.nei10u.taxmusr.model.Recommendation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FastJsonConfigurationTest {

    @Test
    void httpResponsesShareTheCaseRecordFeatures() {
        FastJsonConfig config = FastJsonConfiguration.httpConfig(true);
        List<JSONWriter.Feature> features = List.of(config.getWriterFeatures());

        assertTrue(features.containsAll(List.of(FastJsonConfiguration.CASE_RECORD_FEATURES)));
        assertTrue(features.contains(JSONWriter.Feature.PrettyFormat));
        assertTrue(List.of(config.getReaderFeatures()).contains(JSONReader.Feature.SupportSmartMatch));
    }

    @Test
    void compactModeWritesSingleLineWithEnumLabels() {
        FastJsonConfig config = FastJsonConfiguration.httpConfig(false);
        AssessmentResult result = new AssessmentResult(31132.0, 27668.0, 3464.0, Recommendation.JOINT);

        String json = JSON.toJSONString(result, config.getWriterFeatures());

        assertFalse(json.contains("\n"));
        assertEquals("joint", JSON.parseObject(json).getString("recommendation"));
    }
}
