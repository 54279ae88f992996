package com.webtestool.core.cache;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/** 디스크/원격 계층이 공유하는 Jackson 설정 */
final class CacheJson {
    private CacheJson() {}

    static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);   // ISO-8601

    static JavaType envelopeOf(Class<?> valueType) {
        return MAPPER.getTypeFactory().constructParametricType(CacheEnvelope.class, valueType);
    }
}
