package com.platform.governance.policy;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.platform.governance.error.SerializationException;
import org.springframework.stereotype.Component;

/**
 * Converts rule logic to and from its canonical JSON form.
 * The canonical form has sorted keys and omits nulls, so equal content always
 * produces the same bytes and therefore the same hash.
 */
@Component
public class PolicyRuleCodec {
    
    private final ObjectMapper canonicalMapper;
    
    public PolicyRuleCodec() {
        this.canonicalMapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .build();
    }
    
    public String toCanonicalJson(PolicyRuleLogic ruleLogic) {
        try {
            return canonicalMapper.writeValueAsString(ruleLogic);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to serialize policy rule logic", e);
        }
    }
    
    public PolicyRuleLogic fromJson(String json) {
        try {
            return canonicalMapper.readValue(json, PolicyRuleLogic.class);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to parse policy rule logic", e);
        }
    }
}
