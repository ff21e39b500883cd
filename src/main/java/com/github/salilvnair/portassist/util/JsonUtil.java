package com.github.salilvnair.portassist.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.experimental.UtilityClass;

import java.util.Map;

@UtilityClass
public final class JsonUtil {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    /**
     * Bean or record to a field map, null when the value has no object shape.
     */
    public static Map<String, Object> toMapOrNull(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return MAPPER.convertValue(value, MAP_TYPE);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
