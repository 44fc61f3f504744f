package me.golemcore.tutor.tools;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.tutor.domain.model.LearnerLevel;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lenient readers for assistant-supplied arguments. Models send numbers as
 * strings and single values where lists are expected, so every reader
 * accepts both.
 */
final class ToolArguments {

    private ToolArguments() {
    }

    static String string(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    static String string(Map<String, Object> params, String key, String defaultValue) {
        String value = string(params, key);
        return value != null ? value : defaultValue;
    }

    static List<String> stringList(Map<String, Object> params, String key) {
        Object value = params.get(key);
        List<String> result = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            for (Object item : collection) {
                if (item != null && !item.toString().isBlank()) {
                    result.add(item.toString().trim());
                }
            }
        } else if (value != null && !value.toString().isBlank()) {
            result.add(value.toString().trim());
        }
        return result;
    }

    static Double number(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(key + " must be a number", e);
            }
        }
        return null;
    }

    static Boolean bool(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof String text && !text.isBlank()) {
            return Boolean.parseBoolean(text.trim());
        }
        return null;
    }

    static LearnerLevel level(Map<String, Object> params, String key) {
        return LearnerLevel.fromValue(string(params, key));
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> object(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value instanceof Map<?, ?> map) {
            return new LinkedHashMap<>((Map<String, Object>) map);
        }
        return new LinkedHashMap<>();
    }
}
