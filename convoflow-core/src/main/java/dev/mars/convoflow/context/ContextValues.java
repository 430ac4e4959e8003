/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */

package dev.mars.convoflow.context;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Value helpers shared by template interpolation and expression evaluation.
 */
public final class ContextValues {

    // Largest magnitude below which every whole double is an exact long.
    private static final double MAX_EXACT_WHOLE = 9007199254740992.0; // 2^53

    private ContextValues() {
    }

    /**
     * Falsy values are {@code null}, {@code false}, numeric zero and the empty string.
     */
    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.signum() != 0;
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return d != 0.0 && !Double.isNaN(d);
        }
        if (value instanceof CharSequence text) {
            return text.length() > 0;
        }
        return true;
    }

    /**
     * String form used when a value is substituted into text; {@code null} renders empty.
     * Whole doubles within the exact long range drop their fraction.
     */
    public static String stringify(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double d && d == Math.rint(d) && Math.abs(d) < MAX_EXACT_WHOLE) {
            return String.valueOf(d.longValue());
        }
        return value.toString();
    }

    /**
     * Walks a dotted path through nested maps and lists. Numeric segments index lists.
     *
     * @return the value, or {@code null} when any segment is missing
     */
    public static Object getPath(Object root, String path) {
        if (path == null || path.isEmpty()) {
            return null;
        }
        Object current = root;
        for (String segment : path.split("\\.")) {
            if (current instanceof Map<?, ?> map) {
                current = map.get(segment);
            } else if (current instanceof List<?> list) {
                int index = parseIndex(segment);
                if (index < 0 || index >= list.size()) {
                    return null;
                }
                current = list.get(index);
            } else {
                return null;
            }
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    static int parseIndex(String segment) {
        if (segment.isEmpty() || segment.length() > 9) {
            return -1;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return -1;
            }
        }
        return Integer.parseInt(segment);
    }
}
