/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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

package org.fireflyframework.procurement.condition;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;

/**
 * Type-aware equality and ordering for context values.
 */
final class Values {

    private Values() {
    }

    static boolean areEqual(Object actual, Object expected) {
        if (actual instanceof Number a && expected instanceof Number e) {
            return compareNumbers(a, e) == 0;
        }
        return Objects.equals(actual, expected);
    }

    /**
     * Compares {@code actual} with {@code bound}.
     *
     * @return negative, zero or positive as for {@link Comparable}, or null if the
     *         values cannot be ordered against each other
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    static Integer compare(Object actual, Object bound, List<String> ordinalScale) {
        if (actual instanceof Number a && bound instanceof Number b) {
            return compareNumbers(a, b);
        }
        if (actual instanceof String a && bound instanceof String b) {
            int ai = ordinalScale.indexOf(a);
            int bi = ordinalScale.indexOf(b);
            if (ai >= 0 && bi >= 0) {
                return Integer.compare(ai, bi);
            }
            return a.compareTo(b);
        }
        if (actual instanceof Comparable a && actual.getClass().equals(bound.getClass())) {
            return a.compareTo(bound);
        }
        return null;
    }

    private static int compareNumbers(Number a, Number b) {
        if (isExact(a) && isExact(b)) {
            return new BigDecimal(a.toString()).compareTo(new BigDecimal(b.toString()));
        }
        return Double.compare(a.doubleValue(), b.doubleValue());
    }

    private static boolean isExact(Number number) {
        return number instanceof Integer || number instanceof Long || number instanceof Short
                || number instanceof Byte || number instanceof BigInteger || number instanceof BigDecimal;
    }
}
