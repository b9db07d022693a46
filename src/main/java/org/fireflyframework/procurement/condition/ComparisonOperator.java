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

import java.util.Arrays;
import java.util.Optional;

/**
 * Operators allowed inside a comparison object.
 * <p>
 * When the compared context value is absent, {@code lt} and {@code lte} pass
 * while every other operator fails.
 */
public enum ComparisonOperator {

    MIN("min", ">=", false),
    MAX("max", "<=", false),
    LT("lt", "<", true),
    LTE("lte", "<=", true),
    GT("gt", ">", false),
    GTE("gte", ">=", false),
    EQ("eq", "==", false);

    private final String key;
    private final String symbol;
    private final boolean passesWhenAbsent;

    ComparisonOperator(String key, String symbol, boolean passesWhenAbsent) {
        this.key = key;
        this.symbol = symbol;
        this.passesWhenAbsent = passesWhenAbsent;
    }

    public String key() {
        return key;
    }

    public String symbol() {
        return symbol;
    }

    public boolean passesWhenAbsent() {
        return passesWhenAbsent;
    }

    /**
     * Checks a comparison outcome ({@code actual.compareTo(bound)}) against this operator.
     */
    public boolean accepts(int comparison) {
        return switch (this) {
            case MIN, GTE -> comparison >= 0;
            case MAX, LTE -> comparison <= 0;
            case LT -> comparison < 0;
            case GT -> comparison > 0;
            case EQ -> comparison == 0;
        };
    }

    public static Optional<ComparisonOperator> fromKey(String key) {
        return Arrays.stream(values())
                .filter(op -> op.key.equals(key))
                .findFirst();
    }
}
