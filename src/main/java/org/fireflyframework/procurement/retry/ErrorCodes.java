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

package org.fireflyframework.procurement.retry;

import java.util.Collection;

/**
 * Error code matching. A reported error matches a code when it equals the code
 * or contains it, so that messages such as {@code "HTTP 401: AUTHENTICATION_FAILED"}
 * are classified like the bare code.
 */
public final class ErrorCodes {

    private ErrorCodes() {
    }

    public static boolean matches(String error, String code) {
        return error != null && code != null && (error.equals(code) || error.contains(code));
    }

    public static boolean matchesAny(String error, Collection<String> codes) {
        return codes.stream().anyMatch(code -> matches(error, code));
    }
}
