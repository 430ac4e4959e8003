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

package dev.mars.convoflow.engine;

import java.time.Duration;

/**
 * Exponential backoff: {@code base * 2^(attempt - 1)}.
 */
final class RetryBackoff {

    private static final int MAX_SHIFT = 20;

    private RetryBackoff() {
    }

    /**
     * @param attempt the attempt that just failed, starting at 1
     */
    static Duration delayFor(Duration base, int attempt) {
        int shift = Math.min(Math.max(attempt - 1, 0), MAX_SHIFT);
        return base.multipliedBy(1L << shift);
    }
}
