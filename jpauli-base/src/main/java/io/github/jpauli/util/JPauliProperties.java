/*
 * Copyright DataStax, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.jpauli.util;

import io.github.jpauli.annotations.VisibleForTesting;

/**
 * Process-wide settings, read once from JVM system properties when the class is loaded.
 * <p>
 * <ul>
 *   <li>{@code jpauli.tolerance} - numerical tolerance used to drop vanishing coefficients,
 *       to test coefficients for being real, and as the default for closeness checks.
 *       Defaults to {@code 1e-6}.</li>
 *   <li>{@code jpauli.synthesis.trace} - when set, every synthesized term block is logged at
 *       DEBUG instead of TRACE.</li>
 * </ul>
 */
public final class JPauliProperties {
    /** Numerical tolerance shared by the algebra, the synthesizer and the simulator. */
    public static final double TOLERANCE = parseTolerance(System.getProperty("jpauli.tolerance", "1e-6"));

    /** Whether synthesized circuits are logged at DEBUG level. */
    public static final boolean SYNTHESIS_TRACE = Boolean.getBoolean("jpauli.synthesis.trace");

    private JPauliProperties() {
    }

    @VisibleForTesting
    static double parseTolerance(String value) {
        double tolerance;
        try {
            tolerance = Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("jpauli.tolerance must be a number, got " + value, e);
        }
        if (!(tolerance >= 0) || Double.isInfinite(tolerance)) {
            throw new IllegalArgumentException("jpauli.tolerance must be finite and non-negative, got " + value);
        }
        return tolerance;
    }
}
