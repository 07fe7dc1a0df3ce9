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

package io.github.jpauli.math;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.util.FastMath;

import static io.github.jpauli.util.JPauliProperties.TOLERANCE;

/**
 * Utility methods for complex coefficients and amplitudes.
 */
public final class ComplexUtil {
    /** -i */
    public static final Complex MINUS_I = new Complex(0, -1);

    /** Private constructor to prevent instantiation. */
    private ComplexUtil() {
    }

    /**
     * @return true if the magnitude of {@code c} is within the configured tolerance of zero
     */
    public static boolean isZero(Complex c) {
        return c.abs() <= TOLERANCE;
    }

    /**
     * @return true if the imaginary part of {@code c} is within the configured tolerance of zero
     */
    public static boolean isReal(Complex c) {
        return FastMath.abs(c.getImaginary()) <= TOLERANCE;
    }

    /**
     * @return true if {@code a} and {@code b} differ by at most the configured tolerance
     */
    public static boolean isClose(Complex a, Complex b) {
        return isClose(a, b, TOLERANCE);
    }

    /**
     * @return true if {@code a} and {@code b} differ by at most {@code tolerance}
     */
    public static boolean isClose(Complex a, Complex b, double tolerance) {
        return a.subtract(b).abs() <= tolerance;
    }

    /**
     * @return e^(i * phi)
     */
    public static Complex expI(double phi) {
        return new Complex(FastMath.cos(phi), FastMath.sin(phi));
    }

    /**
     * Squared magnitude, without the square root taken by {@link Complex#abs()}.
     */
    public static double absSquared(Complex c) {
        return c.getReal() * c.getReal() + c.getImaginary() * c.getImaginary();
    }

    /**
     * Orders complex numbers by real part, then by imaginary part.
     */
    public static int compare(Complex a, Complex b) {
        int c = Double.compare(a.getReal(), b.getReal());
        return c != 0 ? c : Double.compare(a.getImaginary(), b.getImaginary());
    }

    /**
     * Formats as {@code (re+imi)}, e.g. {@code (0.5-1.0i)}.
     */
    public static String format(Complex c) {
        double im = c.getImaginary();
        return "(" + c.getReal() + (im < 0 || (im == 0 && 1 / im < 0) ? "-" : "+") + FastMath.abs(im) + "i)";
    }
}
