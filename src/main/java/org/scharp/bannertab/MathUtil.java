///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

/**
 * A class for holding utility methods.
 */
abstract class MathUtil {

    /** The relative precision at which the incomplete gamma series and continued fraction stop. */
    private static final double EPSILON = 1e-15;

    /** A number near the smallest representable double, used to keep the continued fraction away from zero. */
    private static final double FLOATING_POINT_MINIMUM = Double.MIN_NORMAL / EPSILON;

    private static final int MAX_ITERATIONS = 10_000;

    // Lanczos approximation with g=7, n=9.
    private static final double LANCZOS_G = 7;
    private static final double[] LANCZOS_COEFFICIENTS = {
        0.99999999999980993,
        676.5203681218851,
        -1259.1392167224028,
        771.32342877765313,
        -176.61502916214059,
        12.507343278686905,
        -0.13857109526572012,
        9.9843695780195716e-6,
        1.5056327351493116e-7,
    };

    // private constructor to prevent anyone from instantiating the class.
    private MathUtil() {
    }

    /**
     * Computes the natural logarithm of the gamma function.
     *
     * @param x
     *     The argument. This must be at least 0.5.
     *
     * @return ln(&Gamma;(x))
     */
    static double logGamma(double x) {
        assert 0.5 <= x : "logGamma is only implemented for x >= 0.5";

        double shifted = x - 1;
        double sum = LANCZOS_COEFFICIENTS[0];
        for (int i = 1; i < LANCZOS_COEFFICIENTS.length; i++) {
            sum += LANCZOS_COEFFICIENTS[i] / (shifted + i);
        }
        double t = shifted + LANCZOS_G + 0.5;
        return 0.5 * Math.log(2 * Math.PI) + (shifted + 0.5) * Math.log(t) - t + Math.log(sum);
    }

    /**
     * Computes the regularized upper incomplete gamma function Q(a, x) = &Gamma;(a, x) / &Gamma;(a).
     *
     * @param a
     *     The shape parameter. This must be at least 0.5.
     * @param x
     *     The lower limit of integration. This must not be negative.
     *
     * @return Q(a, x), which is between 0 and 1.
     */
    static double regularizedGammaQ(double a, double x) {
        assert 0.5 <= a : "a must be at least 0.5";
        assert 0 <= x : "x must not be negative";

        if (x == 0) {
            return 1;
        }

        // The series converges quickly below a+1, the continued fraction above it.
        if (x < a + 1) {
            return Math.max(0, 1 - lowerGammaSeries(a, x));
        }
        return Math.min(1, upperGammaContinuedFraction(a, x));
    }

    /**
     * Computes the probability that a chi-square distributed variable with {@code degreesOfFreedom} degrees of freedom
     * is at least {@code statistic} (the upper tail, or survival function).
     *
     * @param statistic
     *     The chi-square statistic. This must not be negative.
     * @param degreesOfFreedom
     *     The degrees of freedom. This must be positive.
     *
     * @return The p-value of the statistic.
     */
    static double chiSquareSurvival(double statistic, int degreesOfFreedom) {
        assert 0 < degreesOfFreedom : "degreesOfFreedom must be positive";
        assert 0 <= statistic : "statistic must not be negative";

        return regularizedGammaQ(degreesOfFreedom / 2.0, statistic / 2.0);
    }

    private static double gammaPrefactor(double a, double x) {
        return Math.exp(-x + a * Math.log(x) - logGamma(a));
    }

    private static double lowerGammaSeries(double a, double x) {
        double term = 1 / a;
        double sum = term;
        double denominator = a;
        for (int i = 0; i < MAX_ITERATIONS; i++) {
            denominator++;
            term *= x / denominator;
            sum += term;
            if (Math.abs(term) < Math.abs(sum) * EPSILON) {
                break;
            }
        }
        return sum * gammaPrefactor(a, x);
    }

    // Modified Lentz's method.
    private static double upperGammaContinuedFraction(double a, double x) {
        double b = x + 1 - a;
        double c = 1 / FLOATING_POINT_MINIMUM;
        double d = 1 / b;
        double fraction = d;
        for (int i = 1; i < MAX_ITERATIONS; i++) {
            double an = -i * (i - a);
            b += 2;
            d = an * d + b;
            if (Math.abs(d) < FLOATING_POINT_MINIMUM) {
                d = FLOATING_POINT_MINIMUM;
            }
            c = b + an / c;
            if (Math.abs(c) < FLOATING_POINT_MINIMUM) {
                c = FLOATING_POINT_MINIMUM;
            }
            d = 1 / d;
            double delta = d * c;
            fraction *= delta;
            if (Math.abs(delta - 1) < EPSILON) {
                break;
            }
        }
        return gammaPrefactor(a, x) * fraction;
    }
}
