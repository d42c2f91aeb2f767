///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import java.util.Collection;

/**
 * A class with utility methods for validating arguments.
 */
abstract class ArgumentUtil {

    // private constructor to prevent anyone from instantiating the class.
    private ArgumentUtil() {
    }

    /**
     * Throws an exception if {@code argument} is {@code null}.
     *
     * @param argument
     *     The argument to check.
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws NullPointerException
     *     if {@code argument} is {@code null}.
     */
    static void checkNotNull(Object argument, String argumentName) {
        if (argument == null) {
            throw new NullPointerException(argumentName + " must not be null");
        }
    }

    /**
     * Throws an exception if {@code argument} is {@code null}, empty, or only whitespace.
     *
     * @param argument
     *     The string to check.
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws NullPointerException
     *     if {@code argument} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code argument} is blank.
     */
    static void checkNotBlank(String argument, String argumentName) {
        checkNotNull(argument, argumentName);
        if (argument.isBlank()) {
            throw new IllegalArgumentException(argumentName + " must not be blank");
        }
    }

    /**
     * Throws an exception if {@code collection} is {@code null} or contains a {@code null} entry.
     *
     * @param collection
     *     The collection to check.
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws NullPointerException
     *     if {@code collection} is {@code null} or contains a {@code null} entry.
     */
    static void checkNoNullEntries(Collection<?> collection, String argumentName) {
        checkNotNull(collection, argumentName);
        for (Object entry : collection) {
            if (entry == null) {
                throw new NullPointerException(argumentName + " must not contain a null entry");
            }
        }
    }

    /**
     * Throws an exception if {@code argument} is not positive (greater than zero).
     *
     * @param argument
     *     The argument to check
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws IllegalArgumentException
     *     if {@code argument} is zero or negative
     */
    static void checkPositive(int argument, String argumentName) {
        assert argumentName != null : "argumentName must not be null";

        if (argument <= 0) {
            throw new IllegalArgumentException(argumentName + " must be positive");
        }
    }

    /**
     * Throws an exception if {@code argument} is negative (less than zero).
     *
     * @param argument
     *     The argument to check
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws IllegalArgumentException
     *     if {@code argument} is negative
     */
    static void checkNotNegative(double argument, String argumentName) {
        assert argumentName != null : "argumentName must not be null";

        if (!(0 <= argument)) {
            throw new IllegalArgumentException(argumentName + " must not be negative");
        }
    }

    /**
     * Throws an exception if {@code argument} is not strictly between 0 and 1, which is the legal range of a
     * significance level.
     *
     * @param argument
     *     The argument to check
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws IllegalArgumentException
     *     if {@code argument} is not in the open interval (0, 1).
     */
    static void checkProbability(double argument, String argumentName) {
        assert argumentName != null : "argumentName must not be null";

        if (!(0 < argument && argument < 1)) {
            throw new IllegalArgumentException(argumentName + " must be between 0 and 1 (exclusive)");
        }
    }
}
