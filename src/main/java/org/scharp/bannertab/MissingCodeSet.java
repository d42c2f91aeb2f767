///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The codes of one variable that don't represent a real answer, such as "Don't know" or "Refused".
 * <p>
 * Surveys usually give non-substantive answers a code outside of the scale (for example, 99 on a 1-5 scale) so that
 * they can be told apart from a missing response.  For analysis, however, they are treated as missing: they never
 * contribute to a base or a percentage.
 * </p>
 *
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
public final class MissingCodeSet {

    /**
     * A set with no codes.
     */
    public static final MissingCodeSet EMPTY = new MissingCodeSet(new TreeMap<>());

    private final SortedMap<Integer, String> labelsByCode;

    /**
     * Creates a set of non-substantive codes.
     *
     * @param labelsByCode
     *     A map from each non-substantive code to its value label. This map is copied.
     *
     * @throws NullPointerException
     *     if {@code labelsByCode} is {@code null} or contains a {@code null} key or value.
     */
    public MissingCodeSet(Map<Integer, String> labelsByCode) {
        ArgumentUtil.checkNotNull(labelsByCode, "labelsByCode");
        ArgumentUtil.checkNoNullEntries(labelsByCode.keySet(), "labelsByCode");
        ArgumentUtil.checkNoNullEntries(labelsByCode.values(), "labelsByCode");

        this.labelsByCode = new TreeMap<>(labelsByCode);
    }

    /**
     * Determines if a value is non-substantive.
     *
     * @param code
     *     A value from the data. This may be {@code null}, which represents a value that is missing altogether.
     *
     * @return {@code true} if {@code code} is one of the non-substantive codes. {@code false} if it's a substantive
     *     code or {@code null}.
     */
    public boolean contains(Integer code) {
        return code != null && labelsByCode.containsKey(code);
    }

    /**
     * Determines if a value is a real answer: neither missing nor non-substantive.
     *
     * @param code
     *     A value from the data. This may be {@code null}.
     *
     * @return {@code true} if {@code code} is not {@code null} and is not non-substantive.
     */
    public boolean isSubstantive(Integer code) {
        return code != null && !labelsByCode.containsKey(code);
    }

    /**
     * Gets the substantive codes of a variable, which are its coded values minus the codes in this set.
     *
     * @param variable
     *     The variable to which this set belongs.
     *
     * @return The substantive codes in ascending order.  The returned set is not modifiable.
     */
    public SortedSet<Integer> substantiveCodes(Variable variable) {
        SortedSet<Integer> substantiveCodes = new TreeSet<>(variable.codedValues());
        substantiveCodes.removeAll(labelsByCode.keySet());
        return Collections.unmodifiableSortedSet(substantiveCodes);
    }

    /**
     * Gets the non-substantive codes.
     *
     * @return The codes in ascending order.  The returned set is not modifiable.
     */
    public SortedSet<Integer> codes() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(labelsByCode.keySet()));
    }

    /**
     * Gets the non-substantive codes with the labels that identified them.
     *
     * @return A map from code to value label.  The returned map is not modifiable.
     */
    public SortedMap<Integer, String> labelsByCode() {
        return Collections.unmodifiableSortedMap(labelsByCode);
    }

    /**
     * Determines if this set is empty.
     *
     * @return {@code true} if no code is non-substantive.
     */
    public boolean isEmpty() {
        return labelsByCode.isEmpty();
    }

    @Override
    public int hashCode() {
        return Objects.hash(labelsByCode);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof MissingCodeSet otherSet)) {
            return false;
        }
        return labelsByCode.equals(otherSet.labelsByCode);
    }

    @Override
    public String toString() {
        return labelsByCode.toString();
    }
}
