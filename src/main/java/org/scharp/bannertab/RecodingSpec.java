///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * How an ordinal scale is collapsed into a binary indicator: the number of scale points that map to 1, and which end
 * of the scale they come from.
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
public final class RecodingSpec {

    /**
     * The conventional "top-2-box" recoding: the two highest scale points map to 1.
     */
    public static final RecodingSpec TOP_2_BOX = new RecodingSpec(2, BoxDirection.TOP);

    private static final Pattern SCHEME_PATTERN = Pattern.compile("(top|bottom)([1-9][0-9]*)");

    private final int boxSize;
    private final BoxDirection direction;

    /**
     * Creates a recoding specification.
     *
     * @param boxSize
     *     The number of scale points that map to 1.
     * @param direction
     *     The end of the scale from which they are taken.
     *
     * @throws IllegalArgumentException
     *     if {@code boxSize} is not positive.
     * @throws NullPointerException
     *     if {@code direction} is {@code null}.
     */
    public RecodingSpec(int boxSize, BoxDirection direction) {
        ArgumentUtil.checkPositive(boxSize, "boxSize");
        ArgumentUtil.checkNotNull(direction, "direction");

        this.boxSize = boxSize;
        this.direction = direction;
    }

    /**
     * Parses a scheme name such as "top2", "top3", or "bottom2".
     *
     * @param scheme
     *     The scheme name. Case is ignored.
     *
     * @return The corresponding specification.
     *
     * @throws NullPointerException
     *     if {@code scheme} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code scheme} is not a direction followed by a positive box size.
     */
    public static RecodingSpec parse(String scheme) {
        ArgumentUtil.checkNotNull(scheme, "scheme");

        Matcher matcher = SCHEME_PATTERN.matcher(scheme.strip().toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            throw notAScheme(scheme, null);
        }
        BoxDirection direction = matcher.group(1).equals("top") ? BoxDirection.TOP : BoxDirection.BOTTOM;

        int boxSize;
        try {
            boxSize = Integer.parseInt(matcher.group(2));
        } catch (NumberFormatException exception) {
            // the box size overflows an int
            throw notAScheme(scheme, exception);
        }
        return new RecodingSpec(boxSize, direction);
    }

    private static IllegalArgumentException notAScheme(String scheme, Throwable cause) {
        return new IllegalArgumentException(
            "\"" + scheme + "\" is not a recoding scheme (expected something like top2 or bottom3)", cause);
    }

    /**
     * Gets the number of scale points that map to 1.
     *
     * @return The box size, which is always positive.
     */
    public int boxSize() {
        return boxSize;
    }

    /**
     * Gets the end of the scale from which the box is taken.
     *
     * @return The direction. This is never {@code null}.
     */
    public BoxDirection direction() {
        return direction;
    }

    /**
     * Gets the scheme name, such as "top2".  This is also the suffix of the recoded variable's name.
     *
     * @return The scheme name.
     */
    public String schemeName() {
        return direction.schemePrefix() + boxSize;
    }

    /**
     * Gets the label of the box, such as "Top 2 Box".
     *
     * @return The box label.
     */
    public String boxLabel() {
        return direction.labelPrefix() + " " + boxSize + " Box";
    }

    @Override
    public int hashCode() {
        return Objects.hash(boxSize, direction);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof RecodingSpec otherSpec)) {
            return false;
        }
        return boxSize == otherSpec.boxSize && direction == otherSpec.direction;
    }

    @Override
    public String toString() {
        return schemeName();
    }
}
