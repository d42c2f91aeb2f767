///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import java.util.Objects;

/**
 * A record of something that was skipped or is less reliable than usual.
 * <p>
 * Instances of this class are immutable.
 * </p>
 */
public final class PipelineWarning {

    private final WarningType type;
    private final String variableName;
    private final String bannerVariableName;
    private final String detail;

    /**
     * Creates a warning.
     *
     * @param type
     *     The kind of problem.
     * @param variableName
     *     The variable concerned. For an empty banner column, this is the banner variable.
     * @param bannerVariableName
     *     The banner variable concerned, or {@code null} if the problem is not about a banner.
     * @param detail
     *     A human-readable description of the problem.
     *
     * @throws NullPointerException
     *     if {@code type}, {@code variableName}, or {@code detail} is {@code null}.
     */
    public PipelineWarning(WarningType type, String variableName, String bannerVariableName, String detail) {
        ArgumentUtil.checkNotNull(type, "type");
        ArgumentUtil.checkNotNull(variableName, "variableName");
        ArgumentUtil.checkNotNull(detail, "detail");

        this.type = type;
        this.variableName = variableName;
        this.bannerVariableName = bannerVariableName;
        this.detail = detail;
    }

    /**
     * Gets the kind of problem.
     *
     * @return The warning type.
     */
    public WarningType type() {
        return type;
    }

    /**
     * Gets the name of the variable concerned.
     *
     * @return The variable name. This is never {@code null}.
     */
    public String variableName() {
        return variableName;
    }

    /**
     * Gets the name of the banner variable concerned.
     *
     * @return The banner variable name, or {@code null} if the warning is not about a banner.
     */
    public String bannerVariableName() {
        return bannerVariableName;
    }

    /**
     * Gets a description of the problem.
     *
     * @return The detail. This is never {@code null}.
     */
    public String detail() {
        return detail;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, variableName, bannerVariableName, detail);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PipelineWarning that)) {
            return false;
        }
        return type == that.type &&
            variableName.equals(that.variableName) &&
            Objects.equals(bannerVariableName, that.bannerVariableName) &&
            detail.equals(that.detail);
    }

    @Override
    public String toString() {
        String subject = bannerVariableName == null || bannerVariableName.equals(variableName) ?
            variableName :
            variableName + " x " + bannerVariableName;
        return type + " " + subject + ": " + detail;
    }
}
