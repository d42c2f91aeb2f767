///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

/**
 * A point at which a {@link BannerPipeline} can stop to wait for a person's decision.
 */
public enum PipelineStage {
    /** Some variables could not be classified with confidence. */
    CLASSIFICATION,

    /** The recoding of each ordinal scale should be confirmed. */
    RECODING,

    /** No banner variables were given. */
    BANNER_SELECTION,

    /** The audit of the recoded data must be approved before tabulation. */
    AUDIT_APPROVAL,
}
