///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.bannertab;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Derives top-N-box and bottom-N-box binary variables from ordinal scales.
 * <p>
 * For a top box of size N, the threshold is {@code max - N + 1}, where {@code max} is the largest substantive code.
 * A respondent's derived value is 1 if their code is at or above the threshold, 0 if it is any other substantive code,
 * and missing if it is missing or non-substantive.  A bottom box is the mirror image, with threshold
 * {@code min + N - 1}.
 * </p><p>
 * Each scale gets its own threshold, so a survey can freely mix 5-point, 7-point and 0-10 scales.
 * </p>
 */
public final class RecodingEngine {

    private static final Logger logger = LoggerFactory.getLogger(RecodingEngine.class);

    /** Scales with fewer substantive codes than this are not recoded. */
    public static final int MINIMUM_SCALE_POINTS = 3;

    /** The value label of the derived variable's 0 code. */
    public static final String OUTSIDE_BOX_LABEL = "Bottom box";

    /**
     * Recodes a single variable.  The variable's kind is not checked.
     *
     * @param variable
     *     The ordinal scale.
     * @param missingCodes
     *     The variable's non-substantive codes.
     * @param spec
     *     The recoding to apply.
     *
     * @return Either the derived variable or the reason it couldn't be derived. This is never {@code null}.
     *
     * @throws NullPointerException
     *     if any argument is {@code null}.
     */
    public RecodeOutcome recode(Variable variable, MissingCodeSet missingCodes, RecodingSpec spec) {
        ArgumentUtil.checkNotNull(variable, "variable");
        ArgumentUtil.checkNotNull(missingCodes, "missingCodes");
        ArgumentUtil.checkNotNull(spec, "spec");

        SortedSet<Integer> scale = missingCodes.substantiveCodes(variable);
        final int scalePoints = scale.size();
        if (scalePoints < MINIMUM_SCALE_POINTS) {
            return RecodeOutcome.skipped(new RecodeSkip(variable.name(), spec,
                "only " + scalePoints + " substantive codes, which is already binary"));
        }
        if (scalePoints <= spec.boxSize()) {
            return RecodeOutcome.skipped(new RecodeSkip(variable.name(), spec,
                "a box of " + spec.boxSize() + " covers all " + scalePoints + " scale points"));
        }

        final int threshold;
        final SortedSet<Integer> thresholdCodes;
        if (spec.direction() == BoxDirection.TOP) {
            threshold = scale.last() - spec.boxSize() + 1;
            thresholdCodes = new TreeSet<>(scale.tailSet(threshold));
        } else {
            threshold = scale.first() + spec.boxSize() - 1;
            thresholdCodes = new TreeSet<>(scale.headSet(threshold + 1));
        }

        List<String> thresholdLabels = new ArrayList<>(thresholdCodes.size());
        for (Integer code : thresholdCodes) {
            thresholdLabels.add(variable.valueLabel(code));
        }

        Variable derived = Variable.builder().
            name(variable.name() + "_" + spec.schemeName()).
            label(variable.displayLabel() + " [" + spec.boxLabel() + "]").
            valueLabel(0, OUTSIDE_BOX_LABEL).
            valueLabel(1, spec.boxLabel()).
            kind(VariableKind.BINARY).
            build();

        return RecodeOutcome.recoded(new RecodedVariable(derived, variable.name(), variable.label(), spec, threshold,
            scalePoints, thresholdCodes, thresholdLabels));
    }

    /**
     * Maps one source value to its derived value.
     *
     * @param recodedVariable
     *     The recoding.
     * @param missingCodes
     *     The source variable's non-substantive codes.
     * @param sourceValue
     *     The respondent's code for the source variable, or {@code null} if it is missing.
     *
     * @return 1 if the code is in the box, 0 if it is another substantive code, {@code null} otherwise.
     */
    public Integer recodeValue(RecodedVariable recodedVariable, MissingCodeSet missingCodes, Integer sourceValue) {
        if (!missingCodes.isSubstantive(sourceValue)) {
            return null;
        }
        if (recodedVariable.direction() == BoxDirection.TOP) {
            return recodedVariable.threshold() <= sourceValue ? 1 : 0;
        }
        return sourceValue <= recodedVariable.threshold() ? 1 : 0;
    }

    /**
     * Recodes every ordinal scale of a dataset that the configuration doesn't exclude.
     * <p>
     * The given dataset is not modified.  The derived variables are appended to a new dataset in the order of their
     * sources.
     * </p>
     *
     * @param dataset
     *     The classified dataset.  Only variables of kind {@link VariableKind#ORDINAL_SCALE} are recoded.
     * @param missingCodes
     *     The non-substantive codes of each variable.  A variable without an entry is assumed to have none.
     * @param config
     *     Which recoding to apply to each variable.
     *
     * @return The derived dataset with documentation of what was done.
     *
     * @throws NullPointerException
     *     if any argument is {@code null}.
     * @throws InvalidSurveyDataException
     *     if the name of a derived variable is already taken.
     */
    public RecodeResult recodeAll(SurveyDataset dataset, Map<String, MissingCodeSet> missingCodes,
        RecodingConfig config) {
        ArgumentUtil.checkNotNull(dataset, "dataset");
        ArgumentUtil.checkNotNull(missingCodes, "missingCodes");
        ArgumentUtil.checkNotNull(config, "config");

        WarningLog warnings = new WarningLog(logger);
        List<RecodedVariable> recodedVariables = new ArrayList<>();
        List<RecodeSkip> skips = new ArrayList<>();
        Map<String, MissingCodeSet> allMissingCodes = new LinkedHashMap<>();

        SurveyDataset derivedDataset = dataset;
        for (Variable variable : dataset.catalog().variables()) {
            MissingCodeSet variableMissingCodes = missingCodes.getOrDefault(variable.name(), MissingCodeSet.EMPTY);
            allMissingCodes.put(variable.name(), variableMissingCodes);

            if (variable.kind() != VariableKind.ORDINAL_SCALE || config.isExcluded(variable.name())) {
                continue;
            }

            RecodeOutcome outcome = recode(variable, variableMissingCodes, config.specFor(variable.name()));
            if (outcome.isSkipped()) {
                RecodeSkip skip = outcome.skip();
                skips.add(skip);
                warnings.add(WarningType.RECODE_SKIP, skip.variableName(), null, skip.reason());
                continue;
            }

            RecodedVariable recodedVariable = outcome.recodedVariable();
            if (derivedDataset.catalog().contains(recodedVariable.name())) {
                throw new InvalidSurveyDataException("cannot recode " + variable.name() + " as \"" +
                    recodedVariable.name() + "\" because a variable with that name already exists");
            }

            List<Integer> derivedValues = new ArrayList<>(dataset.observationCount());
            for (Integer sourceValue : dataset.column(variable.name())) {
                derivedValues.add(recodeValue(recodedVariable, variableMissingCodes, sourceValue));
            }
            derivedDataset = derivedDataset.withDerivedVariable(recodedVariable.variable(), derivedValues);
            recodedVariables.add(recodedVariable);
            allMissingCodes.put(recodedVariable.name(), MissingCodeSet.EMPTY);

            logger.debug("recoded {} as {} (threshold {}, {} scale points)", variable.name(), recodedVariable.name(),
                recodedVariable.threshold(), recodedVariable.scalePoints());
        }

        assert derivedDataset.observationCount() == dataset.observationCount() : "recoding changed the row count";

        logger.info("recoded {} variables, skipped {}", recodedVariables.size(), skips.size());
        return new RecodeResult(derivedDataset, recodedVariables, skips, allMissingCodes, warnings.warnings());
    }
}
