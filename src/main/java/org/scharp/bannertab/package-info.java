///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
/**
 * <p>
 * This library turns coded survey responses into banner tables with chi-square significance tests.
 * </p>
 *
 * <p>
 * See the documentation for {@link org.scharp.bannertab.BannerPipeline} for sample code on producing a banner table.
 * </p>
 *
 * <h2>A Banner Table Primer for Java Programmers</h2>
 *
 * <p>
 * A survey dataset has one row per respondent and one column per question (a "variable").  Answers are stored as
 * integer codes and each variable has "value labels" which say what the codes mean.  For example, a question "How
 * satisfied are you with our service?" might code "Very dissatisfied" as 1 through "Very satisfied" as 5, and also
 * have the code 99 for "Don't know".  Codes like 99 are <i>non-substantive</i>: they are answers, but not opinions, so
 * they are left out of every count and percentage.  This library finds them by looking for phrases such as "don't
 * know", "refused" or "n/a" in the value labels.
 * </p>
 *
 * <p>
 * Questions like the one above are called Likert scales (or ordinal scales).  Market researchers usually summarize
 * them as "top-2-box": the share of respondents who chose one of the two highest points of the scale.  This library
 * derives a 0/1 variable for each ordinal scale, named like {@code Q1_top2}, and keeps the original variable
 * unchanged.  On a 5-point scale the top-2-box threshold is 4; on a 0-10 scale it is 9.
 * </p>
 *
 * <p>
 * A banner table puts the questions in rows and splits the respondents into columns by one or more grouping questions,
 * such as region or age group, which are called "banner variables".  Each cell is a column percentage: of the
 * respondents in that column who gave a substantive answer (the "base"), what share gave this answer.  A leading
 * "Total" column holds everyone.  A banner category that has no respondents at all is hidden, and a non-substantive
 * banner category, such as "Refused", is never a column: those respondents only count in the Total column.  A column
 * whose respondents all skipped one question shows "—" for that question rather than 0%.
 * </p>
 *
 * <p>
 * For each question and each banner variable, a chi-square test of independence tells whether the differences between
 * the columns are likely to be real.  A p-value below 0.05 is flagged as significant, and one below 0.10 as marginal.
 * </p>
 *
 * <p>
 * Deciding which questions are ordinal scales is a heuristic.  A ranking question ("rank these five brands from 1 to
 * 5") has the same codes as a 5-point scale.  When the classifier is unsure, the pipeline can stop and ask, returning
 * a {@link org.scharp.bannertab.PendingDecision} and resuming when it is given a
 * {@link org.scharp.bannertab.DecisionRecord}.
 * </p>
 *
 * <h2>Error Handling Strategy</h2>
 * <p>
 * Only data which can't be interpreted at all is an error.  This includes observations with the wrong number of
 * values, duplicate variable names, and banner variables that aren't in the survey.  Such problems throw an
 * {@link org.scharp.bannertab.InvalidSurveyDataException} as soon as they are found (fail-fast) and nothing is
 * produced.  Programming errors, such as {@code null} arguments, throw the usual runtime exceptions.
 * </p>
 *
 * <p>
 * Everything else is a {@link org.scharp.bannertab.PipelineWarning}: an uncertain classification, a scale that was too
 * short to recode, an empty banner column, a question that no one in a column answered, a contingency table that
 * can't be tested, or a test with small expected frequencies.  Each warning is logged through SLF4J when it is raised
 * and kept in the output, so that nothing that was skipped goes unreported.
 * </p>
 */
package org.scharp.bannertab;
