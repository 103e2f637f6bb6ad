/**
 * Realization exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.figuredbass.exception.FiguredBassException} - Base exception
 *       for all realization errors</li>
 *   <li>{@link com.phillippitts.figuredbass.exception.InvalidInputException} - Request rejected
 *       before any slot is built (empty bass line or voice list, malformed pitch)</li>
 *   <li>{@link com.phillippitts.figuredbass.exception.InvalidNotationException} - Figure string
 *       could not be parsed</li>
 *   <li>{@link com.phillippitts.figuredbass.exception.SlotInfeasibleException} - One slot has no
 *       legal realization on its own</li>
 *   <li>{@link com.phillippitts.figuredbass.exception.ChainInfeasibleException} - Every slot is
 *       satisfiable but pruning left no end-to-end path</li>
 *   <li>{@link com.phillippitts.figuredbass.exception.ChainNotReadyException} - Chain used out of
 *       lifecycle order</li>
 *   <li>{@link com.phillippitts.figuredbass.exception.RealizationLimitExceededException} - Slot
 *       search hit the configured cap</li>
 * </ul>
 *
 * <p>All exceptions are unchecked and carry the slot context needed to locate the
 * offending bass note or figure. Rule violations found while generating candidates are
 * not exceptions; such candidates are simply excluded.
 *
 * @see com.phillippitts.figuredbass.exception.RealizationExceptionBuilder
 * @since 1.0
 */
package com.phillippitts.figuredbass.exception;
