/**
 * Immutable results of a realization: {@link com.phillippitts.figuredbass.domain.Possibility}
 * (one chord), {@link com.phillippitts.figuredbass.domain.IndexProgression} (a path of
 * realization indices) and {@link com.phillippitts.figuredbass.domain.Progression} (the path
 * resolved to possibilities).
 *
 * @since 1.0
 */
package com.phillippitts.figuredbass.domain;
