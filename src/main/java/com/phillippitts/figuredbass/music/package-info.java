/**
 * Spelled pitch and interval value types used throughout the realizer.
 *
 * <p>{@link com.phillippitts.figuredbass.music.Pitch} keeps its spelling (F# and G- are distinct
 * values) while {@link com.phillippitts.figuredbass.music.Pitch#midi()} gives the sounding pitch.
 * {@link com.phillippitts.figuredbass.music.Interval} transposes with correct spelling, which the
 * resolution rules depend on.
 *
 * @since 1.0
 */
package com.phillippitts.figuredbass.music;
