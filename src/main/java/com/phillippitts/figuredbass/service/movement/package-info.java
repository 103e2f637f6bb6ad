/**
 * Consecutive voice-leading rules and the movements they allow between two slots.
 */
package com.phillippitts.figuredbass.service.movement;
