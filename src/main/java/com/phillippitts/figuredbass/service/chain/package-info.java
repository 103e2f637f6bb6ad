/**
 * The realization chain: one {@link com.phillippitts.figuredbass.service.chain.ChordSlot} per bass
 * note, each holding its realizations and the adjacency to the next slot.
 *
 * <p>{@link com.phillippitts.figuredbass.service.chain.ChainBuilder} fills a chain in the order
 * UNBUILT, REALIZATIONS_BUILT, MOVEMENTS_BUILT, PRUNED. Only a pruned chain answers
 * count, enumeration and sampling queries.
 *
 * @since 1.0
 */
package com.phillippitts.figuredbass.service.chain;
