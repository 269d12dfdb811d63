/**
 * Reference discount strategies.
 *
 * <p>Each strategy owns its construction parameters and its own policy for negative amounts,
 * so the same input can be rejected by one strategy and accepted by another. Dispatchers never
 * apply such a policy themselves.
 */
package fr.lapetina.dispatch.domain.strategy.discount;
