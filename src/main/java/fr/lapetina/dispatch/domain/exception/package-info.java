/**
 * Typed failures of the dispatch core.
 *
 * <ul>
 *   <li>{@link fr.lapetina.dispatch.domain.exception.InvalidInputException} - a strategy rejected its input</li>
 *   <li>{@link fr.lapetina.dispatch.domain.exception.StrategyNotFoundException} - unknown registry key</li>
 *   <li>{@link fr.lapetina.dispatch.domain.exception.MissingBindingException} - dispatcher without a strategy</li>
 * </ul>
 *
 * <p>All extend {@link fr.lapetina.dispatch.domain.exception.DispatchException} and carry an
 * {@link fr.lapetina.dispatch.domain.model.ErrorType}.
 */
package fr.lapetina.dispatch.domain.exception;
