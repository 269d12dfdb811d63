/**
 * Shared value types for the dispatch core.
 *
 * <p>{@link fr.lapetina.dispatch.domain.model.ErrorType} categorizes every failure the core
 * can signal, so metrics and calling code can react per category rather than per exception class.
 *
 * @see fr.lapetina.dispatch.domain.exception.DispatchException
 */
package fr.lapetina.dispatch.domain.model;
