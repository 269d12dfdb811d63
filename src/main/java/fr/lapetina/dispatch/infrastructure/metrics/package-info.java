/**
 * Micrometer instrumentation for strategy invocations, exported in Prometheus format.
 *
 * <p>{@link fr.lapetina.dispatch.infrastructure.metrics.MeteredStrategy} wraps any strategy, so
 * dispatchers and registries stay free of metrics code.
 */
package fr.lapetina.dispatch.infrastructure.metrics;
