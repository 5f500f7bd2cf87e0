/**
 * Pool metrics backed by Micrometer, exported in Prometheus format by default.
 */
package fr.lapetina.zmq.msgio.infrastructure.metrics;
