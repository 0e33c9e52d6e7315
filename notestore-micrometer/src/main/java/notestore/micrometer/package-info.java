/**
 * Micrometer bridge for {@link notestore.spi.MetricsExporter}.
 */
package notestore.micrometer;
