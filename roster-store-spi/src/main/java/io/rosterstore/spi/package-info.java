/**
 * Storage SPI for versioned rosters.
 *
 * <p>The SPI is blocking and minimal, intended to be run by the server's roster layer on worker
 * threads sized to the backing engine's writer limits.
 */
package io.rosterstore.spi;
