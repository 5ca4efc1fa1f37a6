/**
 * Model core for the roster store.
 *
 * <p>This module is deliberately storage-neutral. It contains only:
 * <ul>
 *   <li>The roster item and subscription value types</li>
 *   <li>The address guard used before any identity is interned</li>
 *   <li>The exception hierarchy shared by every store implementation</li>
 * </ul>
 *
 * <p>Storage contracts live in the SPI module, engines in their own modules.
 */
package io.rosterstore.core;
