/**
 * Helpers shared by the roster store test suites.
 */
package io.rosterstore.testkit;
