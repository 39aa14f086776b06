/**
 * Versioned store abstraction and its Dolt implementation.
 */
package io.github.yok.issuesync.store;
