/**
 * Shared utilities.
 */
package io.github.yok.issuesync.util;
