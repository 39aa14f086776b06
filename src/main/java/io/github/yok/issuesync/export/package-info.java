/**
 * Flat-file export of the issue table.
 */
package io.github.yok.issuesync.export;
