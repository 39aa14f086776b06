/**
 * Issue rows and their repository.
 */
package io.github.yok.issuesync.model;
