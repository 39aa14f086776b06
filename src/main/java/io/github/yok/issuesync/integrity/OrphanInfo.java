package io.github.yok.issuesync.integrity;

import lombok.Value;

/**
 * Projection of a child issue whose encoded parent does not exist.
 *
 * <p>
 * Built fresh for every detection query; never persisted.
 * </p>
 */
@Value
public class OrphanInfo {

    String id;

    String title;

    String status;
}
