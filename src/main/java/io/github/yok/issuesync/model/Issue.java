package io.github.yok.issuesync.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

/**
 * A row of the {@code issues} table.
 *
 * <p>
 * {@code id} is immutable once created. A child issue's ID is {@code <parent-id>.<suffix>}.
 * {@code wispType} is {@code null} when the column has not been added yet.
 * </p>
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "title", "status", "ephemeral", "pinned", "wispType"})
public class Issue {

    String id;

    String title;

    String status;

    boolean ephemeral;

    boolean pinned;

    String wispType;
}
