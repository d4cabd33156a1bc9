package com.memic.sdk.model;

import org.springframework.lang.Nullable;

/**
 * Column metadata of a structured result.
 *
 * @param name        column name
 * @param type        column data type, e.g. {@code varchar} or {@code integer}
 * @param description human-readable description, if any
 */
public record ColumnInfo(String name, String type, @Nullable String description) {
}
