package com.sharednotes.api.tags;

import java.time.OffsetDateTime;

/**
 * a label from the global catalog. names are unique, ignoring case.
 */
public record Tag(Long id, String name, OffsetDateTime created) {
}
