package com.sharednotes.api.notes;

import java.time.OffsetDateTime;

/**
 * grants the {@code granteeId} read access to a note owned by {@code granterId}.
 */
public record NoteShare(Long id, Long noteId, String granterId, String granteeId, OffsetDateTime created) {
}
