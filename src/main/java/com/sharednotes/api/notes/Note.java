package com.sharednotes.api.notes;

import com.sharednotes.api.tags.Tag;

import java.time.OffsetDateTime;
import java.util.Set;

/**
 * a note, owned by exactly one user. deleted notes keep their row but are invisible to
 * every query.
 */
public record Note(Long id, String ownerId, String title, String content, Set<Tag> tags, boolean deleted,
		OffsetDateTime created, OffsetDateTime updated) {

	public boolean ownedBy(String userId) {
		return this.ownerId.equals(userId);
	}

}
