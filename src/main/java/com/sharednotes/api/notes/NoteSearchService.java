package com.sharednotes.api.notes;

import org.jspecify.annotations.Nullable;

import java.util.Collection;

public interface NoteSearchService {

	/**
	 * searches one section of the user's notes by text, by tags, or both.
	 * @throws com.sharednotes.api.ValidationException if neither a query nor tags are
	 * given, or the paging is out of range
	 */
	NotePage search(String userId, @Nullable String query, @Nullable Collection<Long> tagIds, Section section,
			int page, int pageSize);

}
