package com.sharednotes.api.notes;

import com.sharednotes.api.ValidationException;
import com.sharednotes.api.utils.CollectionUtils;
import org.jspecify.annotations.Nullable;
import org.springframework.util.StringUtils;

import java.util.Collection;
import java.util.Set;

/**
 * a validated search request. at least one of the text query or the tag filter is
 * present.
 *
 * @param query the trimmed text query, or {@code null}
 * @param tagIds the distinct tags a note must <em>all</em> carry
 */
public record SearchCriteria(@Nullable String query, Set<Long> tagIds, Section section, int page, int pageSize) {

	public static SearchCriteria of(@Nullable String query, @Nullable Collection<Long> tagIds, Section section,
			int page, int pageSize, int minimumQueryLength, int maximumTags) {
		Pagination.validate(page, pageSize);
		var trimmed = StringUtils.hasText(query) ? query.trim() : null;
		var tags = CollectionUtils.distinct(tagIds);
		if (trimmed == null && tags.isEmpty())
			throw new ValidationException("a search needs a query or at least one tag");
		if (trimmed != null && trimmed.length() < minimumQueryLength)
			throw new ValidationException(
					"the search query must be at least " + minimumQueryLength + " characters long");
		if (tags.size() > maximumTags)
			throw new ValidationException("a search can filter by at most " + maximumTags + " tags");
		return new SearchCriteria(trimmed, Set.copyOf(tags), section, page, pageSize);
	}

}
