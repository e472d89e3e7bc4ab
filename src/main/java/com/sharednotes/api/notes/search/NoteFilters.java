package com.sharednotes.api.notes.search;

import com.sharednotes.api.utils.CollectionUtils;
import com.sharednotes.api.utils.JdbcUtils;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * narrows a candidate set by tags and by text.
 * <p>
 * the tag filter has AND semantics: a note must carry every requested tag. ids that name
 * no tag still count towards the requirement, so they can never be satisfied.
 * <p>
 * the text filter ORs a full-text match on title and content with a case-insensitive
 * substring match, so partial words are found too.
 */
@Component
public class NoteFilters {

	static final String TEXT_SEARCH_CONFIGURATION = "english";

	public NotePredicate apply(NotePredicate candidates, @Nullable Collection<Long> tagIds, @Nullable String query) {
		var filtered = candidates;
		var tags = CollectionUtils.distinct(tagIds);
		if (!tags.isEmpty())
			filtered = filtered.and(this.taggedWithAll(tags));
		if (StringUtils.hasText(query))
			filtered = filtered.and(this.matching(query.trim()));
		return filtered;
	}

	NotePredicate taggedWithAll(Collection<Long> tagIds) {
		var placeholders = String.join(", ", Collections.nCopies(tagIds.size(), "?"));
		var sql = """
				n.id in (
					select nt.note_id from note_tag nt
					where nt.tag_id in (%s)
					group by nt.note_id
					having count(distinct nt.tag_id) = ?
				)""".formatted(placeholders);
		var parameters = new ArrayList<Object>(tagIds);
		parameters.add(tagIds.size());
		return new NotePredicate(sql, parameters);
	}

	NotePredicate matching(String query) {
		var pattern = "%" + JdbcUtils.likeLiteral(query) + "%";
		var sql = "n.search_vector @@ plainto_tsquery('" + TEXT_SEARCH_CONFIGURATION + "', ?)"
				+ " or n.title ilike ? or n.content ilike ?";
		return new NotePredicate(sql, List.of(query, pattern, pattern));
	}

}
