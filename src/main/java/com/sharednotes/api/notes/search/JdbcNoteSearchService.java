package com.sharednotes.api.notes.search;

import com.sharednotes.api.ApiProperties;
import com.sharednotes.api.notes.NotePage;
import com.sharednotes.api.notes.NoteSearchService;
import com.sharednotes.api.notes.SearchCriteria;
import com.sharednotes.api.notes.Section;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;

@Service
@Transactional(readOnly = true)
class JdbcNoteSearchService implements NoteSearchService {

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final VisibilityResolver visibilityResolver;

	private final NoteFilters noteFilters;

	private final NoteQueries noteQueries;

	private final ApiProperties.Search limits;

	JdbcNoteSearchService(VisibilityResolver visibilityResolver, NoteFilters noteFilters, NoteQueries noteQueries,
			ApiProperties properties) {
		this.visibilityResolver = visibilityResolver;
		this.noteFilters = noteFilters;
		this.noteQueries = noteQueries;
		this.limits = properties.search();
	}

	@Override
	public NotePage search(String userId, @Nullable String query, @Nullable Collection<Long> tagIds, Section section,
			int page, int pageSize) {
		var criteria = SearchCriteria.of(query, tagIds, section, page, pageSize, this.limits.minimumQueryLength(),
				this.limits.maximumTags());
		var candidates = this.visibilityResolver.resolve(userId, criteria.section());
		var predicate = this.noteFilters.apply(candidates, criteria.tagIds(), criteria.query());
		var result = this.noteQueries.page(predicate, criteria.page(), criteria.pageSize());
		this.log.debug("search by [{}] in {} for [{}] and tags {} found {} notes", userId, section, criteria.query(),
				criteria.tagIds(), result.pagination().totalNotes());
		return result;
	}

}
