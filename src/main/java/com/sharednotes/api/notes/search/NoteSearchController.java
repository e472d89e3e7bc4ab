package com.sharednotes.api.notes.search;

import com.sharednotes.api.ApiProperties;
import com.sharednotes.api.notes.NotePage;
import com.sharednotes.api.notes.NoteSearchService;
import com.sharednotes.api.notes.Section;
import com.sharednotes.api.utils.IdUtils;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.QueryMapping;
import org.springframework.stereotype.Controller;

import java.security.Principal;
import java.util.List;

@Controller
class NoteSearchController {

	private final NoteSearchService searchService;

	private final int defaultPageSize;

	NoteSearchController(NoteSearchService searchService, ApiProperties properties) {
		this.searchService = searchService;
		this.defaultPageSize = properties.pagination().defaultPageSize();
	}

	@QueryMapping
	NotePage searchNotes(@Argument String query, @Argument List<String> tagIds, @Argument String section,
			@Argument Integer page, @Argument Integer pageSize, Principal principal) {
		return this.searchService.search(principal.getName(), query, IdUtils.parse(tagIds, "tag"),
				Section.of(section), page == null ? 1 : page, pageSize == null ? this.defaultPageSize : pageSize);
	}

}
