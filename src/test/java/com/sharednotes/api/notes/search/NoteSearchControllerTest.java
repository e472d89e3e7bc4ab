package com.sharednotes.api.notes.search;

import com.sharednotes.api.ApiProperties;
import com.sharednotes.api.notes.NotePage;
import com.sharednotes.api.notes.NoteSearchService;
import com.sharednotes.api.notes.Pagination;
import com.sharednotes.api.notes.Section;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.security.authentication.TestingAuthenticationToken;

import java.time.Duration;
import java.util.List;

class NoteSearchControllerTest {

	@Test
	void searchesAsTheCallerWithDefaultPaging() {
		var searchService = Mockito.mock(NoteSearchService.class);
		var properties = new ApiProperties(new ApiProperties.Cache(10, Duration.ofMinutes(1)), null,
				new ApiProperties.Search(2, 10), new ApiProperties.Pagination(15));
		var controller = new NoteSearchController(searchService, properties);
		var page = new NotePage(List.of(), Pagination.of(0, 1, 15));
		Mockito.when(searchService.search("alice", "milk", List.of(4L), Section.PRIVATE, 1, 15)).thenReturn(page);

		var result = controller.searchNotes("milk", List.of("4"), "my-notes", null, null,
				new TestingAuthenticationToken("alice", "n/a"));
		Assertions.assertSame(page, result);
	}

}
