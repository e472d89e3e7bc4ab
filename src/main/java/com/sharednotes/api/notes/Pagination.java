package com.sharednotes.api.notes;

import com.sharednotes.api.ValidationException;

/**
 * where a page sits within a result set. an empty result set is still page 1 of 1, and a
 * page past the end is legal: it is simply empty.
 */
public record Pagination(int currentPage, int totalPages, long totalNotes, int notesPerPage, boolean hasNext,
		boolean hasPrevious, long offset) {

	public static final int MAXIMUM_PAGE_SIZE = 100;

	public static Pagination of(long totalNotes, int page, int pageSize) {
		validate(page, pageSize);
		if (totalNotes < 0)
			throw new IllegalArgumentException("the total must not be negative");
		var totalPages = (int) Math.max(1, (totalNotes + pageSize - 1) / pageSize);
		return new Pagination(page, totalPages, totalNotes, pageSize, page < totalPages, page > 1,
				offset(page, pageSize));
	}

	public static void validate(int page, int pageSize) {
		if (page < 1)
			throw new ValidationException("the page must be at least 1, not " + page);
		if (pageSize < 1 || pageSize > MAXIMUM_PAGE_SIZE)
			throw new ValidationException(
					"the page size must be between 1 and " + MAXIMUM_PAGE_SIZE + ", not " + pageSize);
	}

	private static long offset(int page, int pageSize) {
		return (long) (page - 1) * pageSize;
	}

}
