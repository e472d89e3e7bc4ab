package com.sharednotes.api;

/**
 * malformed identifiers, out-of-range pagination, missing search criteria, unknown
 * sections and the like.
 */
public class ValidationException extends SharedNotesException {

	public ValidationException(String message) {
		super(message);
	}

	@Override
	public String code() {
		return "VALIDATION";
	}

}
