package com.sharednotes.api;

/**
 * raised for records that don't exist <em>and</em> for records the caller may not see.
 * the two cases are reported identically.
 */
public class NotFoundException extends SharedNotesException {

	public NotFoundException(String type, Object id) {
		super(type + " [" + id + "] not found");
	}

	@Override
	public String code() {
		return "NOT_FOUND";
	}

}
