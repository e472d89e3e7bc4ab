package com.sharednotes.api;

/**
 * the directory has no user for the given share target.
 */
public class UnresolvedIdentityException extends SharedNotesException {

	private final String target;

	public UnresolvedIdentityException(String target) {
		super("no user found for [" + target + "]");
		this.target = target;
	}

	public String target() {
		return this.target;
	}

	@Override
	public String code() {
		return "UNRESOLVED_IDENTITY";
	}

}
