package com.sharednotes.api;

/**
 * root of the client-facing failures raised by the notes, tags and directory modules. the
 * {@link GraphQlExceptionAdvice advice} maps each subtype to a GraphQL error type.
 */
public abstract class SharedNotesException extends RuntimeException {

	protected SharedNotesException(String message) {
		super(message);
	}

	/**
	 * stable, machine-readable code surfaced as the {@code code} extension of the error.
	 */
	public abstract String code();

}
