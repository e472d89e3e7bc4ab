package com.sharednotes.api;

/**
 * the note is visible to the caller, but the requested action needs ownership.
 */
public class NoteAccessDeniedException extends SharedNotesException {

	public NoteAccessDeniedException(Long noteId, String action) {
		super("only the owner of note [" + noteId + "] may " + action + " it");
	}

	@Override
	public String code() {
		return "ACCESS_DENIED";
	}

}
