package com.sharednotes.api.notes;

public enum NoteAccess {

	/**
	 * read, write, delete and share.
	 */
	OWNER,

	/**
	 * read only.
	 */
	GRANTEE;

	public static NoteAccess of(Note note, String userId) {
		return note.ownedBy(userId) ? OWNER : GRANTEE;
	}

}
