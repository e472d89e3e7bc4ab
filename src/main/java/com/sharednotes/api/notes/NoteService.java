package com.sharednotes.api.notes;

import org.jspecify.annotations.Nullable;

import java.util.Collection;
import java.util.List;

/**
 * the notes, their tags and their shares, always seen through the eyes of one user.
 * <p>
 * notes that are deleted, absent or not visible to the user are reported as
 * {@link com.sharednotes.api.NotFoundException not found}. visible notes the user does not
 * own yield {@link com.sharednotes.api.NoteAccessDeniedException access denied} for
 * anything but reads.
 */
public interface NoteService {

	int MAXIMUM_TITLE_LENGTH = 255;

	/**
	 * unknown tag ids are dropped. every share email is resolved before anything is
	 * written, and the note and its shares are stored atomically.
	 */
	Note createNote(String userId, String title, String content, @Nullable Collection<Long> tagIds,
			@Nullable Collection<String> shareEmails);

	/**
	 * {@code null} arguments leave the corresponding field unchanged; a non-null
	 * {@code tagIds} replaces the tags.
	 */
	Note updateNote(String userId, Long noteId, @Nullable String title, @Nullable String content,
			@Nullable Collection<Long> tagIds);

	void deleteNote(String userId, Long noteId);

	Note getNoteById(String userId, Long noteId);

	NotePage notes(String userId, Section section, int page, int pageSize, @Nullable Collection<Long> tagIds);

	/**
	 * every note the user owns or that was shared with them.
	 */
	NotePage allNotes(String userId, int page, int pageSize, @Nullable Collection<Long> tagIds);

	/**
	 * idempotent: sharing with somebody who already has access changes nothing.
	 * @return the shares of the note after the operation
	 */
	List<NoteShare> shareNote(String userId, Long noteId, Collection<String> emails);

	/**
	 * the owner sees every share of the note; a grantee only sees their own.
	 */
	List<NoteShare> shares(String userId, Long noteId);

	void removeShare(String userId, Long noteId, Long shareId);

	void removeShareByEmail(String userId, Long noteId, String email);

}
