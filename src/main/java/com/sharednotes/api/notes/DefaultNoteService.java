package com.sharednotes.api.notes;

import com.sharednotes.api.NotFoundException;
import com.sharednotes.api.NoteAccessDeniedException;
import com.sharednotes.api.UnresolvedIdentityException;
import com.sharednotes.api.ValidationException;
import com.sharednotes.api.directory.DirectoryService;
import com.sharednotes.api.notes.search.NoteFilters;
import com.sharednotes.api.notes.search.NotePredicate;
import com.sharednotes.api.notes.search.NoteQueries;
import com.sharednotes.api.notes.search.VisibilityResolver;
import com.sharednotes.api.tags.TagService;
import com.sharednotes.api.utils.CollectionUtils;
import com.sharednotes.api.utils.JdbcUtils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Service
@Transactional
class DefaultNoteService implements NoteService {

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final RowMapper<NoteShare> shareRowMapper = new NoteShareRowMapper();

	private final JdbcClient db;

	private final TagService tagService;

	private final DirectoryService directoryService;

	private final VisibilityResolver visibilityResolver;

	private final NoteFilters noteFilters;

	private final NoteQueries noteQueries;

	private final ApplicationEventPublisher publisher;

	DefaultNoteService(JdbcClient db, TagService tagService, DirectoryService directoryService,
			VisibilityResolver visibilityResolver, NoteFilters noteFilters, NoteQueries noteQueries,
			ApplicationEventPublisher publisher) {
		this.db = db;
		this.tagService = tagService;
		this.directoryService = directoryService;
		this.visibilityResolver = visibilityResolver;
		this.noteFilters = noteFilters;
		this.noteQueries = noteQueries;
		this.publisher = publisher;
	}

	@Override
	public Note createNote(String userId, String title, String content, @Nullable Collection<Long> tagIds,
			@Nullable Collection<String> shareEmails) {
		var validTitle = validTitle(title);
		var validContent = validContent(content);
		// resolve every share target before anything is written
		var grantees = this.resolveGrantees(userId, shareEmails);
		var kh = new GeneratedKeyHolder();
		this.db.sql("insert into note (owner_id, title, content) values (?, ?, ?)")
			.params(userId, validTitle, validContent)
			.update(kh, "id");
		var noteId = JdbcUtils.getIdFromKeyHolder(kh).longValue();
		this.attachTags(noteId, tagIds);
		var shares = grantees.values().stream().map(granteeId -> this.insertShare(noteId, userId, granteeId)).toList();
		var note = this.getNoteById(userId, noteId);
		this.log.info("created note {} for [{}] with {} tags and {} shares", noteId, userId, note.tags().size(),
				shares.size());
		this.publisher.publishEvent(new NoteCreatedEvent(note));
		for (var share : shares)
			if (share != null)
				this.publisher.publishEvent(new NoteSharedEvent(share));
		return note;
	}

	@Override
	public Note updateNote(String userId, Long noteId, @Nullable String title, @Nullable String content,
			@Nullable Collection<Long> tagIds) {
		var note = this.ownedNote(userId, noteId, "update");
		var newTitle = title == null ? note.title() : validTitle(title);
		var newContent = content == null ? note.content() : validContent(content);
		this.db.sql("update note set title = ?, content = ?, updated = now() where id = ?")
			.params(newTitle, newContent, noteId)
			.update();
		if (tagIds != null) {
			this.db.sql("delete from note_tag where note_id = ?").params(noteId).update();
			this.attachTags(noteId, tagIds);
		}
		var updated = this.getNoteById(userId, noteId);
		this.log.debug("updated note {}", noteId);
		this.publisher.publishEvent(new NoteUpdatedEvent(updated));
		return updated;
	}

	@Override
	public void deleteNote(String userId, Long noteId) {
		this.ownedNote(userId, noteId, "delete");
		this.db.sql("update note set deleted = true, updated = now() where id = ?").params(noteId).update();
		this.log.info("deleted note {} owned by [{}]", noteId, userId);
		this.publisher.publishEvent(new NoteDeletedEvent(noteId, userId));
	}

	@Override
	public Note getNoteById(String userId, Long noteId) {
		var note = this.noteQueries.single(this.visibilityResolver.accessible(userId).and(NotePredicate.withId(noteId)));
		if (note == null)
			throw new NotFoundException("note", noteId);
		return note;
	}

	@Override
	@Transactional(readOnly = true)
	public NotePage notes(String userId, Section section, int page, int pageSize, @Nullable Collection<Long> tagIds) {
		Pagination.validate(page, pageSize);
		var candidates = this.visibilityResolver.resolve(userId, section);
		return this.noteQueries.page(this.noteFilters.apply(candidates, tagIds, null), page, pageSize);
	}

	@Override
	@Transactional(readOnly = true)
	public NotePage allNotes(String userId, int page, int pageSize, @Nullable Collection<Long> tagIds) {
		Pagination.validate(page, pageSize);
		var candidates = this.visibilityResolver.accessible(userId);
		return this.noteQueries.page(this.noteFilters.apply(candidates, tagIds, null), page, pageSize);
	}

	@Override
	public List<NoteShare> shareNote(String userId, Long noteId, Collection<String> emails) {
		this.ownedNote(userId, noteId, "share");
		if (CollectionUtils.distinct(emails).isEmpty())
			throw new ValidationException("at least one email is required to share a note");
		var grantees = this.resolveGrantees(userId, emails);
		for (var granteeId : grantees.values()) {
			var share = this.insertShare(noteId, userId, granteeId);
			if (share != null) {
				this.log.info("shared note {} with [{}]", noteId, granteeId);
				this.publisher.publishEvent(new NoteSharedEvent(share));
			}
		}
		return this.sharesForNote(noteId);
	}

	@Override
	@Transactional(readOnly = true)
	public List<NoteShare> shares(String userId, Long noteId) {
		var note = this.getNoteById(userId, noteId);
		if (note.ownedBy(userId))
			return this.sharesForNote(noteId);
		return this.db //
			.sql("select * from note_share where note_id = ? and grantee_id = ? order by created, id") //
			.params(noteId, userId) //
			.query(this.shareRowMapper) //
			.list();
	}

	@Override
	public void removeShare(String userId, Long noteId, Long shareId) {
		this.ownedNote(userId, noteId, "unshare");
		var share = CollectionUtils.firstOrNull(this.db //
			.sql("select * from note_share where id = ? and note_id = ?") //
			.params(shareId, noteId) //
			.query(this.shareRowMapper) //
			.list());
		if (share == null)
			throw new NotFoundException("share", shareId);
		this.deleteShare(share);
	}

	@Override
	public void removeShareByEmail(String userId, Long noteId, String email) {
		this.ownedNote(userId, noteId, "unshare");
		if (!StringUtils.hasText(email))
			throw new ValidationException("the email is required");
		var granteeId = this.directoryService.userIdForEmail(email.trim());
		if (granteeId == null)
			throw new UnresolvedIdentityException(email.trim());
		var share = CollectionUtils.firstOrNull(this.db //
			.sql("select * from note_share where note_id = ? and grantee_id = ?") //
			.params(noteId, granteeId) //
			.query(this.shareRowMapper) //
			.list());
		if (share == null)
			throw new NotFoundException("share for", email.trim());
		this.deleteShare(share);
	}

	private void deleteShare(NoteShare share) {
		this.db.sql("delete from note_share where id = ?").params(share.id()).update();
		this.log.info("removed share {} of note {} with [{}]", share.id(), share.noteId(), share.granteeId());
		this.publisher.publishEvent(new NoteUnsharedEvent(share));
	}

	private List<NoteShare> sharesForNote(Long noteId) {
		return this.db //
			.sql("select * from note_share where note_id = ? order by created, id") //
			.params(noteId) //
			.query(this.shareRowMapper) //
			.list();
	}

	/**
	 * @return the new share, or {@code null} if the grantee already had one
	 */
	private @Nullable NoteShare insertShare(Long noteId, String granterId, String granteeId) {
		return CollectionUtils.firstOrNull(this.db //
			.sql("""
					insert into note_share (note_id, granter_id, grantee_id) values (?, ?, ?)
					on conflict (note_id, grantee_id) do nothing
					returning *
					""") //
			.params(noteId, granterId, granteeId) //
			.query(this.shareRowMapper) //
			.list());
	}

	private void attachTags(Long noteId, @Nullable Collection<Long> tagIds) {
		var known = this.tagService.existing(CollectionUtils.distinct(tagIds));
		if (tagIds != null && known.size() < CollectionUtils.distinct(tagIds).size())
			this.log.debug("ignoring unknown tags for note {}: requested {}, found {}", noteId, tagIds, known);
		for (var tag : known)
			this.db.sql("insert into note_tag (note_id, tag_id) values (?, ?) on conflict do nothing")
				.params(noteId, tag.id())
				.update();
	}

	/**
	 * share targets, by normalized email. fails on the first target that can't be
	 * resolved.
	 */
	private Map<String, String> resolveGrantees(String ownerId, @Nullable Collection<String> emails) {
		var grantees = new LinkedHashMap<String, String>();
		for (var email : CollectionUtils.distinct(emails)) {
			if (!StringUtils.hasText(email))
				throw new ValidationException("share emails must not be empty");
			var normalized = email.trim().toLowerCase(Locale.ROOT);
			if (grantees.containsKey(normalized))
				continue;
			var granteeId = this.directoryService.userIdForEmail(normalized);
			if (granteeId == null)
				throw new UnresolvedIdentityException(email.trim());
			if (granteeId.equals(ownerId))
				throw new ValidationException("a note can not be shared with its owner");
			grantees.put(normalized, granteeId);
		}
		return grantees;
	}

	private Note ownedNote(String userId, Long noteId, String action) {
		var note = this.getNoteById(userId, noteId);
		if (!note.ownedBy(userId))
			throw new NoteAccessDeniedException(noteId, action);
		return note;
	}

	private static String validTitle(String title) {
		var trimmed = title == null ? "" : title.trim();
		if (trimmed.isEmpty())
			throw new ValidationException("the title must not be empty");
		if (trimmed.length() > MAXIMUM_TITLE_LENGTH)
			throw new ValidationException("the title must be at most " + MAXIMUM_TITLE_LENGTH + " characters");
		return trimmed;
	}

	private static String validContent(String content) {
		if (!StringUtils.hasText(content))
			throw new ValidationException("the content must not be empty");
		return content;
	}

	private static class NoteShareRowMapper implements RowMapper<NoteShare> {

		@Override
		public NoteShare mapRow(ResultSet rs, int rowNum) throws SQLException {
			return new NoteShare(rs.getLong("id"), rs.getLong("note_id"), rs.getString("granter_id"),
					rs.getString("grantee_id"), JdbcUtils.timestamp(rs, "created"));
		}

	}

}

record NoteCreatedEvent(Note note) {
}

record NoteUpdatedEvent(Note note) {
}

record NoteDeletedEvent(Long noteId, String ownerId) {
}

record NoteSharedEvent(NoteShare share) {
}

record NoteUnsharedEvent(NoteShare share) {
}
