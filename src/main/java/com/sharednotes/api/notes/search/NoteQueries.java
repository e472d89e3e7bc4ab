package com.sharednotes.api.notes.search;

import com.sharednotes.api.notes.Note;
import com.sharednotes.api.notes.NotePage;
import com.sharednotes.api.notes.Pagination;
import com.sharednotes.api.tags.TagService;
import com.sharednotes.api.utils.CollectionUtils;
import com.sharednotes.api.utils.JdbcUtils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Set;

/**
 * renders {@link NotePredicate predicates} into SQL and materialises the matching notes,
 * newest first. only the requested page is ever loaded.
 */
@Component
public class NoteQueries {

	private static final String ORDER = " order by n.updated desc, n.id desc ";

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final RowMapper<NoteRow> noteRowMapper = new NoteRowMapper();

	private final JdbcClient db;

	private final TagService tagService;

	NoteQueries(JdbcClient db, TagService tagService) {
		this.db = db;
		this.tagService = tagService;
	}

	public long count(NotePredicate predicate) {
		return this.db //
			.sql("select count(*) from note n where " + predicate.sql()) //
			.params(predicate.parameters()) //
			.query(Long.class) //
			.single();
	}

	public NotePage page(NotePredicate predicate, int page, int pageSize) {
		var total = this.count(predicate);
		var pagination = Pagination.of(total, page, pageSize);
		if (pagination.offset() >= total) {
			this.log.debug("page {} is past the last of {} notes", page, total);
			return new NotePage(List.of(), pagination);
		}
		var parameters = new ArrayList<>(predicate.parameters());
		parameters.add(pageSize);
		parameters.add(pagination.offset());
		var rows = this.db //
			.sql("select n.* from note n where " + predicate.sql() + ORDER + " limit ? offset ?") //
			.params(parameters) //
			.query(this.noteRowMapper) //
			.list();
		return new NotePage(this.withTags(rows), pagination);
	}

	public @Nullable Note single(NotePredicate predicate) {
		var rows = this.db //
			.sql("select n.* from note n where " + predicate.sql() + ORDER) //
			.params(predicate.parameters()) //
			.query(this.noteRowMapper) //
			.list();
		return CollectionUtils.firstOrNull(this.withTags(rows));
	}

	private List<Note> withTags(List<NoteRow> rows) {
		var tags = this.tagService.tagsForNotes(rows.stream().map(NoteRow::id).toList());
		return rows //
			.stream() //
			.map(row -> new Note(row.id(), row.ownerId(), row.title(), row.content(),
					tags.getOrDefault(row.id(), Set.of()), row.deleted(), row.created(), row.updated())) //
			.toList();
	}

	private record NoteRow(Long id, String ownerId, String title, String content, boolean deleted,
			OffsetDateTime created, OffsetDateTime updated) {
	}

	private static class NoteRowMapper implements RowMapper<NoteRow> {

		@Override
		public NoteRow mapRow(ResultSet rs, int rowNum) throws SQLException {
			return new NoteRow(rs.getLong("id"), rs.getString("owner_id"), rs.getString("title"),
					rs.getString("content"), rs.getBoolean("deleted"), JdbcUtils.timestamp(rs, "created"),
					JdbcUtils.timestamp(rs, "updated"));
		}

	}

}
