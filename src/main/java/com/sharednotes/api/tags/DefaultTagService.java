package com.sharednotes.api.tags;

import com.sharednotes.api.NotFoundException;
import com.sharednotes.api.ValidationException;
import com.sharednotes.api.utils.CollectionUtils;
import com.sharednotes.api.utils.JdbcUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
@Transactional
class DefaultTagService implements TagService {

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final RowMapper<Tag> tagRowMapper = new TagRowMapper();

	private final JdbcClient db;

	DefaultTagService(JdbcClient db) {
		this.db = db;
	}

	@Override
	public List<Tag> tags() {
		return this.db //
			.sql("select * from tag order by lower(name), id") //
			.query(this.tagRowMapper) //
			.list();
	}

	@Override
	public Tag getTagById(Long id) {
		var tag = CollectionUtils.firstOrNull(this.db //
			.sql("select * from tag where id = ?") //
			.params(id) //
			.query(this.tagRowMapper) //
			.list());
		if (tag == null)
			throw new NotFoundException("tag", id);
		return tag;
	}

	@Override
	public Tag createTag(String name) {
		var normalized = normalize(name);
		var kh = new GeneratedKeyHolder();
		try {
			this.db.sql("insert into tag (name) values (?)").params(normalized).update(kh, "id");
		} //
		catch (DuplicateKeyException e) {
			throw new ValidationException("a tag named [" + normalized + "] already exists");
		}
		var id = JdbcUtils.getIdFromKeyHolder(kh).longValue();
		this.log.info("created tag [{}] with id {}", normalized, id);
		return this.getTagById(id);
	}

	@Override
	public Tag renameTag(Long id, String name) {
		var normalized = normalize(name);
		var updated = 0;
		try {
			updated = this.db.sql("update tag set name = ? where id = ?").params(normalized, id).update();
		} //
		catch (DuplicateKeyException e) {
			throw new ValidationException("a tag named [" + normalized + "] already exists");
		}
		if (updated == 0)
			throw new NotFoundException("tag", id);
		this.log.info("renamed tag {} to [{}]", id, normalized);
		return this.getTagById(id);
	}

	@Override
	public void deleteTag(Long id) {
		// note_tag rows go with it (on delete cascade)
		var deleted = this.db.sql("delete from tag where id = ?").params(id).update();
		if (deleted == 0)
			throw new NotFoundException("tag", id);
		this.log.info("deleted tag {}", id);
	}

	@Override
	public Set<Tag> existing(Collection<Long> ids) {
		var distinct = CollectionUtils.distinct(ids);
		if (distinct.isEmpty())
			return Set.of();
		return new LinkedHashSet<>(this.db //
			.sql("select * from tag where id in (:ids) order by lower(name), id") //
			.param("ids", distinct) //
			.query(this.tagRowMapper) //
			.list());
	}

	@Override
	public Map<Long, Set<Tag>> tagsForNotes(Collection<Long> noteIds) {
		var distinct = CollectionUtils.distinct(noteIds);
		var tagsByNote = new HashMap<Long, Set<Tag>>();
		if (distinct.isEmpty())
			return tagsByNote;
		this.db //
			.sql("""
					select nt.note_id, t.*
					from note_tag nt join tag t on t.id = nt.tag_id
					where nt.note_id in (:noteIds)
					order by lower(t.name), t.id
					""") //
			.param("noteIds", distinct) //
			.query((RowCallbackHandler) rs -> tagsByNote
				.computeIfAbsent(rs.getLong("note_id"), noteId -> new LinkedHashSet<>())
				.add(this.tagRowMapper.mapRow(rs, rs.getRow())));
		return tagsByNote;
	}

	private static String normalize(String name) {
		var trimmed = name == null ? "" : name.trim();
		if (!StringUtils.hasText(trimmed))
			throw new ValidationException("the tag name must not be empty");
		if (trimmed.length() > MAXIMUM_NAME_LENGTH)
			throw new ValidationException("the tag name must be at most " + MAXIMUM_NAME_LENGTH + " characters");
		return trimmed;
	}

	private static class TagRowMapper implements RowMapper<Tag> {

		@Override
		public Tag mapRow(ResultSet rs, int rowNum) throws SQLException {
			return new Tag(rs.getLong("id"), rs.getString("name"), JdbcUtils.timestamp(rs, "created"));
		}

	}

}
