package com.sharednotes.api.tags;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

public interface TagService {

	int MAXIMUM_NAME_LENGTH = 50;

	List<Tag> tags();

	Tag getTagById(Long id);

	Tag createTag(String name);

	Tag renameTag(Long id, String name);

	void deleteTag(Long id);

	/**
	 * @return the subset of {@code ids} naming tags that exist
	 */
	Set<Tag> existing(Collection<Long> ids);

	/**
	 * @return the tags attached to each of the given notes. notes without tags have no
	 * entry.
	 */
	Map<Long, Set<Tag>> tagsForNotes(Collection<Long> noteIds);

}
