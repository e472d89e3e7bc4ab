package com.sharednotes.api.tags;

import com.sharednotes.api.utils.IdUtils;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.MutationMapping;
import org.springframework.graphql.data.method.annotation.QueryMapping;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.stereotype.Controller;

import java.util.Collection;

/**
 * every user may read the catalog. it is shared by all users, so only catalog
 * administrators may change it.
 */
@Controller
class TagController {

	static final String CATALOG_ADMINISTRATOR = "hasAuthority('SCOPE_tags:admin')";

	private final TagService tagService;

	TagController(TagService tagService) {
		this.tagService = tagService;
	}

	@QueryMapping
	Collection<Tag> tags() {
		return this.tagService.tags();
	}

	@MutationMapping
	@PreAuthorize(CATALOG_ADMINISTRATOR)
	public Tag createTag(@Argument String name) {
		return this.tagService.createTag(name);
	}

	@MutationMapping
	@PreAuthorize(CATALOG_ADMINISTRATOR)
	public Tag renameTag(@Argument String id, @Argument String name) {
		return this.tagService.renameTag(IdUtils.parse(id, "tag"), name);
	}

	@MutationMapping
	@PreAuthorize(CATALOG_ADMINISTRATOR)
	public boolean deleteTag(@Argument String id) {
		this.tagService.deleteTag(IdUtils.parse(id, "tag"));
		return true;
	}

}
