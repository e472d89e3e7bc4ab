package com.sharednotes.api.notes;

import com.sharednotes.api.ApiProperties;
import com.sharednotes.api.directory.DirectoryService;
import com.sharednotes.api.utils.IdUtils;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.MutationMapping;
import org.springframework.graphql.data.method.annotation.QueryMapping;
import org.springframework.graphql.data.method.annotation.SchemaMapping;
import org.springframework.stereotype.Controller;

import java.security.Principal;
import java.util.Collection;
import java.util.List;

@Controller
class NotesController {

	private final NoteService noteService;

	private final DirectoryService directoryService;

	private final int defaultPageSize;

	NotesController(NoteService noteService, DirectoryService directoryService, ApiProperties properties) {
		this.noteService = noteService;
		this.directoryService = directoryService;
		this.defaultPageSize = properties.pagination().defaultPageSize();
	}

	@QueryMapping
	NotePage notes(@Argument String section, @Argument Integer page, @Argument Integer pageSize,
			@Argument List<String> tagIds, Principal principal) {
		return this.noteService.notes(principal.getName(), Section.of(section), this.page(page),
				this.pageSize(pageSize), IdUtils.parse(tagIds, "tag"));
	}

	@QueryMapping
	NotePage allNotes(@Argument Integer page, @Argument Integer pageSize, @Argument List<String> tagIds,
			Principal principal) {
		return this.noteService.allNotes(principal.getName(), this.page(page), this.pageSize(pageSize),
				IdUtils.parse(tagIds, "tag"));
	}

	@QueryMapping
	Note noteById(@Argument String id, Principal principal) {
		return this.noteService.getNoteById(principal.getName(), IdUtils.parse(id, "note"));
	}

	@QueryMapping
	Collection<NoteShare> noteShares(@Argument String noteId, Principal principal) {
		return this.noteService.shares(principal.getName(), IdUtils.parse(noteId, "note"));
	}

	@MutationMapping
	Note createNote(@Argument String title, @Argument String content, @Argument List<String> tagIds,
			@Argument List<String> shareWith, Principal principal) {
		return this.noteService.createNote(principal.getName(), title, content, IdUtils.parse(tagIds, "tag"),
				shareWith);
	}

	@MutationMapping
	Note updateNote(@Argument String id, @Argument String title, @Argument String content,
			@Argument List<String> tagIds, Principal principal) {
		return this.noteService.updateNote(principal.getName(), IdUtils.parse(id, "note"), title, content,
				tagIds == null ? null : IdUtils.parse(tagIds, "tag"));
	}

	@MutationMapping
	boolean deleteNote(@Argument String id, Principal principal) {
		this.noteService.deleteNote(principal.getName(), IdUtils.parse(id, "note"));
		return true;
	}

	@MutationMapping
	Collection<NoteShare> shareNote(@Argument String noteId, @Argument List<String> emails, Principal principal) {
		return this.noteService.shareNote(principal.getName(), IdUtils.parse(noteId, "note"),
				emails == null ? List.of() : emails);
	}

	@MutationMapping
	boolean removeShare(@Argument String noteId, @Argument String shareId, Principal principal) {
		this.noteService.removeShare(principal.getName(), IdUtils.parse(noteId, "note"),
				IdUtils.parse(shareId, "share"));
		return true;
	}

	@MutationMapping
	boolean removeShareByEmail(@Argument String noteId, @Argument String email, Principal principal) {
		this.noteService.removeShareByEmail(principal.getName(), IdUtils.parse(noteId, "note"), email);
		return true;
	}

	@SchemaMapping
	NoteAccess access(Note note, Principal principal) {
		return NoteAccess.of(note, principal.getName());
	}

	@SchemaMapping
	String granteeEmail(NoteShare share) {
		return this.directoryService.emailForUserId(share.granteeId());
	}

	private int page(Integer page) {
		return page == null ? 1 : page;
	}

	private int pageSize(Integer pageSize) {
		return pageSize == null ? this.defaultPageSize : pageSize;
	}

}
