package com.sharednotes.api.notes;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.modulith.events.ApplicationModuleListener;
import org.springframework.stereotype.Component;

/**
 * writes an audit trail of every change to a note or its shares, once the change has
 * committed.
 */
@Component
class NoteAuditListener {

	private final Logger log = LoggerFactory.getLogger(getClass());

	@ApplicationModuleListener
	void created(NoteCreatedEvent event) {
		var note = event.note();
		this.log.info("audit: [{}] created note {}", note.ownerId(), note.id());
	}

	@ApplicationModuleListener
	void updated(NoteUpdatedEvent event) {
		var note = event.note();
		this.log.info("audit: [{}] updated note {}", note.ownerId(), note.id());
	}

	@ApplicationModuleListener
	void deleted(NoteDeletedEvent event) {
		this.log.info("audit: [{}] deleted note {}", event.ownerId(), event.noteId());
	}

	@ApplicationModuleListener
	void shared(NoteSharedEvent event) {
		var share = event.share();
		this.log.info("audit: [{}] shared note {} with [{}]", share.granterId(), share.noteId(), share.granteeId());
	}

	@ApplicationModuleListener
	void unshared(NoteUnsharedEvent event) {
		var share = event.share();
		this.log.info("audit: [{}] stopped sharing note {} with [{}]", share.granterId(), share.noteId(),
				share.granteeId());
	}

}
