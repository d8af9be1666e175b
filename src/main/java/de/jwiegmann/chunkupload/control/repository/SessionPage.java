package de.jwiegmann.chunkupload.control.repository;

import de.jwiegmann.chunkupload.entity.UploadSession;

import java.util.List;

public record SessionPage(List<UploadSession> items, long total) {
}
