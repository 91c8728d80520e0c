package com.inboxpilot.integration.local;

import com.inboxpilot.core.model.DirectoryRecord;
import com.inboxpilot.integration.DocumentRepository;

import java.util.List;

public class InMemoryDocumentRepository implements DocumentRepository {

    private final KeywordIndex index = new KeywordIndex();

    public InMemoryDocumentRepository add(String id, String title, String content) {
        index.add(new DirectoryRecord("documents", id, title, content));
        return this;
    }

    @Override
    public List<DirectoryRecord> search(String query) {
        return index.search(query);
    }
}
