package io.promptrelay.document;

import io.promptrelay.error.NotFoundException;
import io.promptrelay.model.PromptDocument;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

public final class DocumentStore {
    private final Map<String, PromptDocument> documents = new ConcurrentHashMap<>();
    private final Map<String, String> idsByTitle = new ConcurrentHashMap<>();
    private final AtomicReference<String> activeDocumentId = new AtomicReference<>();

    public PromptDocument add(PromptDocument document) {
        DocumentValidator.validate(document);
        documents.put(document.id(), document);
        if (!document.title().isBlank()) {
            idsByTitle.put(document.title(), document.id());
        }
        activeDocumentId.compareAndSet(null, document.id());
        return document;
    }

    public PromptDocument get(String documentId) {
        PromptDocument document = documentId == null ? null : documents.get(documentId);
        if (document == null) {
            throw NotFoundException.document(documentId);
        }
        return document;
    }

    public Optional<PromptDocument> find(String documentId) {
        return Optional.ofNullable(documentId == null ? null : documents.get(documentId));
    }

    /**
     * Resolves a reference that may be either a document id or a document title.
     */
    public PromptDocument resolve(String reference) {
        if (reference == null || reference.isBlank()) {
            throw NotFoundException.document(reference);
        }
        PromptDocument byId = documents.get(reference);
        if (byId != null) {
            return byId;
        }
        String id = idsByTitle.get(reference);
        if (id == null) {
            for (Map.Entry<String, String> entry : idsByTitle.entrySet()) {
                if (entry.getKey().equalsIgnoreCase(reference.trim())) {
                    id = entry.getValue();
                    break;
                }
            }
        }
        if (id == null) {
            throw NotFoundException.document(reference);
        }
        return get(id);
    }

    public List<PromptDocument> list() {
        List<PromptDocument> out = new ArrayList<>(documents.values());
        out.sort(Comparator.comparing(PromptDocument::createdAt).thenComparing(PromptDocument::id));
        return out;
    }

    public void setActive(String documentId) {
        get(documentId);
        activeDocumentId.set(documentId);
    }

    public Optional<PromptDocument> active() {
        return find(activeDocumentId.get());
    }
}
