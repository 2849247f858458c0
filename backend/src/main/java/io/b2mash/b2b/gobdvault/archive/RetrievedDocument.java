package io.b2mash.b2b.gobdvault.archive;

import java.util.List;

/**
 * @param content plaintext, or null when decryption was not requested
 * @param versions newest first, or null when not requested
 */
public record RetrievedDocument(
    ArchivedDocument document, byte[] content, List<DocumentVersion> versions) {}
