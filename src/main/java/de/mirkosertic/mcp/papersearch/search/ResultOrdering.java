package de.mirkosertic.mcp.papersearch.search;

import de.mirkosertic.mcp.papersearch.model.FieldValue;
import de.mirkosertic.mcp.papersearch.model.PaperDocument;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Orders search results, either by a field or by a seeded, reproducible shuffle.
 * All sorts are stable.
 */
public final class ResultOrdering {

    public static final String RANDOM = "random";
    public static final String DEFAULT_SORT_FIELD = "name";
    public static final String DEFAULT_SEED = "0";

    private ResultOrdering() {
    }

    /**
     * Returns a newly sorted copy of the documents.
     *
     * @param sortBy    field name, {@code random}, or null/empty for the default {@code name} order
     * @param sortOrder {@code desc} (any case) for descending, anything else ascending
     * @param seed      shuffle seed for {@code random}; null or empty means {@code "0"}
     */
    public static List<PaperDocument> order(final List<PaperDocument> documents, final String sortBy,
                                            final String sortOrder, final String seed) {
        final List<PaperDocument> ordered = new ArrayList<>(documents);
        if (RANDOM.equals(sortBy)) {
            shuffle(ordered, seed);
            return ordered;
        }

        final String field = sortBy == null || sortBy.isEmpty() ? DEFAULT_SORT_FIELD : sortBy;
        final Map<Long, String> keys = new HashMap<>();
        for (final PaperDocument document : ordered) {
            keys.put(document.id(), sortKey(document.get(field)));
        }
        Comparator<PaperDocument> comparator = Comparator.comparing(document -> keys.get(document.id()));
        if ("desc".equalsIgnoreCase(sortOrder)) {
            comparator = comparator.reversed();
        }
        ordered.sort(comparator);
        return ordered;
    }

    /**
     * Lowercased string form; lists use their first element, null and empty lists sort as "".
     */
    static String sortKey(final FieldValue value) {
        FieldValue effective = value;
        if (value instanceof FieldValue.Array array) {
            effective = array.items().isEmpty() ? FieldValue.NULL : array.items().get(0);
        }
        return effective.asText().toLowerCase(Locale.ROOT);
    }

    private static void shuffle(final List<PaperDocument> documents, final String seed) {
        final String effectiveSeed = seed == null || seed.isEmpty() ? DEFAULT_SEED : seed;
        final MessageDigest digest = sha256();
        final Map<Long, Long> keys = new HashMap<>();
        for (final PaperDocument document : documents) {
            keys.put(document.id(), shuffleKey(digest, effectiveSeed, document.id()));
        }
        documents.sort((a, b) -> Long.compareUnsigned(keys.get(a.id()), keys.get(b.id())));
    }

    /**
     * First 8 bytes, big-endian, of SHA-256 over {@code seed + ":" + id}.
     */
    static long shuffleKey(final MessageDigest digest, final String seed, final long id) {
        digest.reset();
        final byte[] hash = digest.digest((seed + ":" + id).getBytes(StandardCharsets.UTF_8));
        return ByteBuffer.wrap(hash, 0, Long.BYTES).getLong();
    }

    static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (final NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
