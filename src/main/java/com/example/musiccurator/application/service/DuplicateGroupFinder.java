package com.example.musiccurator.application.service;

import com.example.musiccurator.application.service.similarity.SimilarityStrategy;
import com.example.musiccurator.common.config.AppCleanupProperties;
import com.example.musiccurator.domain.MetadataHash;
import com.example.musiccurator.domain.enumtype.CleanupMode;
import com.example.musiccurator.domain.enumtype.GroupingKind;
import com.example.musiccurator.domain.model.DuplicateGroup;
import com.example.musiccurator.infrastructure.catalog.LibraryCatalog;
import com.example.musiccurator.infrastructure.persistence.entity.LibraryFileEntity;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Groups active catalog rows that look like copies of the same recording.
 * <p>
 * FAST groups by metadata hash only. THOROUGH also links rows sharing a content hash or a
 * near-identical normalized filename (unless both are tagged as different songs); linked rows are
 * merged transitively so a file is never in two groups.
 */
@Component
public class DuplicateGroupFinder {

    private static final int FILENAME_BLOCK_PREFIX = 3;

    private final LibraryCatalog libraryCatalog;
    private final MatchTextNormalizer matchTextNormalizer;
    private final SimilarityStrategy similarityStrategy;
    private final double filenameThreshold;

    public DuplicateGroupFinder(LibraryCatalog libraryCatalog,
                                MatchTextNormalizer matchTextNormalizer,
                                SimilarityStrategy similarityStrategy,
                                AppCleanupProperties appCleanupProperties) {
        this.libraryCatalog = libraryCatalog;
        this.matchTextNormalizer = matchTextNormalizer;
        this.similarityStrategy = similarityStrategy;
        this.filenameThreshold = appCleanupProperties.getFilenameSimilarityThreshold();
    }

    public List<DuplicateGroup> find(CleanupMode mode) {
        Links links = new Links();
        for (List<LibraryFileEntity> bucket : bucketBy(libraryCatalog.findActiveSharingMetadataHash(), true)) {
            links.linkAll(bucket, GroupingKind.METADATA_HASH, bucket.get(0).getMetadataHash());
        }
        if (mode == CleanupMode.THOROUGH) {
            for (List<LibraryFileEntity> bucket : bucketBy(libraryCatalog.findActiveSharingContentHash(), false)) {
                links.linkAll(bucket, GroupingKind.CONTENT_HASH, bucket.get(0).getContentHash());
            }
            linkSimilarFilenames(libraryCatalog.findActive(), links);
        }
        return links.toGroups();
    }

    private List<List<LibraryFileEntity>> bucketBy(List<LibraryFileEntity> rows, boolean byMetadata) {
        Map<String, List<LibraryFileEntity>> buckets = new LinkedHashMap<>();
        for (LibraryFileEntity row : rows) {
            String key = byMetadata ? row.getMetadataHash() : row.getContentHash();
            buckets.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
        }
        List<List<LibraryFileEntity>> result = new ArrayList<>();
        for (List<LibraryFileEntity> bucket : buckets.values()) {
            if (bucket.size() > 1) {
                result.add(bucket);
            }
        }
        return result;
    }

    private void linkSimilarFilenames(List<LibraryFileEntity> rows, Links links) {
        Map<String, List<LibraryFileEntity>> blocks = new HashMap<>();
        Map<Long, String> keys = new HashMap<>();
        for (LibraryFileEntity row : rows) {
            String key = matchTextNormalizer.filenameKey(row.getFilename());
            if (key.length() < FILENAME_BLOCK_PREFIX) {
                continue;
            }
            keys.put(row.getId(), key);
            blocks.computeIfAbsent(key.substring(0, FILENAME_BLOCK_PREFIX), k -> new ArrayList<>()).add(row);
        }
        for (List<LibraryFileEntity> block : blocks.values()) {
            for (int i = 0; i < block.size(); i++) {
                String left = keys.get(block.get(i).getId());
                for (int j = i + 1; j < block.size(); j++) {
                    String right = keys.get(block.get(j).getId());
                    if (tagsAllowFilenameLink(block.get(i), block.get(j))
                            && similarityStrategy.similarity(left, right) >= filenameThreshold) {
                        links.link(block.get(i), block.get(j), GroupingKind.FILENAME, left);
                    }
                }
            }
        }
    }

    /**
     * A filename link between two tagged rows with different tags needs a shared artist.
     */
    static boolean tagsAllowFilenameLink(LibraryFileEntity a, LibraryFileEntity b) {
        if (MetadataHash.isSentinel(a.getMetadataHash()) || MetadataHash.isSentinel(b.getMetadataHash())) {
            return true;
        }
        if (a.getMetadataHash() == null || b.getMetadataHash() == null
                || a.getMetadataHash().equals(b.getMetadataHash())) {
            return true;
        }
        return a.getArtistKey() != null && !a.getArtistKey().isEmpty()
                && a.getArtistKey().equals(b.getArtistKey());
    }

    /**
     * Union-find over row ids, remembering the strongest reason each set was formed.
     */
    private static final class Links {

        private final Map<Long, Long> parent = new HashMap<>();
        private final Map<Long, LibraryFileEntity> rows = new LinkedHashMap<>();
        private final Map<Long, GroupingKind> kindByRoot = new HashMap<>();
        private final Map<Long, String> keyByRoot = new HashMap<>();

        void linkAll(List<LibraryFileEntity> bucket, GroupingKind kind, String key) {
            for (int i = 1; i < bucket.size(); i++) {
                link(bucket.get(0), bucket.get(i), kind, key);
            }
        }

        void link(LibraryFileEntity a, LibraryFileEntity b, GroupingKind kind, String key) {
            long rootA = find(register(a));
            long rootB = find(register(b));
            GroupingKind kindA = kindByRoot.get(rootA);
            GroupingKind kindB = kindByRoot.get(rootB);
            String keyA = keyByRoot.get(rootA);
            String keyB = keyByRoot.get(rootB);
            long root = Math.min(rootA, rootB);
            long child = Math.max(rootA, rootB);
            if (rootA != rootB) {
                parent.put(child, root);
                kindByRoot.remove(child);
                keyByRoot.remove(child);
            }
            // enum order doubles as strength: metadata hash, then content hash, then filename
            GroupingKind best = kind;
            String bestKey = key;
            if (kindA != null && kindA.ordinal() < best.ordinal()) {
                best = kindA;
                bestKey = keyA;
            }
            if (kindB != null && kindB.ordinal() < best.ordinal()) {
                best = kindB;
                bestKey = keyB;
            }
            kindByRoot.put(root, best);
            keyByRoot.put(root, bestKey);
        }

        private long register(LibraryFileEntity row) {
            rows.putIfAbsent(row.getId(), row);
            parent.putIfAbsent(row.getId(), row.getId());
            return row.getId();
        }

        private long find(long id) {
            long root = id;
            while (parent.get(root) != root) {
                root = parent.get(root);
            }
            long cursor = id;
            while (cursor != root) {
                long next = parent.get(cursor);
                parent.put(cursor, root);
                cursor = next;
            }
            return root;
        }

        List<DuplicateGroup> toGroups() {
            Map<Long, List<LibraryFileEntity>> members = new LinkedHashMap<>();
            for (LibraryFileEntity row : rows.values()) {
                members.computeIfAbsent(find(row.getId()), k -> new ArrayList<>()).add(row);
            }
            List<Long> roots = new ArrayList<>(members.keySet());
            Collections.sort(roots);
            List<DuplicateGroup> groups = new ArrayList<>();
            int groupId = 1;
            for (Long root : roots) {
                List<LibraryFileEntity> groupMembers = members.get(root);
                if (groupMembers.size() < 2) {
                    continue;
                }
                Collections.sort(groupMembers, new Comparator<LibraryFileEntity>() {
                    @Override
                    public int compare(LibraryFileEntity a, LibraryFileEntity b) {
                        return Long.compare(a.getId(), b.getId());
                    }
                });
                DuplicateGroup group = new DuplicateGroup();
                group.setGroupId(groupId++);
                group.setKind(kindByRoot.get(root));
                group.setGroupKey(keyByRoot.get(root));
                group.setMembers(groupMembers);
                groups.add(group);
            }
            return groups;
        }
    }
}
