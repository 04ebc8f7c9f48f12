package com.example.musiccurator.domain.model;

import com.example.musiccurator.domain.enumtype.GroupingKind;
import com.example.musiccurator.infrastructure.persistence.entity.LibraryFileEntity;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;

/**
 * Files sharing a grouping key. Members are kept in rank order once reviewed, so the
 * keeper is normally the first member unless a review decision overrode it.
 */
@Data
public class DuplicateGroup {

    private int groupId;

    private GroupingKind kind;

    private String groupKey;

    private List<LibraryFileEntity> members = new ArrayList<>();

    private LibraryFileEntity keeper;

    private List<LibraryFileEntity> deleteCandidates = new ArrayList<>();

    private Map<Long, QualityScore> scores = new LinkedHashMap<>();

    private boolean excluded;

    public int size() {
        return members.size();
    }

    public QualityScore scoreOf(LibraryFileEntity file) {
        return scores.get(file.getId());
    }

    public long reclaimableBytes() {
        long total = 0L;
        for (LibraryFileEntity candidate : deleteCandidates) {
            total += candidate.getFileSize() == null ? 0L : candidate.getFileSize();
        }
        return total;
    }

    public DuplicateGroup copy() {
        DuplicateGroup copy = new DuplicateGroup();
        copy.setGroupId(groupId);
        copy.setKind(kind);
        copy.setGroupKey(groupKey);
        copy.setMembers(new ArrayList<>(members));
        copy.setKeeper(keeper);
        copy.setDeleteCandidates(new ArrayList<>(deleteCandidates));
        copy.setScores(new LinkedHashMap<>(scores));
        copy.setExcluded(excluded);
        return copy;
    }
}
