package com.example.musiccurator.domain.model;

import com.example.musiccurator.domain.enumtype.CleanupMode;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class CleanupPlan {

    private String planId;

    private CleanupMode mode;

    private long createdAt;

    private List<DuplicateGroup> groups = new ArrayList<>();

    public int deleteCandidateCount() {
        int count = 0;
        for (DuplicateGroup group : groups) {
            count += group.getDeleteCandidates().size();
        }
        return count;
    }

    public long reclaimableBytes() {
        long total = 0L;
        for (DuplicateGroup group : groups) {
            total += group.reclaimableBytes();
        }
        return total;
    }

    public DuplicateGroup findGroup(int groupId) {
        for (DuplicateGroup group : groups) {
            if (group.getGroupId() == groupId) {
                return group;
            }
        }
        return null;
    }

    /**
     * Copies the plan and its groups; member rows are shared.
     */
    public CleanupPlan copy() {
        CleanupPlan copy = new CleanupPlan();
        copy.setPlanId(planId);
        copy.setMode(mode);
        copy.setCreatedAt(createdAt);
        List<DuplicateGroup> groupCopies = new ArrayList<>();
        for (DuplicateGroup group : groups) {
            groupCopies.add(group.copy());
        }
        copy.setGroups(groupCopies);
        return copy;
    }
}
