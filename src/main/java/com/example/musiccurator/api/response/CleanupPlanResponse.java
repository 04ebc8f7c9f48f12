package com.example.musiccurator.api.response;

import com.example.musiccurator.domain.enumtype.CleanupMode;
import com.example.musiccurator.domain.enumtype.GroupingKind;
import com.example.musiccurator.domain.enumtype.QualityTier;
import com.example.musiccurator.domain.model.CleanupPlan;
import com.example.musiccurator.domain.model.DuplicateGroup;
import com.example.musiccurator.domain.model.QualityScore;
import com.example.musiccurator.infrastructure.persistence.entity.LibraryFileEntity;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

@Data
public class CleanupPlanResponse {

    private String planId;

    private CleanupMode mode;

    private long createdAt;

    private int groupCount;

    private int deleteCandidateCount;

    private long reclaimableBytes;

    private List<Group> groups = new ArrayList<>();

    public static CleanupPlanResponse from(CleanupPlan plan) {
        CleanupPlanResponse response = new CleanupPlanResponse();
        response.setPlanId(plan.getPlanId());
        response.setMode(plan.getMode());
        response.setCreatedAt(plan.getCreatedAt());
        response.setGroupCount(plan.getGroups().size());
        response.setDeleteCandidateCount(plan.deleteCandidateCount());
        response.setReclaimableBytes(plan.reclaimableBytes());
        for (DuplicateGroup group : plan.getGroups()) {
            Group item = new Group();
            item.setGroupId(group.getGroupId());
            item.setKind(group.getKind());
            item.setGroupKey(group.getGroupKey());
            item.setKeeperId(group.getKeeper() == null ? null : group.getKeeper().getId());
            for (LibraryFileEntity member : group.getMembers()) {
                QualityScore score = group.scoreOf(member);
                Member m = new Member();
                m.setId(member.getId());
                m.setFilePath(member.getFilePath());
                m.setFormat(member.getFileFormat());
                m.setBitrate(member.getBitrate());
                m.setSampleRate(member.getSampleRate());
                m.setFileSize(member.getFileSize());
                if (score != null) {
                    m.setQualityScore(score.getTotal());
                    m.setTier(score.getTier());
                }
                m.setKeeper(member == group.getKeeper());
                item.getMembers().add(m);
            }
            response.getGroups().add(item);
        }
        return response;
    }

    @Data
    public static class Group {

        private int groupId;

        private GroupingKind kind;

        private String groupKey;

        private Long keeperId;

        private List<Member> members = new ArrayList<>();
    }

    @Data
    public static class Member {

        private Long id;

        private String filePath;

        private String format;

        private Integer bitrate;

        private Integer sampleRate;

        private Long fileSize;

        private Integer qualityScore;

        private QualityTier tier;

        private boolean keeper;
    }
}
