package com.example.musiccurator.infrastructure.persistence.mapper;

import com.example.musiccurator.infrastructure.persistence.entity.VettingSessionEntity;
import java.util.List;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.SelectKey;

/**
 * Sessions are append-only; there is deliberately no update statement here.
 */
@Mapper
public interface VettingHistoryMapper {

    @Insert("INSERT INTO vetting_history("
            + "import_folder, scanned_at, file_count, new_count, duplicate_count, uncertain_count, threshold_used"
            + ") VALUES ("
            + "#{importFolder}, #{scannedAt}, #{fileCount}, #{newCount}, #{duplicateCount}, #{uncertainCount}, #{thresholdUsed})")
    @SelectKey(statement = "SELECT last_insert_rowid()", keyProperty = "id", before = false, resultType = Long.class)
    int insert(VettingSessionEntity entity);

    @Select("SELECT id, import_folder, scanned_at, file_count, new_count, duplicate_count, uncertain_count, threshold_used "
            + "FROM vetting_history ORDER BY scanned_at DESC, id DESC LIMIT #{limit}")
    List<VettingSessionEntity> selectRecent(@Param("limit") int limit);
}
