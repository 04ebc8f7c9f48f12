package com.example.musiccurator.infrastructure.persistence.mapper;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface LibraryStatsMapper {

    String LAST_INDEXED_AT = "last_indexed_at";
    String LAST_INDEX_DURATION_MS = "last_index_duration_ms";

    @Insert("INSERT INTO library_stats(stat_key, stat_value, updated_at) "
            + "VALUES (#{key}, #{value}, #{updatedAt}) "
            + "ON CONFLICT(stat_key) DO UPDATE SET stat_value = excluded.stat_value, updated_at = excluded.updated_at")
    int upsert(@Param("key") String key, @Param("value") String value, @Param("updatedAt") Long updatedAt);

    @Select("SELECT stat_value FROM library_stats WHERE stat_key = #{key}")
    String selectValue(@Param("key") String key);
}
