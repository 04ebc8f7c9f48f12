package com.example.musiccurator.infrastructure.persistence.mapper;

import com.example.musiccurator.infrastructure.persistence.entity.LibraryFileEntity;
import com.example.musiccurator.infrastructure.persistence.model.CatalogTotalsRow;
import com.example.musiccurator.infrastructure.persistence.model.FormatCountRow;
import java.util.List;
import org.apache.ibatis.annotations.Delete;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.SelectKey;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface LibraryFileMapper {

    String COLUMNS = "id, file_path, filename, artist, artist_key, title, album, year, duration, file_format, "
            + "bitrate, vbr, sample_rate, file_size, metadata_hash, content_hash, indexed_at, file_mtime, "
            + "last_verified, is_active";

    @Insert("INSERT INTO library_index("
            + "file_path, filename, artist, artist_key, title, album, year, duration, file_format, "
            + "bitrate, vbr, sample_rate, file_size, metadata_hash, content_hash, indexed_at, file_mtime, "
            + "last_verified, is_active"
            + ") VALUES ("
            + "#{filePath}, #{filename}, #{artist}, #{artistKey}, #{title}, #{album}, #{year}, #{duration}, #{fileFormat}, "
            + "#{bitrate}, #{vbr}, #{sampleRate}, #{fileSize}, #{metadataHash}, #{contentHash}, #{indexedAt}, #{fileMtime}, "
            + "#{lastVerified}, 1)")
    @SelectKey(statement = "SELECT last_insert_rowid()", keyProperty = "id", before = false, resultType = Long.class)
    int insert(LibraryFileEntity entity);

    @Update("UPDATE library_index SET "
            + "filename = #{filename}, "
            + "artist = #{artist}, "
            + "artist_key = #{artistKey}, "
            + "title = #{title}, "
            + "album = #{album}, "
            + "year = #{year}, "
            + "duration = #{duration}, "
            + "file_format = #{fileFormat}, "
            + "bitrate = #{bitrate}, "
            + "vbr = #{vbr}, "
            + "sample_rate = #{sampleRate}, "
            + "file_size = #{fileSize}, "
            + "metadata_hash = #{metadataHash}, "
            + "content_hash = #{contentHash}, "
            + "indexed_at = #{indexedAt}, "
            + "file_mtime = #{fileMtime}, "
            + "last_verified = #{lastVerified}, "
            + "is_active = 1 "
            + "WHERE id = #{id}")
    int updateIndexedFields(LibraryFileEntity entity);

    @Update("UPDATE library_index SET last_verified = #{lastVerified}, is_active = 1 WHERE id = #{id}")
    int touchVerified(@Param("id") Long id, @Param("lastVerified") Long lastVerified);

    @Select("SELECT " + COLUMNS + " FROM library_index WHERE file_path = #{filePath}")
    LibraryFileEntity selectByPath(@Param("filePath") String filePath);

    @Select("<script>"
            + "SELECT " + COLUMNS + " FROM library_index WHERE metadata_hash = #{metadataHash} "
            + "<if test='activeOnly'>AND is_active = 1 </if>"
            + "ORDER BY last_verified DESC, id ASC"
            + "</script>")
    List<LibraryFileEntity> selectByMetadataHash(@Param("metadataHash") String metadataHash,
                                                 @Param("activeOnly") boolean activeOnly);

    @Select("<script>"
            + "SELECT " + COLUMNS + " FROM library_index WHERE content_hash = #{contentHash} "
            + "<if test='activeOnly'>AND is_active = 1 </if>"
            + "ORDER BY last_verified DESC, id ASC"
            + "</script>")
    List<LibraryFileEntity> selectByContentHash(@Param("contentHash") String contentHash,
                                                @Param("activeOnly") boolean activeOnly);

    @Select("SELECT " + COLUMNS + " FROM library_index "
            + "WHERE is_active = 1 AND artist_key = #{artistKey} "
            + "ORDER BY last_verified DESC, id ASC")
    List<LibraryFileEntity> selectActiveByArtistKey(@Param("artistKey") String artistKey);

    @Select("SELECT " + COLUMNS + " FROM library_index WHERE is_active = 1 ORDER BY file_path")
    List<LibraryFileEntity> selectActive();

    @Select("<script>"
            + "SELECT " + COLUMNS + " FROM library_index "
            + "WHERE substr(file_path, 1, length(#{prefix})) = #{prefix} "
            + "<if test='activeOnly'>AND is_active = 1 </if>"
            + "ORDER BY file_path"
            + "</script>")
    List<LibraryFileEntity> selectUnderPath(@Param("prefix") String prefix,
                                            @Param("activeOnly") boolean activeOnly);

    @Select("SELECT " + COLUMNS + " FROM library_index "
            + "WHERE is_active = 1 AND metadata_hash <> #{excludedHash} AND metadata_hash IN ("
            + "SELECT metadata_hash FROM library_index WHERE is_active = 1 "
            + "GROUP BY metadata_hash HAVING COUNT(*) > 1) "
            + "ORDER BY metadata_hash, id")
    List<LibraryFileEntity> selectActiveSharingMetadataHash(@Param("excludedHash") String excludedHash);

    @Select("SELECT " + COLUMNS + " FROM library_index "
            + "WHERE is_active = 1 AND content_hash IS NOT NULL AND content_hash IN ("
            + "SELECT content_hash FROM library_index WHERE is_active = 1 AND content_hash IS NOT NULL "
            + "GROUP BY content_hash HAVING COUNT(*) > 1) "
            + "ORDER BY content_hash, id")
    List<LibraryFileEntity> selectActiveSharingContentHash();

    @Update("UPDATE library_index SET is_active = #{active} WHERE id = #{id}")
    int updateActive(@Param("id") Long id, @Param("active") int active);

    @Update("<script>"
            + "UPDATE library_index SET is_active = #{active} WHERE id IN "
            + "<foreach item='id' collection='ids' open='(' separator=',' close=')'>"
            + "#{id}"
            + "</foreach>"
            + "</script>")
    int updateActiveByIds(@Param("ids") List<Long> ids, @Param("active") int active);

    @Delete("DELETE FROM library_index WHERE is_active = 0")
    int deleteInactive();

    @Select("SELECT COUNT(*) AS total_files, "
            + "COALESCE(SUM(CASE WHEN is_active = 1 THEN 1 ELSE 0 END), 0) AS active_files, "
            + "COALESCE(SUM(CASE WHEN is_active = 1 THEN file_size ELSE 0 END), 0) AS total_size, "
            + "COUNT(DISTINCT CASE WHEN is_active = 1 THEN artist_key END) AS unique_artists, "
            + "COUNT(DISTINCT CASE WHEN is_active = 1 THEN LOWER(album) END) AS unique_albums "
            + "FROM library_index")
    CatalogTotalsRow selectTotals();

    @Select("SELECT COALESCE(file_format, 'unknown') AS file_format, COUNT(*) AS file_count "
            + "FROM library_index WHERE is_active = 1 "
            + "GROUP BY COALESCE(file_format, 'unknown') "
            + "ORDER BY file_count DESC, file_format ASC")
    List<FormatCountRow> selectFormatCounts();
}
