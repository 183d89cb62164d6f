package com.work.mirror.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.mirror.core.repository.entity.MirrorTestHistoryEntity;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

/**
 * 探测历史表 Mapper，写入走 BaseMapper#insert
 */
public interface MirrorTestHistoryMapper extends BaseMapper<MirrorTestHistoryEntity> {

    @Select("SELECT id, mirror_url, available, status, status_code, response_time, test_time, created_at " +
            "FROM mirror_test_history " +
            "ORDER BY test_time DESC, id DESC " +
            "LIMIT #{limit}")
    List<MirrorTestHistoryEntity> listRecent(@Param("limit") int limit);

    @Select("SELECT id, mirror_url, available, status, status_code, response_time, test_time, created_at " +
            "FROM mirror_test_history " +
            "WHERE mirror_url = #{mirrorUrl} " +
            "ORDER BY test_time DESC, id DESC " +
            "LIMIT #{limit}")
    List<MirrorTestHistoryEntity> listRecentByMirror(@Param("mirrorUrl") String mirrorUrl, @Param("limit") int limit);
}
