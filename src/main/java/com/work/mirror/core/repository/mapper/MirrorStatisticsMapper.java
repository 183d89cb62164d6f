package com.work.mirror.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.mirror.core.repository.entity.MirrorStatisticsEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.time.Instant;
import java.util.List;

/**
 * 镜像累计统计表 Mapper
 */
public interface MirrorStatisticsMapper extends BaseMapper<MirrorStatisticsEntity> {

    /**
     * 单语句 upsert，保证同一镜像并发写入时计数不丢失。
     * 注意：avg 使用的是旧的 total_tests（SET 右侧引用的都是旧行），等价于
     * (old_avg * old_total + latency) / (old_total + 1)，失败探测的耗时同样计入均值。
     */
    @Insert("INSERT INTO mirror_statistics(mirror_url, total_tests, success_count, fail_count, avg_response_time, " +
            "last_success_time, last_fail_time, current_status, updated_at) " +
            "VALUES(#{mirrorUrl}, 1, #{successDelta}, #{failDelta}, #{responseTime}, " +
            "#{lastSuccessTime}, #{lastFailTime}, #{available}, #{updatedAt}) " +
            "ON CONFLICT(mirror_url) DO UPDATE SET " +
            "total_tests = mirror_statistics.total_tests + 1, " +
            "success_count = mirror_statistics.success_count + EXCLUDED.success_count, " +
            "fail_count = mirror_statistics.fail_count + EXCLUDED.fail_count, " +
            "avg_response_time = (COALESCE(mirror_statistics.avg_response_time, 0) * mirror_statistics.total_tests " +
            "+ EXCLUDED.avg_response_time) / (mirror_statistics.total_tests + 1), " +
            "last_success_time = COALESCE(EXCLUDED.last_success_time, mirror_statistics.last_success_time), " +
            "last_fail_time = COALESCE(EXCLUDED.last_fail_time, mirror_statistics.last_fail_time), " +
            "current_status = EXCLUDED.current_status, " +
            "updated_at = EXCLUDED.updated_at")
    int upsertStatistics(@Param("mirrorUrl") String mirrorUrl,
                         @Param("successDelta") int successDelta,
                         @Param("failDelta") int failDelta,
                         @Param("responseTime") double responseTime,
                         @Param("lastSuccessTime") Instant lastSuccessTime,
                         @Param("lastFailTime") Instant lastFailTime,
                         @Param("available") boolean available,
                         @Param("updatedAt") Instant updatedAt);

    @Select("SELECT id, mirror_url, total_tests, success_count, fail_count, avg_response_time, " +
            "last_success_time, last_fail_time, current_status, updated_at " +
            "FROM mirror_statistics " +
            "ORDER BY success_count DESC, avg_response_time ASC")
    List<MirrorStatisticsEntity> listRanked();
}
