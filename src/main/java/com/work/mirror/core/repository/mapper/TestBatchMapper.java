package com.work.mirror.core.repository.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.work.mirror.core.repository.entity.TestBatchEntity;

public interface TestBatchMapper extends BaseMapper<TestBatchEntity> {
}
