package com.work.mirror;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Spring Boot 启动入口：启动后立即执行一次检测，之后按固定间隔循环。
 */
@SpringBootApplication
@EnableScheduling
@MapperScan("com.work.mirror.core.repository.mapper")
public class MirrorCheckerApplication {

    public static void main(String[] args) {
        SpringApplication.run(MirrorCheckerApplication.class, args);
    }
}
