package com.example.musiccurator;

import com.example.musiccurator.common.config.AppCleanupProperties;
import com.example.musiccurator.common.config.AppLibraryProperties;
import com.example.musiccurator.common.config.AppMatchProperties;
import com.example.musiccurator.common.config.AppQualityProperties;
import com.example.musiccurator.common.config.AppVetProperties;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@MapperScan("com.example.musiccurator.infrastructure.persistence.mapper")
@EnableScheduling
@EnableConfigurationProperties({
        AppLibraryProperties.class,
        AppVetProperties.class,
        AppMatchProperties.class,
        AppQualityProperties.class,
        AppCleanupProperties.class
})
public class MusicCuratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(MusicCuratorApplication.class, args);
    }
}
