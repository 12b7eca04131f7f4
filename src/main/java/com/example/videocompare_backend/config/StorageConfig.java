package com.example.videocompare_backend.config;

import com.example.videocompare_backend.service.LocalStorageService;
import com.example.videocompare_backend.service.Interfaces.StorageService;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@EnableConfigurationProperties(StorageProperties.class)
@Configuration
public class StorageConfig {

    @Bean
    public StorageService storageService(StorageProperties properties) {
        Path base = Path.of(properties.getBaseDir());
        var svc = new LocalStorageService(base, properties.getScratchPrefix(), properties.getDownloadPrefix());
        org.slf4j.LoggerFactory.getLogger(StorageConfig.class)
                .info("Storage wired: base={}, scratchPrefix={}, downloadPrefix={}", base, properties.getScratchPrefix(), properties.getDownloadPrefix());
        return svc;
    }
}
