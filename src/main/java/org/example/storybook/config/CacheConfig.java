package org.example.storybook.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class CacheConfig {

    /**
     * Chapter count per run id. Entries expire so a late outline replacement is picked up.
     */
    @Bean
    @Qualifier("chapterCountCache")
    public Cache<String, Integer> chapterCountCache(
            @Value("${progress.chapter-count-cache.ttl-seconds:300}") long ttlSeconds,
            @Value("${progress.chapter-count-cache.max-size:10000}") long maxSize) {
        return Caffeine.newBuilder()
                .maximumSize(maxSize)
                .expireAfterWrite(Duration.ofSeconds(Math.max(1, ttlSeconds)))
                .recordStats()
                .build();
    }
}
