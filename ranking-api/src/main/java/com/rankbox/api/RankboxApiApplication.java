package com.rankbox.api;

import com.rankbox.api.config.RankingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(RankingProperties.class)
public class RankboxApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(RankboxApiApplication.class, args);
    }
}
