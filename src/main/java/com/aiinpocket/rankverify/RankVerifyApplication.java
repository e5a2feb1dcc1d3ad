package com.aiinpocket.rankverify;

import com.aiinpocket.rankverify.config.VerificationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(VerificationProperties.class)
public class RankVerifyApplication {

    public static void main(String[] args) {
        SpringApplication.run(RankVerifyApplication.class, args);
    }

}
