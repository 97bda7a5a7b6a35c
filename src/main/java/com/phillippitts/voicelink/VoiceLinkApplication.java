package com.phillippitts.voicelink;

import com.phillippitts.voicelink.config.properties.WebSocketProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        WebSocketProperties.class
})
@EnableScheduling
public class VoiceLinkApplication {

    public static void main(String[] args) {
        SpringApplication.run(VoiceLinkApplication.class, args);
    }

}
