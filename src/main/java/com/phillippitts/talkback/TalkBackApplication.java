package com.phillippitts.talkback;

import com.phillippitts.talkback.config.properties.ChunkerProperties;
import com.phillippitts.talkback.config.properties.TurnProperties;
import com.phillippitts.talkback.config.properties.VadProperties;
import com.phillippitts.talkback.config.properties.WebSocketProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        VadProperties.class,
        ChunkerProperties.class,
        TurnProperties.class,
        WebSocketProperties.class
})
@EnableScheduling
public class TalkBackApplication {

    public static void main(String[] args) {
        SpringApplication.run(TalkBackApplication.class, args);
    }

}
