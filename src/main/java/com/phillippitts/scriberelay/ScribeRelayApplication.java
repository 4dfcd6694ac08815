package com.phillippitts.scriberelay;

import com.phillippitts.scriberelay.config.audio.AudioCaptureProperties;
import com.phillippitts.scriberelay.config.client.ClientProperties;
import com.phillippitts.scriberelay.config.engine.EngineProperties;
import com.phillippitts.scriberelay.config.relay.RelayProperties;
import com.phillippitts.scriberelay.config.relay.UpstreamProperties;
import com.phillippitts.scriberelay.config.summary.SummaryProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.SecurityAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(exclude = SecurityAutoConfiguration.class)
@EnableConfigurationProperties({
        RelayProperties.class,
        UpstreamProperties.class,
        ClientProperties.class,
        AudioCaptureProperties.class,
        EngineProperties.class,
        SummaryProperties.class,
        com.phillippitts.scriberelay.config.properties.ThreadPoolProperties.class
})
@EnableScheduling
public class ScribeRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScribeRelayApplication.class, args);
    }

}
