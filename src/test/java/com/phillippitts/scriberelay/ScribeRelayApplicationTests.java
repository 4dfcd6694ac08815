package com.phillippitts.scriberelay;

import com.phillippitts.scriberelay.config.IntegrationTestConfiguration;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

@Tag("integration")
@ActiveProfiles("test")
@Import(IntegrationTestConfiguration.class)
@SpringBootTest(
    // the WebSocket container needs a running servlet server
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = {
        "engine.native.enabled=false" // no speech model on the test classpath
    }
)
class ScribeRelayApplicationTests {

    @Test
    void contextLoads() {
    }

}
