package com.phillippitts.huevoice;

import com.phillippitts.huevoice.config.properties.AudioCaptureProperties;
import com.phillippitts.huevoice.config.properties.BridgeProperties;
import com.phillippitts.huevoice.config.properties.CommandAliasProperties;
import com.phillippitts.huevoice.config.properties.DispatcherProperties;
import com.phillippitts.huevoice.config.properties.FeedbackProperties;
import com.phillippitts.huevoice.config.properties.PipelineProperties;
import com.phillippitts.huevoice.config.properties.RecognitionProperties;
import com.phillippitts.huevoice.config.properties.SupervisorProperties;
import com.phillippitts.huevoice.config.properties.WakeWordProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.Arrays;
import java.util.Map;

@SpringBootApplication
@EnableConfigurationProperties({
        BridgeProperties.class,
        WakeWordProperties.class,
        AudioCaptureProperties.class,
        RecognitionProperties.class,
        DispatcherProperties.class,
        CommandAliasProperties.class,
        SupervisorProperties.class,
        PipelineProperties.class,
        FeedbackProperties.class
})
@EnableScheduling
public class HueVoiceApplication {

    static final String DEBUG_FLAG = "--debug";

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(HueVoiceApplication.class);
        app.setDefaultProperties(defaultProperties(args));
        app.run(args);
    }

    /** {@code --debug} turns on DEBUG logging for the application's own packages. */
    static Map<String, Object> defaultProperties(String[] args) {
        if (Arrays.asList(args).contains(DEBUG_FLAG)) {
            return Map.of("logging.level.com.phillippitts.huevoice", "DEBUG");
        }
        return Map.of();
    }
}
