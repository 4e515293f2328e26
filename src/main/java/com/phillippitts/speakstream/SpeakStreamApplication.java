package com.phillippitts.speakstream;

import com.phillippitts.speakstream.config.properties.SpeechPipelineProperties;
import com.phillippitts.speakstream.config.properties.ThreadPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        SpeechPipelineProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class SpeakStreamApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpeakStreamApplication.class, args);
    }

}
