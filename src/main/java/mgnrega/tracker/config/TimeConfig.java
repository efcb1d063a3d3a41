package mgnrega.tracker.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class TimeConfig {

    @Bean
    public Clock clock(TrackerProperties properties) {
        return Clock.system(properties.getZone());
    }
}
