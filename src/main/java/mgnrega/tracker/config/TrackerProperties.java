package mgnrega.tracker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "mgnrega")
@Data
public class TrackerProperties {

    // Zone used to work out the reporting month
    private ZoneId zone = ZoneId.of("Asia/Kolkata");

    private State state = new State();
    private Seed seed = new Seed();
    private Sync sync = new Sync();
    private Geocoding geocoding = new Geocoding();
    private Cors cors = new Cors();

    @Data
    public static class State {
        private String code = "MH";
        private String name = "महाराष्ट्र (Maharashtra)";
    }

    @Data
    public static class Seed {
        private boolean enabled = true;
        private int generationThreads = 4;
    }

    @Data
    public static class Sync {
        private String cron = "0 0 2 * * *";
    }

    @Data
    public static class Geocoding {
        private String baseUrl = "https://nominatim.openstreetmap.org";
        private String userAgent = "MGNREGA-Tracker/1.0";
        private Duration timeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    }
}
