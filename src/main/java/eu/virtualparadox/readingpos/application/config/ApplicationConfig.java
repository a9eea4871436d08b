package eu.virtualparadox.readingpos.application.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "readingpos")
@Getter @Setter
public class ApplicationConfig {

    private Indexing indexing = new Indexing();

    @Getter @Setter
    public static class Indexing {
        /** Worker threads building position indices. */
        private int threads = 1;
        private int awaitTerminationSeconds = 60;
    }
}
