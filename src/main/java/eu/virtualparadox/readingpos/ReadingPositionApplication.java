package eu.virtualparadox.readingpos;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ReadingPositionApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReadingPositionApplication.class, args);
    }
}
