package cex.spot.matching;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spot order matching engine
 */
@SpringBootApplication
public class SpotMatchingEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(SpotMatchingEngineApplication.class, args);
    }
}
