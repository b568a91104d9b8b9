package ai.toolrelay.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ToolRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(ToolRelayApplication.class, args);
    }
}
