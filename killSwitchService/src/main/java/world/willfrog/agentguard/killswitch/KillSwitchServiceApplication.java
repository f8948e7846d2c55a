package world.willfrog.agentguard.killswitch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KillSwitchServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(KillSwitchServiceApplication.class, args);
    }
}
