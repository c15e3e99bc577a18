package trader.scout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ScoutApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScoutApplication.class, args);
    }
}
