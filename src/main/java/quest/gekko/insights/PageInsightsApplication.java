package quest.gekko.insights;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PageInsightsApplication {

    public static void main(String[] args) {
        SpringApplication.run(PageInsightsApplication.class, args);
    }

}
