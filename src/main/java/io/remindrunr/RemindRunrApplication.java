package io.remindrunr;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * RemindRunr: reminders and scheduled prompts on top of JobRunr.
 */
@SpringBootApplication
public class RemindRunrApplication {

    public static void main(String[] args) {
        SpringApplication.run(RemindRunrApplication.class, args);
    }
}
