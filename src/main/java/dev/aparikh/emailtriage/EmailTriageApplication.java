package dev.aparikh.emailtriage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EmailTriageApplication {

    public static void main(String[] args) {
        SpringApplication.run(EmailTriageApplication.class, args);
    }
}
