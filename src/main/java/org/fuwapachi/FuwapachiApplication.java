package org.fuwapachi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FuwapachiApplication {
    public static void main(String[] args) {
        SpringApplication.run(FuwapachiApplication.class, args);
    }
}
