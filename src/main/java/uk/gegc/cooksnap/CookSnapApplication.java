package uk.gegc.cooksnap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CookSnapApplication {

    public static void main(String[] args) {
        SpringApplication.run(CookSnapApplication.class, args);
    }
}
