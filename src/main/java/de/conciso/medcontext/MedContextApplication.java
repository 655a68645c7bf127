package de.conciso.medcontext;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MedContextApplication {

    public static void main(String[] args) {
        SpringApplication.run(MedContextApplication.class, args);
    }
}
