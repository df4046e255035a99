package org.openphc.patientvault;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PatientVaultApplication {

    public static void main(String[] args) {
        SpringApplication.run(PatientVaultApplication.class, args);
    }
}
