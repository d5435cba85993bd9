package com.osservatorio.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.osservatorio")
@EntityScan("com.osservatorio.data.entity")
@EnableJpaRepositories("com.osservatorio.data.repository")
@EnableScheduling
public class OsservatorioApplication {

    public static void main(String[] args) {
        SpringApplication.run(OsservatorioApplication.class, args);
    }
}
