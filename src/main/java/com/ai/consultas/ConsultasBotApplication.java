package com.ai.consultas;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "com.ai.consultas")
@EnableJpaRepositories(basePackages = "com.ai.consultas.repository")
@EntityScan(basePackages = "com.ai.consultas.entity")
public class ConsultasBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(ConsultasBotApplication.class, args);
    }
}
