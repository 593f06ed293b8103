package eu.virtualparadox.documind.application;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@SpringBootApplication(scanBasePackages = "eu.virtualparadox.documind")
@EntityScan(basePackages = "eu.virtualparadox.documind")
@EnableJpaRepositories(basePackages = "eu.virtualparadox.documind")
public class DocumindApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocumindApplication.class, args);
    }
}
