package io.github.drompincen.payverify.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.payverify")
@EnableMongoRepositories(basePackages = "io.github.drompincen.payverify.persistence.repository")
public class PayVerifyApplication {

    public static void main(String[] args) {
        SpringApplication.run(PayVerifyApplication.class, args);
    }
}
