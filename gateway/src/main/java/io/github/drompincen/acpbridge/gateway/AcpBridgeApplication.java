package io.github.drompincen.acpbridge.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.acpbridge")
public class AcpBridgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(AcpBridgeApplication.class, args);
    }
}
