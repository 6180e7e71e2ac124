package org.learningjava.brandlens.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "org.learningjava.brandlens")
public class BrandLensApplication {
    public static void main(String[] args) {
        SpringApplication.run(BrandLensApplication.class, args);
    }
}
