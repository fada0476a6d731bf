package dev.aparikh.lightsearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LightSearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(LightSearchApplication.class, args);
    }

}
