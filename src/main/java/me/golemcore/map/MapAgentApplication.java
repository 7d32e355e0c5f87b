package me.golemcore.map;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MapAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(MapAgentApplication.class, args);
    }

}
