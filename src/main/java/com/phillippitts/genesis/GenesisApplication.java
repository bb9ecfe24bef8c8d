package com.phillippitts.genesis;

import com.phillippitts.genesis.config.properties.DialogueProperties;
import com.phillippitts.genesis.config.properties.HardwareProperties;
import com.phillippitts.genesis.config.properties.PersonaProperties;
import com.phillippitts.genesis.config.properties.ReasoningProperties;
import com.phillippitts.genesis.config.properties.StorageProperties;
import com.phillippitts.genesis.config.properties.ThreadPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        HardwareProperties.class,
        DialogueProperties.class,
        PersonaProperties.class,
        ReasoningProperties.class,
        StorageProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class GenesisApplication {

    public static void main(String[] args) {
        SpringApplication.run(GenesisApplication.class, args);
    }

}
