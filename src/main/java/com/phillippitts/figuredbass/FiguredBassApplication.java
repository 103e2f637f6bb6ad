package com.phillippitts.figuredbass;

import com.phillippitts.figuredbass.config.properties.DemoProperties;
import com.phillippitts.figuredbass.config.properties.EngineProperties;
import com.phillippitts.figuredbass.config.properties.RealizerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        RealizerProperties.class,
        EngineProperties.class,
        DemoProperties.class
})
public class FiguredBassApplication {

    public static void main(String[] args) {
        SpringApplication.run(FiguredBassApplication.class, args);
    }

}
