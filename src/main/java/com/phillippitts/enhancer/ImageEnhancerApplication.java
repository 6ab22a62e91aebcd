package com.phillippitts.enhancer;

import com.phillippitts.enhancer.config.properties.EnhancerProperties;
import com.phillippitts.enhancer.config.properties.ThreadPoolProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        EnhancerProperties.class,
        ThreadPoolProperties.class
})
@EnableScheduling
public class ImageEnhancerApplication {

    public static void main(String[] args) {
        System.setProperty("java.awt.headless", "true");
        SpringApplication.run(ImageEnhancerApplication.class, args);
    }

}
