package com.phillippitts.avifconverter;

import com.phillippitts.avifconverter.config.ConcurrencyProperties;
import com.phillippitts.avifconverter.config.ConverterProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        ConverterProperties.class,
        ConcurrencyProperties.class
})
public class AvifConverterApplication {

    public static void main(String[] args) {
        SpringApplication.run(AvifConverterApplication.class, args);
    }

}
