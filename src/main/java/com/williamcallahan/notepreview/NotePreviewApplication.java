package com.williamcallahan.notepreview;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class NotePreviewApplication {

    public static void main(String[] args) {
        SpringApplication.run(NotePreviewApplication.class, args);
    }

}
