package de.jwiegmann.chunkupload;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChunkUploadApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChunkUploadApplication.class, args);
    }
}
