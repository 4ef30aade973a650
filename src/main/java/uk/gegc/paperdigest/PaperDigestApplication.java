package uk.gegc.paperdigest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PaperDigestApplication {

    public static void main(String[] args) {
        SpringApplication.run(PaperDigestApplication.class, args);
    }
}
