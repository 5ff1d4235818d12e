package uk.gegc.puzzlemaker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PuzzleMakerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PuzzleMakerApplication.class, args);
    }
}
