package com.vidnyan.sigmaeval;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Sigma Eval - evaluation engine for generated SIGMA detection rules.
 * 
 * Runs structural validation, behavioral fingerprinting, semantic scoring,
 * huntability scoring, stability testing and novelty detection.
 */
@SpringBootApplication
public class SigmaEvalApplication {

    public static void main(String[] args) {
        SpringApplication.run(SigmaEvalApplication.class, args);
    }
}
