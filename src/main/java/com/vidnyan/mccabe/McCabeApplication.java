package com.vidnyan.mccabe;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * McCabe cyclomatic complexity checker.
 *
 * Builds a control-flow graph per function and reports functions above a complexity threshold.
 */
@SpringBootApplication
public class McCabeApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(McCabeApplication.class, args)));
    }
}
