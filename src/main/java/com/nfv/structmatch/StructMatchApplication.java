package com.nfv.structmatch;

import com.nfv.structmatch.cli.CommandLineInterface;
import lombok.extern.slf4j.Slf4j;

/**
 * Main application entry point for StructMatch
 * Structural comparison, merge and conflict detection for JSON and YAML documents
 */
@Slf4j
public class StructMatchApplication {

    public static void main(String[] args) {
        int exitCode;
        try {
            CommandLineInterface cli = new CommandLineInterface();
            exitCode = cli.execute(args);
        } catch (Exception e) {
            log.error("Error executing StructMatch", e);
            System.err.println("\n❌ Error: " + e.getMessage());
            exitCode = CommandLineInterface.EXIT_USAGE;
        }
        System.exit(exitCode);
    }
}
