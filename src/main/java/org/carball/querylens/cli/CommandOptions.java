package org.carball.querylens.cli;

import lombok.Data;

import java.nio.file.Path;
import java.time.LocalDate;

@Data
public class CommandOptions {

    private String command;
    private Path configFile;
    private String profile;

    // analyze
    private LocalDate date;
    private boolean slowOnly;
    private boolean nPlusOneOnly;
    private int limit;
    private OutputFormat format = OutputFormat.TEXT;

    // clear
    private Integer days;

    public enum OutputFormat {
        TEXT,
        JSON
    }
}
