package com.example.dsload.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "app")
public class LoaderProperties {

    // Value of the job_name column of every audit row written by a run
    private String jobName = "csv_load";

    private String sourceDir = "./data";

    private String filePattern = "*.csv";

    // Tried in order; the first one that decodes the whole file wins
    private List<String> encodings = new ArrayList<>(List.of("UTF-8", "windows-1251", "windows-1252", "ISO-8859-1"));

    private String auditTable = "logs.etl_audit";

    private Database database = new Database();

    private Map<String, Spec> loadSpecs = new LinkedHashMap<>();

    @Data
    public static class Database {
        private String type = "postgres";
    }

    @Data
    public static class Spec {
        private String table;
        private String mode = "merge";
        private List<String> primaryKey = new ArrayList<>();
        private List<String> dateColumns = new ArrayList<>();
        private String flagPrefix;
    }
}
