package de.bsommerfeld.recall.core.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import de.bsommerfeld.recall.core.util.StorageUtils;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Recall memory configuration, persisted as {@code config.toml} in the data
 * directory. Unknown keys are ignored so older files keep loading.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class MemoryConfig {

    public static final String APP_NAME = "recall";
    public static final String DATABASE_FILE = "memory.db";

    static final int DEFAULT_DEDUPE_WINDOW_MINUTES = 15;

    @JsonProperty("data-dir")
    private String dataDir = StorageUtils.getAppDataDir(APP_NAME).toString();

    @JsonProperty("max-observation-length")
    private int maxObservationLength = 2000;

    @JsonProperty("max-context-results")
    private int maxContextResults = 20;

    @JsonProperty("max-search-results")
    private int maxSearchResults = 20;

    @JsonProperty("dedupe-window-minutes")
    private int dedupeWindowMinutes = DEFAULT_DEDUPE_WINDOW_MINUTES;

    @JsonProperty("busy-timeout-millis")
    private int busyTimeoutMillis = 5000;

    public String getDataDir() {
        return dataDir;
    }

    public void setDataDir(String dataDir) {
        this.dataDir = dataDir;
    }

    public int getMaxObservationLength() {
        return maxObservationLength;
    }

    public void setMaxObservationLength(int maxObservationLength) {
        this.maxObservationLength = maxObservationLength;
    }

    public int getMaxContextResults() {
        return maxContextResults;
    }

    public void setMaxContextResults(int maxContextResults) {
        this.maxContextResults = maxContextResults;
    }

    public int getMaxSearchResults() {
        return maxSearchResults;
    }

    public void setMaxSearchResults(int maxSearchResults) {
        this.maxSearchResults = maxSearchResults;
    }

    public int getDedupeWindowMinutes() {
        return dedupeWindowMinutes;
    }

    public void setDedupeWindowMinutes(int dedupeWindowMinutes) {
        this.dedupeWindowMinutes = dedupeWindowMinutes;
    }

    public int getBusyTimeoutMillis() {
        return busyTimeoutMillis;
    }

    public void setBusyTimeoutMillis(int busyTimeoutMillis) {
        this.busyTimeoutMillis = busyTimeoutMillis;
    }

    /** Non-positive settings fall back to the 15 minute default. */
    @JsonIgnore
    public Duration dedupeWindow() {
        return Duration.ofMinutes(dedupeWindowMinutes <= 0 ? DEFAULT_DEDUPE_WINDOW_MINUTES : dedupeWindowMinutes);
    }

    @JsonIgnore
    public Path databasePath() {
        return Path.of(dataDir).resolve(DATABASE_FILE);
    }
}
