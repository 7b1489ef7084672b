package com.liftlog.config;

import com.liftlog.contract.WeightUnit;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.HashMap;
import java.util.Map;

/** Typed view of the {@code liftlog.*} settings. */
@ConfigurationProperties(prefix = "liftlog")
public class LiftLogProperties {

    public enum StoreType { MEMORY, JDBC }

    private StoreType store = StoreType.MEMORY;

    /** Unit applied to a set when the payload omits one and the user has no preference. */
    private String defaultUnit = "kg";

    private Map<String, String> userUnits = new HashMap<>();

    /** Zone that decides which day, week, month and year a completion belongs to. */
    private String aggregateZone = "UTC";

    private boolean rebuildOnStartup = true;

    private int schemaVersion = 1;

    /** Classpath resource with the exercise names and aliases the command interpreter knows. */
    private String exerciseLibrary = "exercises.json";

    public WeightUnit preferredUnit(String userId) {
        String configured = userUnits.get(userId);
        return WeightUnit.fromValue(configured != null ? configured : defaultUnit);
    }

    public StoreType getStore() {
        return store;
    }

    public void setStore(StoreType store) {
        this.store = store;
    }

    public String getDefaultUnit() {
        return defaultUnit;
    }

    public void setDefaultUnit(String defaultUnit) {
        this.defaultUnit = defaultUnit;
    }

    public Map<String, String> getUserUnits() {
        return userUnits;
    }

    public void setUserUnits(Map<String, String> userUnits) {
        this.userUnits = userUnits;
    }

    public String getAggregateZone() {
        return aggregateZone;
    }

    public void setAggregateZone(String aggregateZone) {
        this.aggregateZone = aggregateZone;
    }

    public boolean isRebuildOnStartup() {
        return rebuildOnStartup;
    }

    public void setRebuildOnStartup(boolean rebuildOnStartup) {
        this.rebuildOnStartup = rebuildOnStartup;
    }

    public int getSchemaVersion() {
        return schemaVersion;
    }

    public void setSchemaVersion(int schemaVersion) {
        this.schemaVersion = schemaVersion;
    }

    public String getExerciseLibrary() {
        return exerciseLibrary;
    }

    public void setExerciseLibrary(String exerciseLibrary) {
        this.exerciseLibrary = exerciseLibrary;
    }
}
