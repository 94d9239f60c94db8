package app.govexplorer.sdk.view;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One audit trail entry in the bundle history table. {@code rawFieldChanges} backs the optional detail
 * expansion and is not part of {@link #columns()}.
 */
public record HistoryRow(
    String time,
    String action,
    String stage,
    String user,
    String project,
    String bundle,
    String before,
    String after,
    String change,
    String rawFieldChanges
) implements DerivedRow {

    public static final String TIME = "Time (UTC)";
    public static final String ACTION = "Action";
    public static final String STAGE = "Stage";
    public static final String USER = "User";
    public static final String PROJECT = "Project";
    public static final String BUNDLE = "Bundle";
    public static final String BEFORE = "Before";
    public static final String AFTER = "After";
    public static final String CHANGE = "Change";

    @Override
    public Map<String, Object> columns() {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put(TIME, time);
        columns.put(ACTION, action);
        columns.put(STAGE, stage);
        columns.put(USER, user);
        columns.put(PROJECT, project);
        columns.put(BUNDLE, bundle);
        columns.put(BEFORE, before);
        columns.put(AFTER, after);
        columns.put(CHANGE, change);
        return Collections.unmodifiableMap(columns);
    }
}
