package app.govexplorer.sdk.view;

import java.util.List;

/**
 * Selection made on the history view.
 *
 * @param bundleName   bundle to show; when several share the name the most recently created one is used
 * @param actionNames  action filter, empty for all actions
 * @param projectNames project filter, empty for all projects
 * @param start        optional window start as typed by the user ({@code 2024-01-31} or a full timestamp)
 * @param end          optional window end, same forms as {@code start}
 */
public record HistoryRequest(
    String bundleName,
    List<String> actionNames,
    List<String> projectNames,
    String start,
    String end
) {

    public HistoryRequest {
        actionNames = actionNames == null ? List.of() : List.copyOf(actionNames);
        projectNames = projectNames == null ? List.of() : List.copyOf(projectNames);
    }

    public static HistoryRequest forBundle(String bundleName) {
        return new HistoryRequest(bundleName, List.of(), List.of(), null, null);
    }
}
