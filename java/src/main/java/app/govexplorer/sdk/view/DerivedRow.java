package app.govexplorer.sdk.view;

import java.util.Map;

/**
 * A flat, display-ready row. Rows are recomputed for every query and carry no identity of their own.
 */
public interface DerivedRow {

    /**
     * @return display column names mapped to scalar values, in display order
     */
    Map<String, Object> columns();
}
