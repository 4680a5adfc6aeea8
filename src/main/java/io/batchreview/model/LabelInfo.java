package io.batchreview.model;

import java.util.List;

/**
 * A voting label the reviewer may apply, with its permitted values (e.g. "-2" .. "+2").
 */
public record LabelInfo(
        String name,
        List<LabelValue> values
) {
    public LabelInfo {
        values = values == null ? List.of() : List.copyOf(values);
    }

    public static LabelInfo defaultCodeReview() {
        return new LabelInfo("Code-Review", List.of(
                new LabelValue("-2", "This shall not be merged"),
                new LabelValue("-1", "I would prefer this is not merged as is"),
                new LabelValue(" 0", "No score"),
                new LabelValue("+1", "Looks good to me, but someone else must approve"),
                new LabelValue("+2", "Looks good to me, approved")
        ));
    }

    public record LabelValue(String score, String description) {
    }
}
