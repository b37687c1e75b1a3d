package io.tasktree.core.node.composite;

import io.tasktree.core.result.Result;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// Result aggregation shared by `Parallel` and `Gather`.
final class FanOut {

    private FanOut() {}

    /// `OK` only if every result is `OK`. The data is a list positioned like the
    /// inputs, holding each success's data and `null` for every failure.
    static Result aggregate(List<Result> results) {
        List<Object> data = new ArrayList<>(results.size());
        boolean allOk = true;
        for (Result result : results) {
            if (result.isOk()) {
                data.add(result.getData());
            } else {
                allOk = false;
                data.add(null);
            }
        }
        List<Object> view = Collections.unmodifiableList(data);
        return allOk ? Result.ok(view) : Result.fail(view);
    }
}
