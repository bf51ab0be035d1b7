package com.zerotrust.access.session;

import com.zerotrust.access.domain.ReevaluationAction;
import com.zerotrust.access.domain.ReevaluationResult;
import lombok.Value;

import java.util.List;

/**
 * Summary of a sweep. {@code failed} counts sessions whose task threw or was
 * rejected by the worker pool; they do not appear in {@code results}.
 */
@Value
public class BatchReevaluationReport {

    int requested;
    int failed;
    List<ReevaluationResult> results;

    public static BatchReevaluationReport empty() {
        return new BatchReevaluationReport(0, 0, List.of());
    }

    public int getCompleted() {
        return results.size();
    }

    public long count(ReevaluationAction action) {
        return results.stream().filter(r -> r.getAction() == action).count();
    }
}
