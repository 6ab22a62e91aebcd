package com.phillippitts.enhancer.service.hook;

import com.phillippitts.enhancer.domain.EnhancementRequest;
import com.phillippitts.enhancer.domain.ProcessingResult;
import org.springframework.stereotype.Component;

/** Feeds {@link ProcessingStatistics}: active users and the recent-activity log. */
@Component
public class ActivityLogHook implements EnhancementHook {

    static final String ANONYMOUS = "anonymous";

    private final ProcessingStatistics statistics;

    public ActivityLogHook(ProcessingStatistics statistics) {
        this.statistics = statistics;
    }

    @Override
    public void before(EnhancementRequest request) {
        statistics.markUserActive(request.requester());
    }

    @Override
    public void after(EnhancementRequest request, ProcessingResult result) {
        String requester = request.requester() == null ? ANONYMOUS : request.requester();
        String detail = result.isSuccess() ? result.strategy() : result.failureReason();
        statistics.record(new Activity(result.completedAt(), requester, request.operation(),
                result.isSuccess(), detail));
    }
}
