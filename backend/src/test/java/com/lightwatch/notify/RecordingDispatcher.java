package com.lightwatch.notify;

import com.lightwatch.domain.TransitionNotice;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public final class RecordingDispatcher implements NotificationDispatcher {
    private final List<TransitionNotice> notices = new CopyOnWriteArrayList<>();
    private volatile boolean failing;

    public void failing(boolean failing) {
        this.failing = failing;
    }

    public List<TransitionNotice> notices() {
        return notices;
    }

    @Override
    public void dispatch(TransitionNotice notice) {
        if (failing) {
            throw new NotificationDeliveryException("telegram is down");
        }
        notices.add(notice);
    }
}
