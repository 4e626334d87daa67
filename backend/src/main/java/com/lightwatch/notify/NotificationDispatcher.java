package com.lightwatch.notify;

import com.lightwatch.domain.TransitionNotice;

public interface NotificationDispatcher {

    void dispatch(TransitionNotice notice);
}
