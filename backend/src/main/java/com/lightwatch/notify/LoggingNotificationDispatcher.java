package com.lightwatch.notify;

import com.lightwatch.domain.TransitionNotice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LoggingNotificationDispatcher implements NotificationDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(LoggingNotificationDispatcher.class);

    @Override
    public void dispatch(TransitionNotice notice) {
        logger.info("Channel {} {}:\n{}", notice.deviceId(), notice.direction(), NotificationFormatter.format(notice));
    }
}
