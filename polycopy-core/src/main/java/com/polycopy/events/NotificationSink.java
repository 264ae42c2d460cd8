package com.polycopy.events;

import com.polycopy.events.payload.ClassificationEvent;

/**
 * Receives one event per processed fill (alerts, chat messages, audit logs).
 */
public interface NotificationSink {

  void onClassified(ClassificationEvent event);
}
