package com.consullo.standby.core.events;

/**
 * Listener for reminder and analytics notifications.
 *
 * <p>Invoked on the scheduler's worker thread. Implementations must return quickly and must not block
 * on the service that notified them.
 *
 * @since 1.0
 */
public interface StandbyListener {

  /**
   * Called after a state change has been applied.
   *
   * @param event notification
   */
  void onNotification(NotificationEvent event);
}
