package com.consullo.standby.reminder;

import com.consullo.standby.core.ReminderSnapshot;
import java.util.Optional;

/**
 * Presentation-layer surface that displays the reminder prompt.
 *
 * <p>Implementations wrap a real window toolkit. All methods are invoked from the scheduler's worker thread
 * and must not block for long. Failures are the presenter's own to recover; the core only asks whether the
 * prompt window exists and whether it is showing.
 *
 * @since 1.0
 */
public interface ReminderPresenter {

  /**
   * Returns true if the prompt window exists (it may be hidden).
   *
   * @return true if present
   */
  boolean promptExists();

  /**
   * Returns true if the prompt window exists and is currently shown.
   *
   * @return true if shown
   */
  boolean promptShowing();

  /**
   * Returns the work area of the primary display, if known.
   *
   * @return work area
   */
  Optional<WorkArea> primaryWorkArea();

  /**
   * Shows the prompt for a newly armed reminder.
   *
   * @param reminder reminder to show
   * @param placement where to show it; empty if no display could be queried
   */
  void showPrompt(ReminderSnapshot reminder, Optional<PromptPlacement> placement);

  /**
   * Re-shows a prompt that was hidden while its reminder is still active.
   *
   * @param reminderId active reminder id
   */
  void reshowPrompt(long reminderId);

  /**
   * Hides the prompt.
   */
  void hidePrompt();
}
