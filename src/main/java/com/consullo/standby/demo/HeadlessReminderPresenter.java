package com.consullo.standby.demo;

import com.consullo.standby.core.ReminderSnapshot;
import com.consullo.standby.reminder.PromptPlacement;
import com.consullo.standby.reminder.ReminderPresenter;
import com.consullo.standby.reminder.WorkArea;
import java.io.PrintStream;
import java.util.Optional;

/**
 * Console stand-in for the prompt window.
 *
 * <p>The "window" always exists and is showing while a reminder is active. Prompts are printed to the given
 * stream together with the placement a real window would use on a 1920x1040 work area.
 */
final class HeadlessReminderPresenter implements ReminderPresenter {

  private static final WorkArea WORK_AREA = new WorkArea(0, 0, 1920, 1040);

  private final PrintStream out;
  private volatile boolean showing;

  HeadlessReminderPresenter(PrintStream out) {
    this.out = out;
  }

  @Override
  public boolean promptExists() {
    return true;
  }

  @Override
  public boolean promptShowing() {
    return showing;
  }

  @Override
  public Optional<WorkArea> primaryWorkArea() {
    return Optional.of(WORK_AREA);
  }

  @Override
  public void showPrompt(ReminderSnapshot reminder, Optional<PromptPlacement> placement) {
    showing = true;
    out.println("[reminder #" + reminder.getId() + "] " + reminder.getText()
        + placement.map(p -> " @" + p.x() + "," + p.y()).orElse(""));
    out.println("  type 'y' + Enter if you stood up, 'n' + Enter to dismiss");
  }

  @Override
  public void reshowPrompt(long reminderId) {
    showing = true;
    out.println("[reminder #" + reminderId + "] still waiting...");
  }

  @Override
  public void hidePrompt() {
    showing = false;
  }
}
